package tw.gc.daytrade.picker.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import tw.gc.daytrade.picker.AppConstants;
import tw.gc.daytrade.picker.config.PickerProperties;
import tw.gc.daytrade.picker.entities.CandidateRow;
import tw.gc.daytrade.picker.entities.MarketHistory;
import tw.gc.daytrade.picker.entities.SelectionResult;
import tw.gc.daytrade.picker.services.DemoMarketDataGenerator;
import tw.gc.daytrade.picker.services.SectorMomentumPicker;

import java.time.LocalDate;
import java.util.List;

/**
 * Dry run on a synthetic market, enabled with {@code picker.demo.enabled=true}.
 * Logs the top rows as JSON.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "picker.demo", name = "enabled", havingValue = "true")
public class DemoRunner implements CommandLineRunner {

    static final int TOP_ROWS = 10;

    private final PickerProperties properties;
    private final DemoMarketDataGenerator generator;
    private final SectorMomentumPicker picker;
    private final ObjectMapper objectMapper;

    @Override
    public void run(String... args) throws JsonProcessingException {
        PickerProperties.Demo demo = properties.getDemo();
        LocalDate asOf = demo.getAsOf() == null || demo.getAsOf().isBlank()
                ? LocalDate.now(AppConstants.TAIPEI_ZONE)
                : LocalDate.parse(demo.getAsOf());

        MarketHistory history = generator.generate(
                asOf, demo.getNumStocks(), demo.getNumSectors(), demo.getHistoryDays(), demo.getSeed());
        LocalDate tradeDate = history.tradingDates().get(history.tradingDates().size() - 1);

        SelectionResult result = picker.run(tradeDate, history, null);
        List<CandidateRow> top = result.candidates().subList(0, Math.min(TOP_ROWS, result.candidates().size()));

        log.info("🎯 Demo {} ({} policy, sectors by {}): {} candidates, strong sectors {}",
                tradeDate, properties.getFallbackPolicy(), properties.getSectorMode().column(),
                result.candidates().size(), result.strongSectors().stream().map(s -> s.sectorId()).toList());
        log.info("Columns: {}", result.columns());
        for (CandidateRow row : top) {
            log.info("{}", objectMapper.writeValueAsString(row));
        }
    }
}
