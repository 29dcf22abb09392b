package tw.gc.daytrade.picker.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.daytrade.picker.config.FallbackPolicy;
import tw.gc.daytrade.picker.config.PickerConfig;
import tw.gc.daytrade.picker.config.PickerConfig.SectorConfig;
import tw.gc.daytrade.picker.entities.DailyBar;
import tw.gc.daytrade.picker.entities.SectorDailyAggregate;
import tw.gc.daytrade.picker.entities.StockMeta;
import tw.gc.daytrade.picker.entities.StrongSector;
import tw.gc.daytrade.picker.testutil.MarketDataTestFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SectorMomentumService")
class SectorMomentumServiceTest {

    private static final double EPS = 1e-9;

    private SectorMomentumService service;
    private SectorConfig sectorConfig;

    @BeforeEach
    void setUp() {
        service = new SectorMomentumService();
        sectorConfig = PickerConfig.defaults().sector();
    }

    private static Map<String, StockMeta> meta(String... idSectorPairs) {
        Map<String, StockMeta> out = new LinkedHashMap<>();
        for (int i = 0; i < idSectorPairs.length; i += 2) {
            out.put(idSectorPairs[i], new StockMeta(idSectorPairs[i], idSectorPairs[i], "TWSE", idSectorPairs[i + 1]));
        }
        return out;
    }

    private static DailyBar bar(LocalDate date, String stockId, Double pct) {
        return MarketDataTestFactory.bar(date, stockId, 100.0, pct, 1000);
    }

    private static SectorDailyAggregate aggregate(LocalDate date, String sectorId, double avg, double upRatio, Double momentumZ) {
        return new SectorDailyAggregate(date, sectorId, 10, avg, avg, upRatio, 0, momentumZ, momentumZ);
    }

    @Nested
    @DisplayName("aggregate")
    class Aggregate {

        @Test
        @DisplayName("computes mean, median, up ratio and count of 3% movers")
        void dailyStatistics() {
            LocalDate d = MarketDataTestFactory.START;
            var stocks = meta("1", "X", "2", "X", "3", "X", "4", "X");
            var bars = List.of(bar(d, "1", -1.0), bar(d, "2", 0.0), bar(d, "3", 3.0), bar(d, "4", 6.0));

            List<SectorDailyAggregate> rows = service.aggregate(bars, stocks, 1);

            assertThat(rows).hasSize(1);
            SectorDailyAggregate x = rows.get(0);
            assertThat(x.stockCount()).isEqualTo(4);
            assertThat(x.avgPctChange()).isCloseTo(2.0, within(EPS));
            assertThat(x.medianPctChange()).isCloseTo(1.5, within(EPS));
            assertThat(x.upRatio()).isCloseTo(0.5, within(EPS));
            assertThat(x.numUp3()).isEqualTo(2);
            assertThat(x.momentum()).isCloseTo(2.0, within(EPS));
        }

        @Test
        @DisplayName("stocks without metadata or pct_change do not contribute")
        void skipsUnknownAndMissing() {
            LocalDate d = MarketDataTestFactory.START;
            var stocks = meta("1", "X", "2", "X");
            var bars = List.of(bar(d, "1", 2.0), bar(d, "2", null), bar(d, "9", 50.0));

            List<SectorDailyAggregate> rows = service.aggregate(bars, stocks, 1);

            assertThat(rows).singleElement().satisfies(x -> {
                assertThat(x.stockCount()).isEqualTo(1);
                assertThat(x.avgPctChange()).isCloseTo(2.0, within(EPS));
            });
        }

        @Test
        @DisplayName("momentum is undefined until the lookback window is full")
        void momentumNeedsFullWindow() {
            List<LocalDate> days = MarketDataTestFactory.tradingDays(4);
            var stocks = meta("1", "X");
            List<DailyBar> bars = new ArrayList<>();
            double[] pct = {1.0, 2.0, 3.0, 4.0};
            for (int i = 0; i < days.size(); i++) {
                bars.add(bar(days.get(i), "1", pct[i]));
            }

            List<SectorDailyAggregate> rows = service.aggregate(bars, stocks, 3);

            assertThat(rows.get(0).momentum()).isNull();
            assertThat(rows.get(1).momentum()).isNull();
            assertThat(rows.get(2).momentum()).isCloseTo(2.0, within(EPS));
            assertThat(rows.get(3).momentum()).isCloseTo(3.0, within(EPS));
        }

        @Test
        @DisplayName("momentum z is zero when every sector has the same momentum")
        void momentumZeroVariance() {
            LocalDate d = MarketDataTestFactory.START;
            var stocks = meta("1", "X", "2", "Y", "3", "Z");
            var bars = List.of(bar(d, "1", 2.0), bar(d, "2", 2.0), bar(d, "3", 2.0));

            List<SectorDailyAggregate> rows = service.aggregate(bars, stocks, 1);

            assertThat(rows).extracting(SectorDailyAggregate::momentumZ).containsExactly(0.0, 0.0, 0.0);
        }

        @Test
        @DisplayName("momentum z is taken across sectors on the same date")
        void momentumZAcrossSectors() {
            LocalDate d = MarketDataTestFactory.START;
            var stocks = meta("1", "X", "2", "Y", "3", "Z");
            var bars = List.of(bar(d, "1", 1.0), bar(d, "2", 2.0), bar(d, "3", 3.0));

            List<SectorDailyAggregate> rows = service.aggregate(bars, stocks, 1);

            assertThat(rows).extracting(SectorDailyAggregate::sectorId).containsExactly("X", "Y", "Z");
            assertThat(rows.get(0).momentumZ()).isCloseTo(-1.0, within(EPS));
            assertThat(rows.get(2).momentumZ()).isCloseTo(1.0, within(EPS));
        }

        @Test
        @DisplayName("non-positive lookback is rejected")
        void rejectsLookback() {
            assertThatThrownBy(() -> service.aggregate(List.of(), Map.of(), 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("selectStrongSectors")
    class Select {

        private final LocalDate d = MarketDataTestFactory.START;

        @Test
        @DisplayName("keeps only sectors passing every threshold, best score first")
        void thresholds() {
            var config = sectorConfig.withThresholds(1.0, 0.6, 0.5);
            var aggregates = List.of(
                    aggregate(d, "A", 2.0, 0.7, 0.6),
                    aggregate(d, "B", 3.0, 0.9, 1.2),
                    aggregate(d, "C", 3.0, 0.5, 1.2),
                    aggregate(d, "D", 3.0, 0.9, null),
                    aggregate(d.plusDays(1), "E", 9.0, 1.0, 3.0));

            List<StrongSector> strong = service.selectStrongSectors(d, aggregates, config, FallbackPolicy.STRICT);

            assertThat(strong).extracting(StrongSector::sectorId).containsExactly("B", "A");
            assertThat(strong).noneMatch(StrongSector::fallback);
            assertThat(strong.get(0).sectorScore()).isGreaterThan(strong.get(1).sectorScore());
        }

        @Test
        @DisplayName("STRICT returns nothing when no sector passes")
        void strictEmpty() {
            var config = sectorConfig.withThresholds(100.0, 1.0, 100.0);
            var aggregates = List.of(aggregate(d, "A", 2.0, 0.7, 0.6), aggregate(d, "B", 1.0, 0.5, -0.6));

            assertThat(service.selectStrongSectors(d, aggregates, config, FallbackPolicy.STRICT)).isEmpty();
            assertThat(service.selectStrongSectors(d, aggregates, config, FallbackPolicy.LEADER_PERCENTILE)).isEmpty();
        }

        @Test
        @DisplayName("PERMISSIVE falls back to the top-K sectors by score")
        void permissiveTopK() {
            var config = new SectorConfig(5, 100.0, 1.0, 100.0, sectorConfig.weights(), 2);
            var aggregates = List.of(
                    aggregate(d, "A", 2.0, 0.7, 0.6),
                    aggregate(d, "B", 1.0, 0.5, -1.2),
                    aggregate(d, "C", 4.0, 0.9, 0.6));

            List<StrongSector> strong = service.selectStrongSectors(d, aggregates, config, FallbackPolicy.PERMISSIVE);

            assertThat(strong).extracting(StrongSector::sectorId).containsExactly("C", "A");
            assertThat(strong).allMatch(StrongSector::fallback);
        }

        @Test
        @DisplayName("no aggregates on the date gives no sectors")
        void noRows() {
            assertThat(service.selectStrongSectors(d, List.of(), sectorConfig, FallbackPolicy.PERMISSIVE)).isEmpty();
        }
    }
}
