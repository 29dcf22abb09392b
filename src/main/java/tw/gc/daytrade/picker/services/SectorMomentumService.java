package tw.gc.daytrade.picker.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.daytrade.picker.config.FallbackPolicy;
import tw.gc.daytrade.picker.config.PickerConfig.SectorConfig;
import tw.gc.daytrade.picker.config.PickerConfig.SectorWeights;
import tw.gc.daytrade.picker.entities.DailyBar;
import tw.gc.daytrade.picker.entities.SectorDailyAggregate;
import tw.gc.daytrade.picker.entities.StockMeta;
import tw.gc.daytrade.picker.entities.StrongSector;
import tw.gc.daytrade.picker.indicators.CrossSectionalStandardizer;
import tw.gc.daytrade.picker.indicators.FailClosed;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * SectorMomentumService
 *
 * Aggregates the eligible universe into per-sector daily statistics, tracks
 * sector momentum over a trailing window, and picks the strong sectors for a
 * date.
 */
@Service
@Slf4j
public class SectorMomentumService {

    private static final double UP_3_PCT = 3.0;

    /**
     * Build sector aggregates for every date in {@code eligibleBars}.
     *
     * <p>Bars for stocks absent from {@code stocks}, or without a
     * pct_change, do not contribute. Momentum is the mean of the sector's
     * {@code avgPctChange} over its last {@code lookback} aggregate rows and
     * stays {@code null} until that many rows exist; its z-score is taken
     * across sectors on the same date.
     *
     * @return aggregates ordered by trade date, then sector id
     */
    public List<SectorDailyAggregate> aggregate(List<DailyBar> eligibleBars, Map<String, StockMeta> stocks, int lookback) {
        if (lookback <= 0) {
            throw new IllegalArgumentException("lookback must be positive");
        }

        Map<String, Map<LocalDate, List<Double>>> bySector = new TreeMap<>();
        for (DailyBar bar : eligibleBars) {
            StockMeta meta = stocks.get(bar.stockId());
            if (meta == null || !FailClosed.isPresent(bar.pctChange())) {
                continue;
            }
            bySector.computeIfAbsent(meta.sectorId(), k -> new TreeMap<>())
                    .computeIfAbsent(bar.tradeDate(), k -> new ArrayList<>())
                    .add(bar.pctChange());
        }

        List<SectorDailyAggregate> rows = new ArrayList<>();
        for (Map.Entry<String, Map<LocalDate, List<Double>>> sector : bySector.entrySet()) {
            List<Double> avgSeries = new ArrayList<>();
            for (Map.Entry<LocalDate, List<Double>> day : sector.getValue().entrySet()) {
                List<Double> pct = day.getValue();
                double avg = mean(pct);
                avgSeries.add(avg);
                Double momentum = null;
                if (avgSeries.size() >= lookback) {
                    momentum = mean(avgSeries.subList(avgSeries.size() - lookback, avgSeries.size()));
                }
                rows.add(new SectorDailyAggregate(
                        day.getKey(),
                        sector.getKey(),
                        pct.size(),
                        avg,
                        median(pct),
                        pct.stream().filter(v -> v > 0).count() / (double) pct.size(),
                        (int) pct.stream().filter(v -> v >= UP_3_PCT).count(),
                        momentum,
                        null
                ));
            }
        }

        rows.sort(Comparator.comparing(SectorDailyAggregate::tradeDate).thenComparing(SectorDailyAggregate::sectorId));
        List<Double> z = CrossSectionalStandardizer.standardizeByGroup(
                rows, SectorDailyAggregate::tradeDate, SectorDailyAggregate::momentum);
        List<SectorDailyAggregate> out = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            out.add(rows.get(i).withMomentumZ(z.get(i)));
        }
        return out;
    }

    /**
     * Composite score for every sector on one date, in input order.
     *
     * <p>score = w1 * z(avgPctChange) + w2 * momentumZ + w3 * upRatio, with a
     * missing momentum z contributing nothing.
     */
    public List<StrongSector> scoreSectors(List<SectorDailyAggregate> sameDay, SectorWeights weights) {
        List<Double> avgZ = CrossSectionalStandardizer.zScores(
                sameDay.stream().map(s -> (Double) s.avgPctChange()).toList());
        List<StrongSector> scored = new ArrayList<>(sameDay.size());
        for (int i = 0; i < sameDay.size(); i++) {
            SectorDailyAggregate s = sameDay.get(i);
            double score = weights.avgPctChangeZ() * FailClosed.orZero(avgZ.get(i))
                    + weights.momentumZ() * FailClosed.orZero(s.momentumZ())
                    + weights.upRatio() * s.upRatio();
            scored.add(new StrongSector(s.sectorId(), score, s.avgPctChange(), s.upRatio(), s.momentumZ(), false));
        }
        return scored;
    }

    /**
     * Sectors passing every threshold on {@code date}. If none pass and the
     * policy allows it, the top-K sectors by composite score instead.
     *
     * @return strong sectors ordered by composite score, descending
     */
    public List<StrongSector> selectStrongSectors(LocalDate date,
                                                  List<SectorDailyAggregate> aggregates,
                                                  SectorConfig config,
                                                  FallbackPolicy policy) {
        List<SectorDailyAggregate> sameDay = aggregates.stream()
                .filter(a -> a.tradeDate().equals(date))
                .toList();
        List<StrongSector> scored = scoreSectors(sameDay, config.weights());

        List<StrongSector> strong = new ArrayList<>();
        for (StrongSector s : scored) {
            if (FailClosed.atLeast(s.avgPctChange(), config.threshAvgPct())
                    && FailClosed.atLeast(s.upRatio(), config.threshUpRatio())
                    && FailClosed.atLeast(s.momentumZ(), config.threshMomentumZ())) {
                strong.add(s);
            }
        }

        Comparator<StrongSector> byScore = Comparator.comparingDouble(StrongSector::sectorScore).reversed();
        if (strong.isEmpty() && policy.allowsSectorTopK() && !scored.isEmpty()) {
            List<StrongSector> ranked = new ArrayList<>(scored);
            ranked.sort(byScore);
            List<StrongSector> fallback = new ArrayList<>();
            for (StrongSector s : ranked.subList(0, Math.min(config.fallbackTopK(), ranked.size()))) {
                fallback.add(new StrongSector(s.sectorId(), s.sectorScore(), s.avgPctChange(), s.upRatio(), s.momentumZ(), true));
            }
            log.warn("⚠️ No sector passed thresholds on {}; {} fallback keeps top {} by score",
                    date, policy, fallback.size());
            return fallback;
        }

        strong.sort(byScore);
        return strong;
    }

    private static double mean(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    private static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Double::compare);
        int n = sorted.size();
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }
}
