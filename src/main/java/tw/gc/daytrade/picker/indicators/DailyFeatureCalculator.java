package tw.gc.daytrade.picker.indicators;

import tw.gc.daytrade.picker.entities.DailyBar;
import tw.gc.daytrade.picker.entities.DailyFeatures;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Utility class for the per-stock rolling-window features.
 *
 * <p>Windows count rows, not calendar days: a stock's missing sessions are
 * simply absent and the window reaches further back.
 */
public final class DailyFeatureCalculator {

    public static final int SHORT_WINDOW = 5;
    public static final int MID_WINDOW = 10;
    public static final int LONG_WINDOW = 20;

    private DailyFeatureCalculator() {
        throw new AssertionError("Utility class");
    }

    /**
     * Compute features for every (date, stock) row in {@code bars}.
     *
     * @return features ordered by stock id, then trade date
     */
    public static List<DailyFeatures> compute(List<DailyBar> bars) {
        Objects.requireNonNull(bars, "bars");
        Map<String, List<DailyBar>> byStock = new LinkedHashMap<>();
        List<DailyBar> sorted = new ArrayList<>(bars);
        sorted.sort(Comparator.comparing(DailyBar::stockId).thenComparing(DailyBar::tradeDate));
        for (DailyBar bar : sorted) {
            byStock.computeIfAbsent(bar.stockId(), k -> new ArrayList<>()).add(bar);
        }

        List<DailyFeatures> out = new ArrayList<>(sorted.size());
        for (List<DailyBar> series : byStock.values()) {
            out.addAll(computeSeries(series));
        }
        return out;
    }

    /**
     * Features for a single stock's date-ordered series.
     */
    public static List<DailyFeatures> computeSeries(List<DailyBar> series) {
        Objects.requireNonNull(series, "series");
        List<Double> closes = new ArrayList<>(series.size());
        List<Double> highs = new ArrayList<>(series.size());
        List<Double> volumes = new ArrayList<>(series.size());
        List<DailyFeatures> out = new ArrayList<>(series.size());

        for (DailyBar bar : series) {
            closes.add(bar.close());
            highs.add(bar.high());
            volumes.add((double) bar.volume());

            Double ma5 = simpleMovingAverage(closes, SHORT_WINDOW).orElse(null);
            Double ma10 = simpleMovingAverage(closes, MID_WINDOW).orElse(null);
            Double ma20 = simpleMovingAverage(closes, LONG_WINDOW).orElse(null);
            Double volAvg = simpleMovingAverage(volumes, LONG_WINDOW).orElse(null);
            Double volRatio = ratio((double) bar.volume(), volAvg).orElse(null);
            Double high20 = rollingMax(highs, LONG_WINDOW).orElse(null);
            Boolean isHigh = high20 == null ? null : bar.close() >= high20;
            Double distance = high20 == null ? null : ratio(high20 - bar.close(), high20).orElse(null);

            out.add(new DailyFeatures(
                    bar.tradeDate(),
                    bar.stockId(),
                    ma5,
                    ma10,
                    ma20,
                    volAvg,
                    volRatio,
                    high20,
                    isHigh,
                    distance,
                    intradayPosition(bar).orElse(null)
            ));
        }
        return out;
    }

    public static Optional<Double> simpleMovingAverage(List<Double> values, int period) {
        Objects.requireNonNull(values, "values");
        validatePositive(period, "period");
        if (values.size() < period) {
            return Optional.empty();
        }
        double sum = 0.0;
        for (int i = values.size() - period; i < values.size(); i++) {
            sum += values.get(i);
        }
        return finite(sum / period);
    }

    public static Optional<Double> rollingMax(List<Double> values, int period) {
        Objects.requireNonNull(values, "values");
        validatePositive(period, "period");
        if (values.size() < period) {
            return Optional.empty();
        }
        double max = Double.NEGATIVE_INFINITY;
        for (int i = values.size() - period; i < values.size(); i++) {
            max = Math.max(max, values.get(i));
        }
        return finite(max);
    }

    /**
     * (close - low) / (high - low); empty on a flat or limit-locked day.
     */
    public static Optional<Double> intradayPosition(DailyBar bar) {
        double range = bar.high() - bar.low();
        if (range == 0.0) {
            return Optional.empty();
        }
        return finite((bar.close() - bar.low()) / range);
    }

    private static Optional<Double> ratio(double numerator, Double denominator) {
        if (denominator == null || denominator == 0.0) {
            return Optional.empty();
        }
        return finite(numerator / denominator);
    }

    private static Optional<Double> finite(double value) {
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }

    private static void validatePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
