package tw.gc.daytrade.picker.indicators;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Group-wise z-scoring shared by the sector, leader and follower stages.
 *
 * <p>Mean and sample standard deviation skip {@code null} values. When the
 * standard deviation is zero or undefined (fewer than two values) every
 * member of the group gets 0.0, including members whose input was missing.
 * Otherwise a missing input stays {@code null}.
 */
public final class CrossSectionalStandardizer {

    private CrossSectionalStandardizer() {
        throw new AssertionError("Utility class");
    }

    /**
     * Z-scores of {@code values}, aligned by index.
     */
    public static List<Double> zScores(List<Double> values) {
        Objects.requireNonNull(values, "values");
        double sum = 0.0;
        int n = 0;
        for (Double v : values) {
            if (isPresent(v)) {
                sum += v;
                n++;
            }
        }
        if (n < 2) {
            return new ArrayList<>(Collections.nCopies(values.size(), 0.0));
        }
        double mean = sum / n;
        double sq = 0.0;
        for (Double v : values) {
            if (isPresent(v)) {
                double d = v - mean;
                sq += d * d;
            }
        }
        double std = Math.sqrt(sq / (n - 1));
        if (!Double.isFinite(std) || std == 0.0) {
            return new ArrayList<>(Collections.nCopies(values.size(), 0.0));
        }
        List<Double> out = new ArrayList<>(values.size());
        for (Double v : values) {
            out.add(isPresent(v) ? (v - mean) / std : null);
        }
        return out;
    }

    /**
     * Standardize {@code value} within each group of {@code rows} sharing the
     * same {@code groupKey}. The result is aligned with {@code rows} by index.
     */
    public static <T, K> List<Double> standardizeByGroup(List<T> rows,
                                                         Function<T, K> groupKey,
                                                         Function<T, Double> value) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(groupKey, "groupKey");
        Objects.requireNonNull(value, "value");

        Map<K, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            groups.computeIfAbsent(groupKey.apply(rows.get(i)), k -> new ArrayList<>()).add(i);
        }

        List<Double> out = new ArrayList<>(Collections.nCopies(rows.size(), (Double) null));
        for (List<Integer> indices : groups.values()) {
            List<Double> groupValues = new ArrayList<>(indices.size());
            for (int idx : indices) {
                groupValues.add(value.apply(rows.get(idx)));
            }
            List<Double> z = zScores(groupValues);
            for (int j = 0; j < indices.size(); j++) {
                out.set(indices.get(j), z.get(j));
            }
        }
        return out;
    }

    private static boolean isPresent(Double v) {
        return v != null && Double.isFinite(v);
    }
}
