package tw.gc.daytrade.picker.indicators;

/**
 * Threshold checks over optional values. A missing or non-finite value never
 * satisfies a threshold on either side, so a row lacking the data a rule needs
 * is always filtered out.
 */
public final class FailClosed {

    private FailClosed() {
        throw new AssertionError("Utility class");
    }

    public static boolean atLeast(Double value, double min) {
        return isPresent(value) && value >= min;
    }

    public static boolean atMost(Double value, double max) {
        return isPresent(value) && value <= max;
    }

    public static boolean within(Double value, double min, double max) {
        return atLeast(value, min) && atMost(value, max);
    }

    /**
     * {@code value > reference}; false when the reference is missing.
     */
    public static boolean above(double value, Double reference) {
        return Double.isFinite(value) && isPresent(reference) && value > reference;
    }

    public static boolean isTrue(Boolean flag) {
        return Boolean.TRUE.equals(flag);
    }

    /**
     * Score contribution of an optional term; a missing term adds nothing.
     */
    public static double orZero(Double value) {
        return isPresent(value) ? value : 0.0;
    }

    public static boolean isPresent(Double value) {
        return value != null && Double.isFinite(value);
    }
}
