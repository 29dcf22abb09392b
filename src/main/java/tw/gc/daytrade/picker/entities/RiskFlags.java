package tw.gc.daytrade.picker.entities;

import java.util.Objects;

/**
 * Optional per-stock trading restrictions. A {@code null} flag means the
 * restriction is not known to apply.
 */
public record RiskFlags(
        String stockId,
        Boolean disposed,
        Boolean fullMargin,
        Double liquidityScore,
        Boolean blacklist
) {

    public RiskFlags {
        Objects.requireNonNull(stockId, "stockId");
    }

    public boolean restricted() {
        return Boolean.TRUE.equals(disposed)
                || Boolean.TRUE.equals(fullMargin)
                || Boolean.TRUE.equals(blacklist);
    }
}
