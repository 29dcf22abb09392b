package tw.gc.daytrade.picker.entities;

import lombok.Builder;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One stock's daily market snapshot row as published by the exchange.
 *
 * <p>{@code pctChange} is in percent (3.0 = +3%). {@code pctChange} and
 * {@code turnover} may be {@code null} when the source row lacks them.
 */
@Builder(toBuilder = true)
public record DailyBar(
        LocalDate tradeDate,
        String stockId,
        double open,
        double high,
        double low,
        double close,
        Double pctChange,
        long volume,
        Double turnover,
        boolean limitUp,
        boolean limitDown
) {

    public DailyBar {
        Objects.requireNonNull(tradeDate, "tradeDate");
        Objects.requireNonNull(stockId, "stockId");
    }
}
