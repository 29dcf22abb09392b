package tw.gc.daytrade.picker.entities;

import java.time.LocalDate;

/**
 * Rolling-window features for one stock on one trade date.
 *
 * <p>Every field is {@code null} until its window is full, and
 * {@code intradayPosition} is also {@code null} on a day with no range.
 */
public record DailyFeatures(
        LocalDate tradeDate,
        String stockId,
        Double ma5,
        Double ma10,
        Double ma20,
        Double volume20dAvg,
        Double volumeRatio20d,
        Double high20d,
        Boolean is20dHigh,
        Double distanceTo20dHigh,
        Double intradayPosition
) {

    public static DailyFeatures undefined(LocalDate tradeDate, String stockId) {
        return new DailyFeatures(tradeDate, stockId, null, null, null, null, null, null, null, null, null);
    }
}
