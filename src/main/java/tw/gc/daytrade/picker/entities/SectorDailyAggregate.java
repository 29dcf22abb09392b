package tw.gc.daytrade.picker.entities;

import java.time.LocalDate;

/**
 * Cross-sectional statistics of one sector on one trade date, computed over
 * the eligible universe only.
 *
 * @param numUp3     stocks with pct_change of at least 3%
 * @param momentum   mean of {@code avgPctChange} over the trailing lookback, {@code null} until full
 * @param momentumZ  cross-sectional z-score of {@code momentum} across sectors on the same date
 */
public record SectorDailyAggregate(
        LocalDate tradeDate,
        String sectorId,
        int stockCount,
        double avgPctChange,
        double medianPctChange,
        double upRatio,
        int numUp3,
        Double momentum,
        Double momentumZ
) {

    public SectorDailyAggregate withMomentumZ(Double value) {
        return new SectorDailyAggregate(tradeDate, sectorId, stockCount, avgPctChange, medianPctChange, upRatio, numUp3, momentum, value);
    }
}
