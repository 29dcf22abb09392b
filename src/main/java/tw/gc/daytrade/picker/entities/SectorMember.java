package tw.gc.daytrade.picker.entities;

/**
 * An eligible stock inside a strong sector on the evaluation date, with its
 * features and its sector-relative z-scores.
 */
public record SectorMember(
        String sectorId,
        DailyBar bar,
        DailyFeatures features,
        Double pctChangeZ,
        Double volumeRatioZ
) {

    public String stockId() {
        return bar.stockId();
    }

    public Double pctChange() {
        return bar.pctChange();
    }
}
