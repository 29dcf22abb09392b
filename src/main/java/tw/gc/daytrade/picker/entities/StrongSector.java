package tw.gc.daytrade.picker.entities;

/**
 * A sector selected for leader/follower search on the evaluation date.
 *
 * @param fallback true when the sector came from the top-K fallback rather than the thresholds
 */
public record StrongSector(
        String sectorId,
        double sectorScore,
        double avgPctChange,
        double upRatio,
        Double momentumZ,
        boolean fallback
) {
}
