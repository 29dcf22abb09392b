package tw.gc.daytrade.picker.entities;

/**
 * A ranked leader. {@code rank} starts at 1 within its sector.
 */
public record LeaderPick(String sectorId, String stockId, double score, int rank, boolean fallback) {
}
