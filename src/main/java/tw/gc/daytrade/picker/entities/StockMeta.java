package tw.gc.daytrade.picker.entities;

import java.util.Objects;

/**
 * Static stock metadata. {@code sectorId} is whatever grouping key the caller
 * chose (industry code or thematic tag).
 */
public record StockMeta(String stockId, String stockName, String market, String sectorId) {

    public static final String UNKNOWN_SECTOR = "UNKNOWN";

    public StockMeta {
        Objects.requireNonNull(stockId, "stockId");
        if (sectorId == null || sectorId.isBlank()) {
            sectorId = UNKNOWN_SECTOR;
        }
    }
}
