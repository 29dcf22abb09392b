package tw.gc.daytrade.picker.config;

/**
 * Source column of the sector key carried in {@code StockMeta.sectorId}.
 * Chosen by whoever builds the metadata; the engine treats it as a label.
 */
public enum SectorMode {
    INDUSTRY("industry"),
    THEMES("themes");

    private final String column;

    SectorMode(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
