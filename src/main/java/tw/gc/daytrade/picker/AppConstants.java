package tw.gc.daytrade.picker;

import java.time.ZoneId;

/**
 * Application-wide constants
 */
public final class AppConstants {

    // Timezone configuration
    public static final ZoneId TAIPEI_ZONE = ZoneId.of("Asia/Taipei");
    public static final String TAIPEI_ZONE_ID = "Asia/Taipei";

    // Taiwan market: 1 round lot = 1000 shares
    public static final int ROUND_LOT_SIZE = 1000;

    public static final String MARKET_TWSE = "TWSE";
    public static final String MARKET_TPEX = "TPEX";

    private AppConstants() {
        // Utility class
    }
}
