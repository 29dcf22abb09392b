package tw.gc.daytrade.picker.testutil;

import tw.gc.daytrade.picker.config.PickerConfig;
import tw.gc.daytrade.picker.entities.DailyBar;
import tw.gc.daytrade.picker.entities.DailyFeatures;
import tw.gc.daytrade.picker.entities.MarketHistory;
import tw.gc.daytrade.picker.entities.SectorMember;
import tw.gc.daytrade.picker.entities.StockMeta;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Test factory for bar histories and sector scenarios.
 */
public class MarketDataTestFactory {

    public static final LocalDate START = LocalDate.of(2025, 1, 6); // Monday
    public static final double DEFAULT_BASE_PRICE = 100.0;
    public static final long DEFAULT_VOLUME = 10_000L;
    public static final double DEFAULT_TURNOVER = 1.0e9;

    public static final int SCENARIO_DAYS = 25;
    public static final String SECTOR_A = "A";
    public static final String SECTOR_B = "B";
    public static final String SECTOR_C = "C";
    public static final String LEADER_ID = "1100";
    public static final List<String> FOLLOWER_IDS = List.of("1101", "1102", "1103");

    /**
     * Weekdays starting at {@link #START}.
     */
    public static List<LocalDate> tradingDays(int count) {
        List<LocalDate> days = new ArrayList<>(count);
        LocalDate d = START;
        while (days.size() < count) {
            if (d.getDayOfWeek() != DayOfWeek.SATURDAY && d.getDayOfWeek() != DayOfWeek.SUNDAY) {
                days.add(d);
            }
            d = d.plusDays(1);
        }
        return days;
    }

    /**
     * A single bar with high 1% above and low 3% below the close.
     */
    public static DailyBar bar(LocalDate date, String stockId, double close, Double pctChange, long volume) {
        return DailyBar.builder()
                .tradeDate(date)
                .stockId(stockId)
                .open(close)
                .high(close * 1.01)
                .low(close * 0.97)
                .close(close)
                .pctChange(pctChange)
                .volume(volume)
                .turnover(DEFAULT_TURNOVER)
                .limitUp(false)
                .limitDown(false)
                .build();
    }

    /**
     * A price path compounding {@code pct} from {@code basePrice}.
     */
    public static List<DailyBar> path(String stockId, List<LocalDate> days, double basePrice, double[] pct, long[] volumes) {
        List<DailyBar> bars = new ArrayList<>(days.size());
        double prev = basePrice;
        for (int i = 0; i < days.size(); i++) {
            double close = prev * (1.0 + pct[i] / 100.0);
            bars.add(bar(days.get(i), stockId, close, pct[i], volumes[i]));
            prev = close;
        }
        return bars;
    }

    public static List<DailyBar> flatPath(String stockId, List<LocalDate> days, double price) {
        double[] pct = new double[days.size()];
        long[] volumes = new long[days.size()];
        Arrays.fill(volumes, DEFAULT_VOLUME);
        return path(stockId, days, price, pct, volumes);
    }

    /**
     * Final-day volume giving {@code ratio} against a 20-day average that
     * includes the final day, when the prior 19 days traded {@code base}.
     */
    public static long volumeForRatio(double ratio, long base) {
        return Math.round(ratio * 19 * base / (20 - ratio));
    }

    /**
     * Three sectors of ten stocks over {@link #SCENARIO_DAYS} days.
     *
     * <p>Sector A climbs 1% a day and on the last day averages +4% with nine
     * of ten stocks up. Its leader {@link #LEADER_ID} jumps 9% on 2.5x volume,
     * closing on a new 20-day high at the top of its range. Three followers
     * ({@link #FOLLOWER_IDS}) gain 3-5% on 1.5x volume. Sectors B and C are
     * flat.
     */
    public static MarketHistory threeSectorScenario() {
        List<LocalDate> days = tradingDays(SCENARIO_DAYS);
        int last = SCENARIO_DAYS - 1;
        List<StockMeta> stocks = new ArrayList<>();
        List<DailyBar> bars = new ArrayList<>();

        double[] finalPct = {9.0, 3.0, 4.0, 5.0, 3.8, 3.8, 3.8, 3.8, 3.8, 0.0};
        double[] finalRatio = {2.5, 1.5, 1.5, 1.5, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0};
        for (int k = 0; k < 10; k++) {
            String id = String.valueOf(1100 + k);
            stocks.add(new StockMeta(id, "Alpha" + k, "TWSE", SECTOR_A));
            double[] pct = new double[SCENARIO_DAYS];
            long[] volumes = new long[SCENARIO_DAYS];
            Arrays.fill(pct, 1.0);
            Arrays.fill(volumes, DEFAULT_VOLUME);
            pct[last] = finalPct[k];
            volumes[last] = volumeForRatio(finalRatio[k], DEFAULT_VOLUME);
            List<DailyBar> series = path(id, days, DEFAULT_BASE_PRICE, pct, volumes);
            if (id.equals(LEADER_ID)) {
                DailyBar top = series.get(last);
                series.set(last, top.toBuilder().high(top.close()).build());
            }
            bars.addAll(series);
        }

        for (int k = 0; k < 10; k++) {
            String b = String.valueOf(2200 + k);
            String c = String.valueOf(3300 + k);
            stocks.add(new StockMeta(b, "Beta" + k, "TWSE", SECTOR_B));
            stocks.add(new StockMeta(c, "Gamma" + k, "TPEX", SECTOR_C));
            bars.addAll(flatPath(b, days, 50.0 + k));
            bars.addAll(flatPath(c, days, 80.0 + k));
        }
        return new MarketHistory(stocks, bars);
    }

    public static LocalDate scenarioDate() {
        return tradingDays(SCENARIO_DAYS).get(SCENARIO_DAYS - 1);
    }

    /**
     * Thresholds the scenario's sector A and its leader/followers are built to pass.
     */
    public static PickerConfig scenarioConfig() {
        PickerConfig defaults = PickerConfig.defaults();
        return defaults
                .withSector(defaults.sector().withThresholds(3.0, 0.6, 1.0))
                .withLeader(new PickerConfig.LeaderConfig(8.0, 2.0, 0.9, 3, 0.0, defaults.leader().weights()))
                .withFollower(new PickerConfig.FollowerConfig(2.0, 6.0, 1.2, 2.0, 0.05, defaults.follower().weights()));
    }

    /**
     * A member with the given day and feature values and no z-scores.
     */
    public static SectorMember member(String sectorId, String stockId, double close, Double pctChange,
                                      Double volumeRatio, Boolean is20dHigh, Double intradayPosition,
                                      Double ma5, Double ma20, Double distance) {
        LocalDate date = START;
        DailyBar bar = bar(date, stockId, close, pctChange, DEFAULT_VOLUME);
        DailyFeatures features = new DailyFeatures(date, stockId, ma5, null, ma20, (double) DEFAULT_VOLUME,
                volumeRatio, null, is20dHigh, distance, intradayPosition);
        return new SectorMember(sectorId, bar, features, null, null);
    }
}
