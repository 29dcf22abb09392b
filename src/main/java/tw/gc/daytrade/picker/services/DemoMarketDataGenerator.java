package tw.gc.daytrade.picker.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.daytrade.picker.AppConstants;
import tw.gc.daytrade.picker.entities.DailyBar;
import tw.gc.daytrade.picker.entities.MarketHistory;
import tw.gc.daytrade.picker.entities.StockMeta;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Seeded synthetic market for dry runs.
 *
 * <p>Each sector gets a daily drift series; each stock's return is its
 * sector's drift plus its own noise. Trading dates are business days ending
 * at the as-of date (or the Friday before, on a weekend). The same seed and
 * arguments always give the same history.
 */
@Service
@Slf4j
public class DemoMarketDataGenerator {

    private static final double TWSE_SHARE = 0.7;
    private static final double MIN_CLOSE = 2.0;

    public MarketHistory generate(LocalDate asOf, int numStocks, int numSectors, int historyDays, long seed) {
        if (numStocks <= 0 || numSectors <= 0 || historyDays <= 0) {
            throw new IllegalArgumentException("numStocks, numSectors and historyDays must be positive");
        }
        Random rng = new Random(seed);
        List<LocalDate> dates = businessDaysEndingAt(asOf, historyDays);

        List<StockMeta> stocks = new ArrayList<>(numStocks);
        double[] basePrice = new double[numStocks];
        double[] baseTurnover = new double[numStocks];
        int[] sectorOf = new int[numStocks];
        for (int i = 0; i < numStocks; i++) {
            String stockId = String.valueOf(1000 + i);
            sectorOf[i] = rng.nextInt(numSectors);
            String market = rng.nextDouble() < TWSE_SHARE ? AppConstants.MARKET_TWSE : AppConstants.MARKET_TPEX;
            stocks.add(new StockMeta(stockId, "Stock" + stockId, market, String.format("S%02d", sectorOf[i])));
            basePrice[i] = uniform(rng, 18, 220);
            baseTurnover[i] = uniform(rng, 1.5e7, 2.5e8);
        }

        double[][] drift = new double[numSectors][dates.size()];
        for (int s = 0; s < numSectors; s++) {
            for (int t = 0; t < dates.size(); t++) {
                drift[s][t] = 0.001 + 0.02 * rng.nextGaussian();
            }
        }

        List<DailyBar> bars = new ArrayList<>(numStocks * dates.size());
        double[] prevClose = basePrice.clone();
        for (int t = 0; t < dates.size(); t++) {
            for (int i = 0; i < numStocks; i++) {
                double ret = drift[sectorOf[i]][t] + 0.025 * rng.nextGaussian();
                double close = Math.max(MIN_CLOSE, prevClose[i] * (1.0 + ret));
                double open = close * (1.0 + 0.01 * rng.nextGaussian());
                double high = Math.max(open, close) * (1.0 + Math.abs(0.01 * rng.nextGaussian()));
                double low = Math.min(open, close) * (1.0 - Math.abs(0.01 * rng.nextGaussian()));
                long volume = (long) (uniform(rng, 2000, 80000) * (1.0 + Math.abs(ret) * 10));
                double turnover = baseTurnover[i] * (0.4 + Math.abs(ret) * 8) * uniform(rng, 0.7, 1.3);
                double pctChange = (close / prevClose[i] - 1.0) * 100.0;

                bars.add(DailyBar.builder()
                        .tradeDate(dates.get(t))
                        .stockId(stocks.get(i).stockId())
                        .open(open)
                        .high(high)
                        .low(low)
                        .close(close)
                        .pctChange(pctChange)
                        .volume(volume)
                        .turnover(turnover)
                        .limitUp(false)
                        .limitDown(false)
                        .build());
                prevClose[i] = close;
            }
        }

        log.info("🧪 Generated demo market: {} stocks, {} sectors, {} days ending {}",
                numStocks, numSectors, dates.size(), dates.get(dates.size() - 1));
        return new MarketHistory(stocks, bars);
    }

    static List<LocalDate> businessDaysEndingAt(LocalDate asOf, int count) {
        List<LocalDate> dates = new ArrayList<>(count);
        LocalDate d = asOf;
        while (dates.size() < count) {
            if (d.getDayOfWeek() != DayOfWeek.SATURDAY && d.getDayOfWeek() != DayOfWeek.SUNDAY) {
                dates.add(d);
            }
            d = d.minusDays(1);
        }
        Collections.reverse(dates);
        return dates;
    }

    private static double uniform(Random rng, double low, double high) {
        return low + (high - low) * rng.nextDouble();
    }
}
