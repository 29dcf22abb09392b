package tw.gc.daytrade.picker.entities;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * A window of daily bars together with the metadata of the stocks in it.
 * Bars are kept in (trade date, stock id) order.
 */
public final class MarketHistory {

    private final List<StockMeta> stocks;
    private final List<DailyBar> bars;
    private final List<LocalDate> tradingDates;

    public MarketHistory(List<StockMeta> stocks, List<DailyBar> bars) {
        Objects.requireNonNull(stocks, "stocks");
        Objects.requireNonNull(bars, "bars");
        this.stocks = List.copyOf(stocks);
        List<DailyBar> sorted = new ArrayList<>(bars);
        sorted.sort((a, b) -> {
            int byDate = a.tradeDate().compareTo(b.tradeDate());
            return byDate != 0 ? byDate : a.stockId().compareTo(b.stockId());
        });
        this.bars = Collections.unmodifiableList(sorted);
        TreeSet<LocalDate> dates = new TreeSet<>();
        for (DailyBar bar : sorted) {
            dates.add(bar.tradeDate());
        }
        this.tradingDates = List.copyOf(dates);
    }

    public List<StockMeta> stocks() {
        return stocks;
    }

    public List<DailyBar> bars() {
        return bars;
    }

    /**
     * Distinct trade dates present in the window, ascending.
     */
    public List<LocalDate> tradingDates() {
        return tradingDates;
    }

    public Map<String, StockMeta> stocksById() {
        Map<String, StockMeta> byId = new LinkedHashMap<>();
        for (StockMeta meta : stocks) {
            byId.putIfAbsent(meta.stockId(), meta);
        }
        return byId;
    }

    public List<DailyBar> barsOn(LocalDate date) {
        List<DailyBar> out = new ArrayList<>();
        for (DailyBar bar : bars) {
            if (bar.tradeDate().equals(date)) {
                out.add(bar);
            }
        }
        return out;
    }

    /**
     * The trading date immediately before {@code date} in this window. Empty
     * when {@code date} is not in the window or is its first date.
     */
    public Optional<LocalDate> previousTradingDate(LocalDate date) {
        int idx = Collections.binarySearch(tradingDates, date);
        if (idx <= 0) {
            return Optional.empty();
        }
        return Optional.of(tradingDates.get(idx - 1));
    }

    /**
     * The same history cut off after {@code date}, inclusive.
     */
    public MarketHistory upTo(LocalDate date) {
        List<DailyBar> slice = new ArrayList<>();
        for (DailyBar bar : bars) {
            if (!bar.tradeDate().isAfter(date)) {
                slice.add(bar);
            }
        }
        return new MarketHistory(stocks, slice);
    }

    public boolean contains(LocalDate date) {
        return Collections.binarySearch(tradingDates, date) >= 0;
    }
}
