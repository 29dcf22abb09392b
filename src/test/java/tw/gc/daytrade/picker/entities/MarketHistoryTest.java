package tw.gc.daytrade.picker.entities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tw.gc.daytrade.picker.testutil.MarketDataTestFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MarketHistory")
class MarketHistoryTest {

    private final List<LocalDate> days = MarketDataTestFactory.tradingDays(6);

    private MarketHistory history() {
        List<DailyBar> bars = new ArrayList<>();
        bars.addAll(MarketDataTestFactory.flatPath("2454", days, 900.0));
        bars.addAll(MarketDataTestFactory.flatPath("2330", days.subList(2, 6), 600.0));
        return new MarketHistory(List.of(
                new StockMeta("2330", "TSMC", "TWSE", "24"),
                new StockMeta("2454", "MediaTek", "TWSE", "24")), bars);
    }

    @Test
    @DisplayName("orders bars by date, then stock")
    void ordering() {
        List<DailyBar> bars = history().bars();

        assertThat(bars.get(0).stockId()).isEqualTo("2454");
        assertThat(bars.get(2).tradeDate()).isEqualTo(days.get(2));
        assertThat(bars.get(2).stockId()).isEqualTo("2330");
        assertThat(history().tradingDates()).containsExactlyElementsOf(days);
    }

    @Test
    @DisplayName("previous trading date spans weekends and stops at the first date")
    void previousTradingDate() {
        MarketHistory history = history();

        // 2025-01-13 is a Monday
        assertThat(history.previousTradingDate(days.get(5))).contains(days.get(4));
        assertThat(days.get(5)).isEqualTo(LocalDate.of(2025, 1, 13));
        assertThat(days.get(4)).isEqualTo(LocalDate.of(2025, 1, 10));
        assertThat(history.previousTradingDate(days.get(0))).isEmpty();
        assertThat(history.previousTradingDate(LocalDate.of(2025, 1, 11))).isEmpty();
    }

    @Test
    @DisplayName("upTo cuts the window after a date")
    void upTo() {
        MarketHistory cut = history().upTo(days.get(2));

        assertThat(cut.tradingDates()).containsExactlyElementsOf(days.subList(0, 3));
        assertThat(cut.barsOn(days.get(2))).extracting(DailyBar::stockId).containsExactly("2330", "2454");
        assertThat(cut.contains(days.get(3))).isFalse();
        assertThat(cut.stocks()).hasSize(2);
    }

    @Test
    @DisplayName("a blank sector becomes UNKNOWN")
    void blankSector() {
        assertThat(new StockMeta("9999", "Mystery", "TPEX", " ").sectorId()).isEqualTo(StockMeta.UNKNOWN_SECTOR);
        assertThat(new StockMeta("9999", "Mystery", "TPEX", null).sectorId()).isEqualTo("UNKNOWN");
    }
}
