package tw.gc.daytrade.picker.services;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.daytrade.picker.config.PickerConfig.UniverseConfig;
import tw.gc.daytrade.picker.entities.DailyBar;
import tw.gc.daytrade.picker.entities.RiskFlags;
import tw.gc.daytrade.picker.indicators.FailClosed;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Universe Filter
 *
 * Removes ineligible rows before any ranking. Rules run in order:
 * turnover floor, price floor, price ceiling, limit-up exclusion, then the
 * risk flags (disposed, full margin, blacklist, liquidity floor) when flags
 * are supplied. Missing turnover/price/liquidity fail their rule.
 */
@Service
@Slf4j
public class UniverseFilter {

    /**
     * Keep the eligible rows, in input order.
     *
     * @param riskFlags flags by stock id; {@code null} or empty means no restriction
     */
    public List<DailyBar> apply(List<DailyBar> rows, Map<String, RiskFlags> riskFlags, UniverseConfig config) {
        List<DailyBar> eligible = new ArrayList<>(rows.size());
        for (DailyBar row : rows) {
            FilterResult result = evaluate(row, riskFlags, config);
            if (result.isPassed()) {
                eligible.add(row);
            } else {
                log.debug("Excluded {} on {}: {}", row.stockId(), row.tradeDate(), result.getReason());
            }
        }
        return eligible;
    }

    /**
     * Evaluate one row with the reason of the first rule it fails.
     */
    public FilterResult evaluate(DailyBar row, Map<String, RiskFlags> riskFlags, UniverseConfig config) {
        if (config.minTurnover() != null && !FailClosed.atLeast(row.turnover(), config.minTurnover())) {
            return FilterResult.rejected(row.stockId(),
                    String.format("Turnover below floor: %s (min: %.0f)", row.turnover(), config.minTurnover()));
        }
        if (config.minPrice() != null && !FailClosed.atLeast(row.close(), config.minPrice())) {
            return FilterResult.rejected(row.stockId(),
                    String.format("Price below floor: %.2f (min: %.2f)", row.close(), config.minPrice()));
        }
        if (config.maxPrice() != null && !FailClosed.atMost(row.close(), config.maxPrice())) {
            return FilterResult.rejected(row.stockId(),
                    String.format("Price above ceiling: %.2f (max: %.2f)", row.close(), config.maxPrice()));
        }
        if (config.excludeLimitUp() && row.limitUp()) {
            return FilterResult.rejected(row.stockId(), "Locked at limit up");
        }

        if (riskFlags != null && !riskFlags.isEmpty()) {
            RiskFlags flags = riskFlags.get(row.stockId());
            if (flags != null && flags.restricted()) {
                return FilterResult.rejected(row.stockId(), describe(flags));
            }
            if (config.minLiquidityScore() != null) {
                Double score = flags == null ? null : flags.liquidityScore();
                if (!FailClosed.atLeast(score, config.minLiquidityScore())) {
                    return FilterResult.rejected(row.stockId(),
                            String.format("Liquidity score below floor: %s (min: %.2f)", score, config.minLiquidityScore()));
                }
            }
        }

        return FilterResult.passed(row.stockId());
    }

    private String describe(RiskFlags flags) {
        List<String> parts = new ArrayList<>();
        if (FailClosed.isTrue(flags.disposed())) {
            parts.add("disposed");
        }
        if (FailClosed.isTrue(flags.fullMargin())) {
            parts.add("full margin");
        }
        if (FailClosed.isTrue(flags.blacklist())) {
            parts.add("blacklisted");
        }
        return "Risk flagged: " + String.join(", ", parts);
    }

    /**
     * Filter result
     */
    @Builder
    @Data
    public static class FilterResult {
        private String stockId;
        private boolean passed;
        private String reason;

        static FilterResult passed(String stockId) {
            return FilterResult.builder().stockId(stockId).passed(true).reason("Eligible").build();
        }

        static FilterResult rejected(String stockId, String reason) {
            return FilterResult.builder().stockId(stockId).passed(false).reason(reason).build();
        }
    }
}
