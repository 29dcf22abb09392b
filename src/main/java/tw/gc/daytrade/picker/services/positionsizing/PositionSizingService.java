package tw.gc.daytrade.picker.services.positionsizing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.daytrade.picker.config.PickerConfig.PositionSizingConfig;

/**
 * Position Sizing Service for follower candidates.
 *
 * <p>Entry is the candidate's close; the stop sits a buffer below the
 * previous session's low. Shares are the smaller of:
 * <ul>
 *   <li><b>Risk budget:</b> floor(capital * riskPerTrade / (entry - stop))</li>
 *   <li><b>Position cap:</b> floor(capital * maxPositionPct / entry)</li>
 * </ul>
 * clamped at zero, and lots are whole round lots of those shares.
 *
 * <p>Without a usable stop the size is undefined: every sizing field of the
 * result is {@code null}, never zero.
 */
@Service
@Slf4j
public class PositionSizingService {

    /**
     * Result record. All fields are {@code null} when sizing is undefined.
     */
    public record PositionSizeResult(Double positionValue, Long shares, Long lots) {

        public static PositionSizeResult undefined() {
            return new PositionSizeResult(null, null, null);
        }

        public boolean isDefined() {
            return shares != null;
        }
    }

    /**
     * Stop below the previous session's low.
     *
     * @return {@code null} when there is no previous low or it is not finite
     */
    public Double suggestStop(Double previousLow, double bufferPct) {
        if (previousLow == null || !Double.isFinite(previousLow)) {
            return null;
        }
        return previousLow * (1.0 - bufferPct);
    }

    public PositionSizeResult size(double entry, Double stop, PositionSizingConfig config) {
        if (stop == null || !Double.isFinite(entry) || !Double.isFinite(stop)
                || entry <= 0 || stop <= 0 || stop >= entry) {
            log.debug("Sizing undefined for entry={} stop={}", entry, stop);
            return PositionSizeResult.undefined();
        }

        double riskBudget = config.capital() * config.riskPerTrade();
        double riskPerShare = entry - stop;
        long sharesByRisk = (long) Math.floor(riskBudget / riskPerShare);

        double maxPositionValue = config.capital() * config.maxPositionPct();
        long sharesByCap = (long) Math.floor(maxPositionValue / entry);

        long shares = Math.max(0L, Math.min(sharesByRisk, sharesByCap));
        long lots = shares / config.roundLotSize();

        log.debug("📊 Sized {} shares ({} lots): risk cap {}, position cap {}, entry={}, stop={}",
                shares, lots, sharesByRisk, sharesByCap, entry, stop);

        return new PositionSizeResult(shares * entry, shares, lots);
    }
}
