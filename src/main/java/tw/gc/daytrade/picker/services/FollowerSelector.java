package tw.gc.daytrade.picker.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.daytrade.picker.config.FallbackPolicy;
import tw.gc.daytrade.picker.config.PickerConfig.FollowerConfig;
import tw.gc.daytrade.picker.config.PickerConfig.FollowerWeights;
import tw.gc.daytrade.picker.entities.FollowerPick;
import tw.gc.daytrade.picker.entities.SectorMember;
import tw.gc.daytrade.picker.indicators.FailClosed;

import java.util.ArrayList;
import java.util.List;

/**
 * Follower Selector
 *
 * Picks strong-sector stocks that are moving with the sector but have not
 * blown off yet: pct_change and volume ratio inside their bands, close over
 * MA5 and MA20, and still near the 20-day high.
 */
@Service
@Slf4j
public class FollowerSelector {

    /**
     * Scored followers in input order.
     */
    public List<FollowerPick> select(List<SectorMember> members, FollowerConfig config, FallbackPolicy policy) {
        List<FollowerPick> out = new ArrayList<>();
        for (SectorMember m : members) {
            if (isFollower(m, config)) {
                out.add(new FollowerPick(m, score(m, config.weights())));
            }
        }

        if (out.isEmpty() && policy.allowsFollowerRelaxation()) {
            for (SectorMember m : members) {
                if (FailClosed.within(m.pctChange(), config.pctChangeMin(), config.pctChangeMax())) {
                    out.add(new FollowerPick(m, score(m, config.weights())));
                }
            }
            log.warn("⚠️ No strict follower; {} fallback relaxed to pct_change band only ({} kept)", policy, out.size());
        }
        return out;
    }

    public boolean isFollower(SectorMember m, FollowerConfig config) {
        double close = m.bar().close();
        return FailClosed.within(m.pctChange(), config.pctChangeMin(), config.pctChangeMax())
                && FailClosed.within(m.features().volumeRatio20d(), config.volumeRatioMin(), config.volumeRatioMax())
                && FailClosed.above(close, m.features().ma5())
                && FailClosed.above(close, m.features().ma20())
                && FailClosed.atMost(m.features().distanceTo20dHigh(), config.maxDistanceTo20dHigh());
    }

    /**
     * A missing distance counts as 1.0, i.e. no credit for proximity.
     */
    public double score(SectorMember m, FollowerWeights w) {
        Double distance = m.features().distanceTo20dHigh();
        double proximity = 1.0 - (FailClosed.isPresent(distance) ? distance : 1.0);
        return w.pctChangeZ() * FailClosed.orZero(m.pctChangeZ())
                + w.volumeRatioZ() * FailClosed.orZero(m.volumeRatioZ())
                + w.oneMinusDistanceTo20dHigh() * proximity
                + w.intradayPosition() * FailClosed.orZero(m.features().intradayPosition());
    }
}
