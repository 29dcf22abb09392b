package tw.gc.daytrade.picker.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.daytrade.picker.config.FallbackPolicy;
import tw.gc.daytrade.picker.config.PickerConfig.LeaderConfig;
import tw.gc.daytrade.picker.config.PickerConfig.LeaderWeights;
import tw.gc.daytrade.picker.entities.LeaderPick;
import tw.gc.daytrade.picker.entities.SectorMember;
import tw.gc.daytrade.picker.indicators.FailClosed;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Leader Selector
 *
 * Finds, per strong sector, the stocks carrying the momentum signature:
 * big move, heavy volume, fresh 20-day high, close near the day's high.
 */
@Service
@Slf4j
public class LeaderSelector {

    private static final Comparator<SectorMember> BY_PCT_CHANGE_DESC = Comparator.comparing(
            SectorMember::pctChange, Comparator.nullsLast(Comparator.<Double>reverseOrder()));

    /**
     * Ranked leaders, at most {@code topNPerSector} per sector.
     *
     * @param members strong-sector members in a stable order
     * @return leaders grouped by sector in first-seen order, best first within a sector
     */
    public List<LeaderPick> select(List<SectorMember> members, LeaderConfig config, FallbackPolicy policy) {
        Map<String, List<SectorMember>> bySector = groupBySector(members);
        List<LeaderPick> out = new ArrayList<>();

        for (Map.Entry<String, List<SectorMember>> entry : bySector.entrySet()) {
            String sectorId = entry.getKey();
            List<SectorMember> sector = entry.getValue();

            List<SectorMember> picked = new ArrayList<>();
            for (SectorMember m : sector) {
                if (isLeader(m, config)) {
                    picked.add(m);
                }
            }

            boolean fallback = false;
            if (picked.isEmpty()) {
                picked = fallbackLeaders(sector, config, policy);
                fallback = !picked.isEmpty();
                if (fallback) {
                    log.warn("⚠️ Sector {} has no strict leader; {} fallback picked {}", sectorId, policy, picked.size());
                }
            }
            if (picked.isEmpty()) {
                log.debug("Sector {} has no leader", sectorId);
                continue;
            }

            List<Scored> scored = new ArrayList<>(picked.size());
            for (SectorMember m : picked) {
                scored.add(new Scored(m, score(m, config.weights())));
            }
            scored.sort(Comparator.comparingDouble(Scored::score).reversed());

            int limit = Math.min(config.topNPerSector(), scored.size());
            for (int i = 0; i < limit; i++) {
                Scored s = scored.get(i);
                out.add(new LeaderPick(sectorId, s.member().stockId(), s.score(), i + 1, fallback));
            }
        }
        return out;
    }

    /**
     * The top-ranked leader of each sector.
     */
    public Map<String, LeaderPick> bestPerSector(List<LeaderPick> leaders) {
        Map<String, LeaderPick> best = new LinkedHashMap<>();
        for (LeaderPick leader : leaders) {
            best.merge(leader.sectorId(), leader, (a, b) -> b.score() > a.score() ? b : a);
        }
        return best;
    }

    public boolean isLeader(SectorMember m, LeaderConfig config) {
        return FailClosed.atLeast(m.pctChange(), config.threshPct())
                && FailClosed.atLeast(m.features().volumeRatio20d(), config.threshVolumeRatio())
                && FailClosed.isTrue(m.features().is20dHigh())
                && FailClosed.atLeast(m.features().intradayPosition(), config.threshIntradayPosition());
    }

    public double score(SectorMember m, LeaderWeights w) {
        return w.pctChangeZ() * FailClosed.orZero(m.pctChangeZ())
                + w.volumeRatioZ() * FailClosed.orZero(m.volumeRatioZ())
                + w.intradayPosition() * FailClosed.orZero(m.features().intradayPosition());
    }

    private List<SectorMember> fallbackLeaders(List<SectorMember> sector, LeaderConfig config, FallbackPolicy policy) {
        List<SectorMember> ranked = new ArrayList<>(sector);
        ranked.sort(BY_PCT_CHANGE_DESC);

        if (policy.allowsLeaderPercentile() && config.topPctInSector() > 0) {
            // half-even rounding, at least one stock
            int cut = (int) Math.max(1, Math.rint(ranked.size() * config.topPctInSector()));
            return new ArrayList<>(ranked.subList(0, Math.min(cut, ranked.size())));
        }
        if (policy.allowsLeaderWholeSector()) {
            return ranked;
        }
        return List.of();
    }

    private Map<String, List<SectorMember>> groupBySector(List<SectorMember> members) {
        Map<String, List<SectorMember>> bySector = new LinkedHashMap<>();
        for (SectorMember m : members) {
            bySector.computeIfAbsent(m.sectorId(), k -> new ArrayList<>()).add(m);
        }
        return bySector;
    }

    private record Scored(SectorMember member, double score) {
    }
}
