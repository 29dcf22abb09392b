package tw.gc.daytrade.picker.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.daytrade.picker.config.PickerConfig;
import tw.gc.daytrade.picker.config.PickerConfig.TotalScoreWeights;
import tw.gc.daytrade.picker.entities.CandidateRow;
import tw.gc.daytrade.picker.entities.DailyBar;
import tw.gc.daytrade.picker.entities.DailyFeatures;
import tw.gc.daytrade.picker.entities.FollowerPick;
import tw.gc.daytrade.picker.entities.LeaderPick;
import tw.gc.daytrade.picker.entities.MarketHistory;
import tw.gc.daytrade.picker.entities.RiskFlags;
import tw.gc.daytrade.picker.entities.SectorDailyAggregate;
import tw.gc.daytrade.picker.entities.SectorMember;
import tw.gc.daytrade.picker.entities.SelectionResult;
import tw.gc.daytrade.picker.entities.StockMeta;
import tw.gc.daytrade.picker.entities.StrongSector;
import tw.gc.daytrade.picker.indicators.CrossSectionalStandardizer;
import tw.gc.daytrade.picker.indicators.DailyFeatureCalculator;
import tw.gc.daytrade.picker.services.positionsizing.PositionSizingService;
import tw.gc.daytrade.picker.services.positionsizing.PositionSizingService.PositionSizeResult;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * SectorMomentumPicker
 *
 * Runs the full selection for one evaluation date: features, sector
 * aggregates, universe filter, strong sectors, leaders, followers, pairing,
 * scoring and sizing. Holds no state between calls, so separate dates can
 * be evaluated independently.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SectorMomentumPicker {

    private final UniverseFilter universeFilter;
    private final SectorMomentumService sectorMomentumService;
    private final LeaderSelector leaderSelector;
    private final FollowerSelector followerSelector;
    private final PositionSizingService positionSizingService;
    private final PickerConfig pickerConfig;

    public SelectionResult run(LocalDate tradeDate, MarketHistory history, List<RiskFlags> riskFlags) {
        return run(tradeDate, history, riskFlags, pickerConfig);
    }

    /**
     * Evaluate {@code tradeDate} against {@code history}.
     *
     * @param riskFlags optional; {@code null} or empty means no stock is restricted
     * @return ranked candidates, or an empty result when any stage comes out empty
     */
    public SelectionResult run(LocalDate tradeDate, MarketHistory history, List<RiskFlags> riskFlags, PickerConfig config) {
        Objects.requireNonNull(tradeDate, "tradeDate");
        Objects.requireNonNull(history, "history");
        Objects.requireNonNull(config, "config");

        Map<String, StockMeta> stocks = history.stocksById();
        Map<String, RiskFlags> flags = indexFlags(riskFlags);

        List<DailyFeatures> features = DailyFeatureCalculator.compute(history.bars());
        List<DailyBar> eligible = universeFilter.apply(history.bars(), flags, config.universe());
        List<SectorDailyAggregate> sectorDaily = sectorMomentumService.aggregate(
                eligible, stocks, config.sector().momentumLookback());

        if (!history.contains(tradeDate)) {
            log.warn("⚠️ {} not in price history ({} dates); nothing to evaluate", tradeDate, history.tradingDates().size());
            return SelectionResult.empty(tradeDate, features, sectorDaily, List.of());
        }

        List<StrongSector> strong = sectorMomentumService.selectStrongSectors(
                tradeDate, sectorDaily, config.sector(), config.fallbackPolicy());
        if (strong.isEmpty()) {
            log.info("📉 {}: no strong sector, no candidates", tradeDate);
            return SelectionResult.empty(tradeDate, features, sectorDaily, strong);
        }

        List<SectorMember> members = buildMembers(tradeDate, eligible, stocks, features, strong);
        List<LeaderPick> leaders = leaderSelector.select(members, config.leader(), config.fallbackPolicy());
        List<FollowerPick> followers = followerSelector.select(members, config.follower(), config.fallbackPolicy());

        log.info("🔎 {}: {} eligible rows, {} members in strong sectors {}, {} leaders, {} followers",
                tradeDate, eligible.stream().filter(b -> b.tradeDate().equals(tradeDate)).count(), members.size(),
                strong.stream().map(StrongSector::sectorId).collect(Collectors.toList()),
                leaders.size(), followers.size());

        if (leaders.isEmpty() || followers.isEmpty()) {
            return SelectionResult.empty(tradeDate, features, sectorDaily, strong);
        }

        List<CandidateRow> rows = pairAndSize(tradeDate, history, strong, leaders, followers, config);
        log.info("✅ {}: {} candidates", tradeDate, rows.size());
        return new SelectionResult(tradeDate, rows, features, sectorDaily, strong);
    }

    public Map<LocalDate, SelectionResult> runRange(LocalDate start, LocalDate end, MarketHistory history, List<RiskFlags> riskFlags) {
        return runRange(start, end, history, riskFlags, pickerConfig);
    }

    /**
     * Evaluate every trading date of {@code history} in {@code [start, end]},
     * each against only the history up to and including that date.
     */
    public Map<LocalDate, SelectionResult> runRange(LocalDate start, LocalDate end, MarketHistory history,
                                                    List<RiskFlags> riskFlags, PickerConfig config) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start");
        }
        Map<LocalDate, SelectionResult> results = new TreeMap<>();
        for (LocalDate date : history.tradingDates()) {
            if (date.isBefore(start) || date.isAfter(end)) {
                continue;
            }
            results.put(date, run(date, history.upTo(date), riskFlags, config));
        }
        return results;
    }

    private List<SectorMember> buildMembers(LocalDate tradeDate,
                                            List<DailyBar> eligible,
                                            Map<String, StockMeta> stocks,
                                            List<DailyFeatures> features,
                                            List<StrongSector> strong) {
        Set<String> strongIds = strong.stream().map(StrongSector::sectorId).collect(Collectors.toSet());
        Map<String, DailyFeatures> todayFeatures = new HashMap<>();
        for (DailyFeatures f : features) {
            if (f.tradeDate().equals(tradeDate)) {
                todayFeatures.put(f.stockId(), f);
            }
        }

        List<SectorMember> base = new ArrayList<>();
        for (DailyBar bar : eligible) {
            if (!bar.tradeDate().equals(tradeDate)) {
                continue;
            }
            StockMeta meta = stocks.get(bar.stockId());
            if (meta == null || !strongIds.contains(meta.sectorId())) {
                continue;
            }
            DailyFeatures f = todayFeatures.getOrDefault(bar.stockId(), DailyFeatures.undefined(tradeDate, bar.stockId()));
            base.add(new SectorMember(meta.sectorId(), bar, f, null, null));
        }
        // fixed order so equal scores rank the same way on every run
        base.sort(Comparator.comparing(SectorMember::sectorId).thenComparing(SectorMember::stockId));

        List<Double> pctZ = CrossSectionalStandardizer.standardizeByGroup(base, SectorMember::sectorId, SectorMember::pctChange);
        List<Double> volZ = CrossSectionalStandardizer.standardizeByGroup(
                base, SectorMember::sectorId, m -> m.features().volumeRatio20d());

        List<SectorMember> members = new ArrayList<>(base.size());
        for (int i = 0; i < base.size(); i++) {
            SectorMember m = base.get(i);
            members.add(new SectorMember(m.sectorId(), m.bar(), m.features(), pctZ.get(i), volZ.get(i)));
        }
        return members;
    }

    private List<CandidateRow> pairAndSize(LocalDate tradeDate,
                                           MarketHistory history,
                                           List<StrongSector> strong,
                                           List<LeaderPick> leaders,
                                           List<FollowerPick> followers,
                                           PickerConfig config) {
        Map<String, LeaderPick> bestLeader = leaderSelector.bestPerSector(leaders);
        Map<String, Double> sectorScore = new LinkedHashMap<>();
        for (StrongSector s : strong) {
            sectorScore.put(s.sectorId(), s.sectorScore());
        }
        Map<String, Double> previousLows = previousLows(tradeDate, history);
        TotalScoreWeights tw = config.totalScoreWeights();

        List<CandidateRow> rows = new ArrayList<>();
        for (FollowerPick follower : followers) {
            LeaderPick leader = bestLeader.get(follower.sectorId());
            if (leader == null) {
                log.debug("Dropping follower {}: sector {} has no leader", follower.stockId(), follower.sectorId());
                continue;
            }

            double scoreSector = sectorScore.getOrDefault(follower.sectorId(), 0.0);
            double scoreTotal = tw.scoreSector() * scoreSector
                    + tw.scoreLeader() * leader.score()
                    + tw.scoreFollow() * follower.score();

            double entry = follower.member().bar().close();
            Double stop = positionSizingService.suggestStop(
                    previousLows.get(follower.stockId()), config.positionSizing().stopBufferPct());
            PositionSizeResult size = positionSizingService.size(entry, stop, config.positionSizing());

            rows.add(CandidateRow.builder()
                    .tradeDate(tradeDate)
                    .stockId(follower.stockId())
                    .leaderId(leader.stockId())
                    .sectorId(follower.sectorId())
                    .scoreSector(scoreSector)
                    .scoreLeader(leader.score())
                    .scoreFollow(follower.score())
                    .scoreTotal(scoreTotal)
                    .suggestEntry(entry)
                    .suggestStop(stop)
                    .positionValue(size.positionValue())
                    .shares(size.shares())
                    .lots(size.lots())
                    .build());
        }

        // stable: equal totals keep (sector, stock) order
        rows.sort(Comparator.comparingDouble(CandidateRow::scoreTotal).reversed());
        return rows;
    }

    private Map<String, Double> previousLows(LocalDate tradeDate, MarketHistory history) {
        Optional<LocalDate> previous = history.previousTradingDate(tradeDate);
        Map<String, Double> lows = new HashMap<>();
        if (previous.isEmpty()) {
            log.info("{} is the first date in history; stops undefined", tradeDate);
            return lows;
        }
        for (DailyBar bar : history.barsOn(previous.get())) {
            lows.put(bar.stockId(), bar.low());
        }
        return lows;
    }

    private Map<String, RiskFlags> indexFlags(List<RiskFlags> riskFlags) {
        Map<String, RiskFlags> byId = new HashMap<>();
        if (riskFlags == null) {
            return byId;
        }
        for (RiskFlags f : riskFlags) {
            byId.put(f.stockId(), f);
        }
        return byId;
    }
}
