package tw.gc.daytrade.picker.config;

import java.util.Objects;

/**
 * Immutable, fully-populated picker configuration.
 *
 * <p>Built once from {@link PickerProperties#toConfig()} and handed to every
 * stage by reference. Percent thresholds use the same units as
 * {@code pct_change} (3.0 means 3%); fractions (ratios, risk, buffers) are
 * plain decimals.
 *
 * <p>{@code sectorMode} labels which metadata column the caller loaded into
 * {@code StockMeta.sectorId}. The engine only groups by that id and never
 * reads the mode.
 */
public record PickerConfig(
        SectorConfig sector,
        LeaderConfig leader,
        FollowerConfig follower,
        TotalScoreWeights totalScoreWeights,
        PositionSizingConfig positionSizing,
        UniverseConfig universe,
        FallbackPolicy fallbackPolicy,
        SectorMode sectorMode
) {

    public PickerConfig {
        Objects.requireNonNull(sector, "sector");
        Objects.requireNonNull(leader, "leader");
        Objects.requireNonNull(follower, "follower");
        Objects.requireNonNull(totalScoreWeights, "totalScoreWeights");
        Objects.requireNonNull(positionSizing, "positionSizing");
        Objects.requireNonNull(universe, "universe");
        Objects.requireNonNull(fallbackPolicy, "fallbackPolicy");
        Objects.requireNonNull(sectorMode, "sectorMode");
    }

    /**
     * Configuration with every default from {@link PickerProperties}.
     */
    public static PickerConfig defaults() {
        return new PickerProperties().toConfig();
    }

    public PickerConfig withSector(SectorConfig value) {
        return new PickerConfig(value, leader, follower, totalScoreWeights, positionSizing, universe, fallbackPolicy, sectorMode);
    }

    public PickerConfig withLeader(LeaderConfig value) {
        return new PickerConfig(sector, value, follower, totalScoreWeights, positionSizing, universe, fallbackPolicy, sectorMode);
    }

    public PickerConfig withFollower(FollowerConfig value) {
        return new PickerConfig(sector, leader, value, totalScoreWeights, positionSizing, universe, fallbackPolicy, sectorMode);
    }

    public PickerConfig withPositionSizing(PositionSizingConfig value) {
        return new PickerConfig(sector, leader, follower, totalScoreWeights, value, universe, fallbackPolicy, sectorMode);
    }

    public PickerConfig withUniverse(UniverseConfig value) {
        return new PickerConfig(sector, leader, follower, totalScoreWeights, positionSizing, value, fallbackPolicy, sectorMode);
    }

    public PickerConfig withFallbackPolicy(FallbackPolicy value) {
        return new PickerConfig(sector, leader, follower, totalScoreWeights, positionSizing, universe, value, sectorMode);
    }

    /**
     * Strong-sector thresholds and composite score weights.
     *
     * @param momentumLookback trailing window (trading days) for sector momentum
     * @param fallbackTopK     sectors kept by composite score when the policy allows the top-K fallback
     */
    public record SectorConfig(
            int momentumLookback,
            double threshAvgPct,
            double threshUpRatio,
            double threshMomentumZ,
            SectorWeights weights,
            int fallbackTopK
    ) {
        public SectorConfig {
            Objects.requireNonNull(weights, "weights");
        }

        public SectorConfig withThresholds(double avgPct, double upRatio, double momentumZ) {
            return new SectorConfig(momentumLookback, avgPct, upRatio, momentumZ, weights, fallbackTopK);
        }

        public SectorConfig withMomentumLookback(int lookback) {
            return new SectorConfig(lookback, threshAvgPct, threshUpRatio, threshMomentumZ, weights, fallbackTopK);
        }
    }

    public record SectorWeights(double avgPctChangeZ, double momentumZ, double upRatio) {
    }

    /**
     * @param topPctInSector fraction of a sector taken by the percentile fallback; 0 disables it
     */
    public record LeaderConfig(
            double threshPct,
            double threshVolumeRatio,
            double threshIntradayPosition,
            int topNPerSector,
            double topPctInSector,
            LeaderWeights weights
    ) {
        public LeaderConfig {
            Objects.requireNonNull(weights, "weights");
        }

        public LeaderConfig withTopPctInSector(double value) {
            return new LeaderConfig(threshPct, threshVolumeRatio, threshIntradayPosition, topNPerSector, value, weights);
        }
    }

    public record LeaderWeights(double pctChangeZ, double volumeRatioZ, double intradayPosition) {
    }

    public record FollowerConfig(
            double pctChangeMin,
            double pctChangeMax,
            double volumeRatioMin,
            double volumeRatioMax,
            double maxDistanceTo20dHigh,
            FollowerWeights weights
    ) {
        public FollowerConfig {
            Objects.requireNonNull(weights, "weights");
        }
    }

    public record FollowerWeights(
            double pctChangeZ,
            double volumeRatioZ,
            double oneMinusDistanceTo20dHigh,
            double intradayPosition
    ) {
    }

    public record TotalScoreWeights(double scoreSector, double scoreLeader, double scoreFollow) {
    }

    /**
     * @param riskPerTrade   fraction of capital put at risk between entry and stop
     * @param maxPositionPct fraction of capital one position may occupy
     * @param stopBufferPct  fraction taken off the previous day's low
     */
    public record PositionSizingConfig(
            double capital,
            double riskPerTrade,
            double maxPositionPct,
            double stopBufferPct,
            int roundLotSize
    ) {
        public PositionSizingConfig withCapital(double value) {
            return new PositionSizingConfig(value, riskPerTrade, maxPositionPct, stopBufferPct, roundLotSize);
        }
    }

    /**
     * Eligibility floors and ceilings. A {@code null} bound is not applied.
     */
    public record UniverseConfig(
            Double minTurnover,
            Double minPrice,
            Double maxPrice,
            Double minLiquidityScore,
            boolean excludeLimitUp
    ) {
        public static UniverseConfig unrestricted() {
            return new UniverseConfig(null, null, null, null, false);
        }
    }
}
