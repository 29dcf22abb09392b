package tw.gc.daytrade.picker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import tw.gc.daytrade.picker.AppConstants;

/**
 * Mutable binding target for the {@code picker.*} keys in application.yml.
 *
 * <p>Nothing in the engine reads this class directly; {@link #toConfig()}
 * turns it into the immutable {@link PickerConfig} once at startup.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "picker")
public class PickerProperties {

    @NotNull
    private FallbackPolicy fallbackPolicy = FallbackPolicy.STRICT;

    @NotNull
    private SectorMode sectorMode = SectorMode.INDUSTRY;

    @Valid
    @NotNull
    private Sector sector = new Sector();

    @Valid
    @NotNull
    private Leader leader = new Leader();

    @Valid
    @NotNull
    private Follower follower = new Follower();

    @Valid
    @NotNull
    private TotalScoreWeights totalScoreWeights = new TotalScoreWeights();

    @Valid
    @NotNull
    private PositionSizing positionSizing = new PositionSizing();

    @Valid
    @NotNull
    private Universe universe = new Universe();

    @Valid
    @NotNull
    private Demo demo = new Demo();

    @Data
    public static class Sector {
        @NotNull
        @Positive
        private Integer momentumLookback = 5;
        @NotNull
        private Double threshAvgPct = 1.0;
        @NotNull
        private Double threshUpRatio = 0.6;
        @NotNull
        private Double threshMomentumZ = 0.5;
        @NotNull
        @Positive
        private Integer fallbackTopK = 3;
        @Valid
        @NotNull
        private SectorWeights weights = new SectorWeights();
    }

    @Data
    public static class SectorWeights {
        @NotNull
        private Double avgPctChangeZ = 0.4;
        @NotNull
        private Double momentumZ = 0.4;
        @NotNull
        private Double upRatio = 0.2;
    }

    @Data
    public static class Leader {
        @NotNull
        private Double threshPct = 7.0;
        @NotNull
        private Double threshVolumeRatio = 2.0;
        @NotNull
        private Double threshIntradayPosition = 0.8;
        @NotNull
        @Positive
        private Integer topNPerSector = 3;
        @NotNull
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double topPctInSector = 0.0;
        @Valid
        @NotNull
        private LeaderWeights weights = new LeaderWeights();
    }

    @Data
    public static class LeaderWeights {
        @NotNull
        private Double pctChangeZ = 0.5;
        @NotNull
        private Double volumeRatioZ = 0.3;
        @NotNull
        private Double intradayPosition = 0.2;
    }

    @Data
    public static class Follower {
        @NotNull
        private Double pctChangeMin = 2.0;
        @NotNull
        private Double pctChangeMax = 6.0;
        @NotNull
        private Double volumeRatioMin = 1.2;
        @NotNull
        private Double volumeRatioMax = 3.0;
        @NotNull
        @DecimalMin("0.0")
        private Double maxDistanceToHigh = 0.05;
        @Valid
        @NotNull
        private FollowerWeights weights = new FollowerWeights();
    }

    @Data
    public static class FollowerWeights {
        @NotNull
        private Double pctChangeZ = 0.35;
        @NotNull
        private Double volumeRatioZ = 0.25;
        @NotNull
        private Double oneMinusDistanceToHigh = 0.2;
        @NotNull
        private Double intradayPosition = 0.2;
    }

    @Data
    public static class TotalScoreWeights {
        @NotNull
        private Double scoreSector = 0.3;
        @NotNull
        private Double scoreLeader = 0.3;
        @NotNull
        private Double scoreFollow = 0.4;
    }

    @Data
    public static class PositionSizing {
        @NotNull
        @Positive
        private Double capital = 1_000_000.0;
        @NotNull
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double riskPerTrade = 0.01;
        @NotNull
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double maxPositionPct = 0.2;
        @NotNull
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double stopBufferPct = 0.005;
        @NotNull
        @Positive
        private Integer roundLotSize = AppConstants.ROUND_LOT_SIZE;
    }

    /**
     * Optional floors; leave a key unset to skip that rule.
     */
    @Data
    public static class Universe {
        private Double minTurnover = 30_000_000.0;
        private Double minPrice = 10.0;
        private Double maxPrice = 1000.0;
        private Double minLiquidityScore;
        private boolean excludeLimitUp = false;
    }

    /**
     * Seeded synthetic market used by the demo runner.
     */
    @Data
    public static class Demo {
        private boolean enabled = false;
        @Positive
        private int numStocks = 220;
        @Positive
        private int numSectors = 12;
        @Positive
        private int historyDays = 40;
        private long seed = 7L;
        private String asOf;
    }

    /**
     * Convert to the immutable configuration, failing fast on any missing key.
     *
     * @throws InvalidPickerConfigException if a required key is absent or out of range
     */
    public PickerConfig toConfig() {
        Sector s = require(sector, "picker.sector");
        SectorWeights sw = require(s.getWeights(), "picker.sector.weights");
        Leader l = require(leader, "picker.leader");
        LeaderWeights lw = require(l.getWeights(), "picker.leader.weights");
        Follower f = require(follower, "picker.follower");
        FollowerWeights fw = require(f.getWeights(), "picker.follower.weights");
        TotalScoreWeights tw = require(totalScoreWeights, "picker.total-score-weights");
        PositionSizing ps = require(positionSizing, "picker.position-sizing");
        Universe u = require(universe, "picker.universe");

        int lookback = require(s.getMomentumLookback(), "picker.sector.momentum-lookback");
        if (lookback <= 0) {
            throw new InvalidPickerConfigException("picker.sector.momentum-lookback", "must be positive");
        }
        double lowPct = require(f.getPctChangeMin(), "picker.follower.pct-change-min");
        double highPct = require(f.getPctChangeMax(), "picker.follower.pct-change-max");
        if (lowPct > highPct) {
            throw new InvalidPickerConfigException("picker.follower.pct-change-min", "must not exceed pct-change-max");
        }
        double lowVol = require(f.getVolumeRatioMin(), "picker.follower.volume-ratio-min");
        double highVol = require(f.getVolumeRatioMax(), "picker.follower.volume-ratio-max");
        if (lowVol > highVol) {
            throw new InvalidPickerConfigException("picker.follower.volume-ratio-min", "must not exceed volume-ratio-max");
        }
        double capital = require(ps.getCapital(), "picker.position-sizing.capital");
        if (capital <= 0) {
            throw new InvalidPickerConfigException("picker.position-sizing.capital", "must be positive");
        }

        return new PickerConfig(
                new PickerConfig.SectorConfig(
                        lookback,
                        require(s.getThreshAvgPct(), "picker.sector.thresh-avg-pct"),
                        require(s.getThreshUpRatio(), "picker.sector.thresh-up-ratio"),
                        require(s.getThreshMomentumZ(), "picker.sector.thresh-momentum-z"),
                        new PickerConfig.SectorWeights(
                                require(sw.getAvgPctChangeZ(), "picker.sector.weights.avg-pct-change-z"),
                                require(sw.getMomentumZ(), "picker.sector.weights.momentum-z"),
                                require(sw.getUpRatio(), "picker.sector.weights.up-ratio")),
                        require(s.getFallbackTopK(), "picker.sector.fallback-top-k")),
                new PickerConfig.LeaderConfig(
                        require(l.getThreshPct(), "picker.leader.thresh-pct"),
                        require(l.getThreshVolumeRatio(), "picker.leader.thresh-volume-ratio"),
                        require(l.getThreshIntradayPosition(), "picker.leader.thresh-intraday-position"),
                        require(l.getTopNPerSector(), "picker.leader.top-n-per-sector"),
                        require(l.getTopPctInSector(), "picker.leader.top-pct-in-sector"),
                        new PickerConfig.LeaderWeights(
                                require(lw.getPctChangeZ(), "picker.leader.weights.pct-change-z"),
                                require(lw.getVolumeRatioZ(), "picker.leader.weights.volume-ratio-z"),
                                require(lw.getIntradayPosition(), "picker.leader.weights.intraday-position"))),
                new PickerConfig.FollowerConfig(
                        lowPct,
                        highPct,
                        lowVol,
                        highVol,
                        require(f.getMaxDistanceToHigh(), "picker.follower.max-distance-to-high"),
                        new PickerConfig.FollowerWeights(
                                require(fw.getPctChangeZ(), "picker.follower.weights.pct-change-z"),
                                require(fw.getVolumeRatioZ(), "picker.follower.weights.volume-ratio-z"),
                                require(fw.getOneMinusDistanceToHigh(), "picker.follower.weights.one-minus-distance-to-high"),
                                require(fw.getIntradayPosition(), "picker.follower.weights.intraday-position"))),
                new PickerConfig.TotalScoreWeights(
                        require(tw.getScoreSector(), "picker.total-score-weights.score-sector"),
                        require(tw.getScoreLeader(), "picker.total-score-weights.score-leader"),
                        require(tw.getScoreFollow(), "picker.total-score-weights.score-follow")),
                new PickerConfig.PositionSizingConfig(
                        capital,
                        require(ps.getRiskPerTrade(), "picker.position-sizing.risk-per-trade"),
                        require(ps.getMaxPositionPct(), "picker.position-sizing.max-position-pct"),
                        require(ps.getStopBufferPct(), "picker.position-sizing.stop-buffer-pct"),
                        require(ps.getRoundLotSize(), "picker.position-sizing.round-lot-size")),
                new PickerConfig.UniverseConfig(
                        u.getMinTurnover(),
                        u.getMinPrice(),
                        u.getMaxPrice(),
                        u.getMinLiquidityScore(),
                        u.isExcludeLimitUp()),
                require(fallbackPolicy, "picker.fallback-policy"),
                require(sectorMode, "picker.sector-mode")
        );
    }

    private static <T> T require(T value, String key) {
        if (value == null) {
            throw new InvalidPickerConfigException(key, "missing required config");
        }
        return value;
    }
}
