package tw.gc.daytrade.picker.config;

/**
 * Which relaxations the picker may apply when a stage comes out empty.
 *
 * <p>Only {@link #STRICT} should be used for real decisioning. The relaxed
 * variants keep dry runs and experiments from stalling on empty intermediate
 * sets and produce heuristic picks, not strict signals.
 */
public enum FallbackPolicy {

    /**
     * No relaxation at any stage. Empty stages yield an empty result.
     */
    STRICT(false, false, false, false),

    /**
     * Sectors with no strict leader take their top percentile by pct_change.
     * Needs {@code leader.top-pct-in-sector > 0} to have any effect.
     */
    LEADER_PERCENTILE(false, true, false, false),

    /**
     * Demo / dry-run mode: every relaxation is reachable.
     */
    PERMISSIVE(true, true, true, true);

    private final boolean sectorTopK;
    private final boolean leaderPercentile;
    private final boolean leaderWholeSector;
    private final boolean followerRelaxation;

    FallbackPolicy(boolean sectorTopK, boolean leaderPercentile, boolean leaderWholeSector, boolean followerRelaxation) {
        this.sectorTopK = sectorTopK;
        this.leaderPercentile = leaderPercentile;
        this.leaderWholeSector = leaderWholeSector;
        this.followerRelaxation = followerRelaxation;
    }

    public boolean allowsSectorTopK() {
        return sectorTopK;
    }

    public boolean allowsLeaderPercentile() {
        return leaderPercentile;
    }

    public boolean allowsLeaderWholeSector() {
        return leaderWholeSector;
    }

    public boolean allowsFollowerRelaxation() {
        return followerRelaxation;
    }
}
