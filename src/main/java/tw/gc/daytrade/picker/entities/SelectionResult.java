package tw.gc.daytrade.picker.entities;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Everything one evaluation produced: the ranked candidates plus the
 * intermediate tables they were derived from.
 */
public record SelectionResult(
        LocalDate tradeDate,
        List<CandidateRow> candidates,
        List<DailyFeatures> features,
        List<SectorDailyAggregate> sectorDaily,
        List<StrongSector> strongSectors
) {

    public SelectionResult {
        Objects.requireNonNull(tradeDate, "tradeDate");
        candidates = List.copyOf(candidates);
        features = List.copyOf(features);
        sectorDaily = List.copyOf(sectorDaily);
        strongSectors = List.copyOf(strongSectors);
    }

    public static SelectionResult empty(LocalDate tradeDate,
                                        List<DailyFeatures> features,
                                        List<SectorDailyAggregate> sectorDaily,
                                        List<StrongSector> strongSectors) {
        return new SelectionResult(tradeDate, List.of(), features, sectorDaily, strongSectors);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public List<String> columns() {
        return CandidateRow.COLUMNS;
    }
}
