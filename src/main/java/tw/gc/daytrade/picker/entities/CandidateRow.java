package tw.gc.daytrade.picker.entities;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One output row: a follower paired with its sector's best leader, scored
 * and sized.
 *
 * <p>{@code suggestStop}, {@code positionValue}, {@code shares} and
 * {@code lots} are {@code null} when no valid stop exists for the row.
 */
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({
        "trade_date", "stock_id", "leader_id", "sector_id",
        "score_sector", "score_leader", "score_follow", "score_total",
        "suggest_entry", "suggest_stop", "position_value", "shares", "lots"
})
public record CandidateRow(
        @JsonProperty("trade_date") LocalDate tradeDate,
        @JsonProperty("stock_id") String stockId,
        @JsonProperty("leader_id") String leaderId,
        @JsonProperty("sector_id") String sectorId,
        @JsonProperty("score_sector") double scoreSector,
        @JsonProperty("score_leader") double scoreLeader,
        @JsonProperty("score_follow") double scoreFollow,
        @JsonProperty("score_total") double scoreTotal,
        @JsonProperty("suggest_entry") double suggestEntry,
        @JsonProperty("suggest_stop") Double suggestStop,
        @JsonProperty("position_value") Double positionValue,
        @JsonProperty("shares") Long shares,
        @JsonProperty("lots") Long lots
) {

    /**
     * Output schema, in column order. Empty results carry this same schema.
     */
    public static final List<String> COLUMNS = List.of(
            "trade_date",
            "stock_id",
            "leader_id",
            "sector_id",
            "score_sector",
            "score_leader",
            "score_follow",
            "score_total",
            "suggest_entry",
            "suggest_stop",
            "position_value",
            "shares",
            "lots"
    );

    public Map<String, Object> toColumnMap() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("trade_date", tradeDate);
        row.put("stock_id", stockId);
        row.put("leader_id", leaderId);
        row.put("sector_id", sectorId);
        row.put("score_sector", scoreSector);
        row.put("score_leader", scoreLeader);
        row.put("score_follow", scoreFollow);
        row.put("score_total", scoreTotal);
        row.put("suggest_entry", suggestEntry);
        row.put("suggest_stop", suggestStop);
        row.put("position_value", positionValue);
        row.put("shares", shares);
        row.put("lots", lots);
        return row;
    }
}
