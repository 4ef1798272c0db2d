package com.chicu.marginoptimizer.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Плоский JSON-документ состояния (то, что лежит в optimizer_state.json).
 * Все числа boxed: отсутствие поля отличимо от нуля, дефолты проставляет {@link StateCodec}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public class StateDocument {

    @JsonProperty("schema_version")
    private Integer schemaVersion;

    @JsonProperty("baseline_margin")
    private Double baselineMargin;

    @JsonProperty("last_safe_margin")
    private Double lastSafeMargin;

    @JsonProperty("current_margin")
    private Double currentMargin;

    @JsonProperty("step")
    private Double step;

    @JsonProperty("baseline_srpm")
    private Double baselineSrpm;

    @JsonProperty("baseline_bid_rate")
    private Double baselineBidRate;

    @JsonProperty("baseline_profit")
    private Double baselineProfit;

    @JsonProperty("history")
    private List<Entry> history;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {

        @JsonProperty("recorded_at")
        private Instant recordedAt;

        @JsonProperty("margin")
        private Double margin;

        @JsonProperty("impressions")
        private Double impressions;

        @JsonProperty("revenue")
        private Double revenue;

        @JsonProperty("cost")
        private Double cost;

        @JsonProperty("bid_rate")
        private Double bidRate;

        @JsonProperty("responses")
        private Double responses;

        @JsonProperty("profit")
        private Double profit;

        @JsonProperty("profit_per_1k")
        private Double profitPer1k;

        @JsonProperty("revenue_per_1k")
        private Double revenuePer1k;

        @JsonProperty("cost_per_1k")
        private Double costPer1k;

        @JsonProperty("srpm")
        private Double srpm;

        @JsonProperty("impression_rate")
        private Double impressionRate;
    }
}
