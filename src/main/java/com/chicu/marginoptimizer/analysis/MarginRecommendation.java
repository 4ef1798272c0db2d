package com.chicu.marginoptimizer.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MarginRecommendation(
        @JsonProperty("demand_id") String demandId,
        @JsonProperty("demand_name") String demandName,
        @JsonProperty("recommended_margin_pct") double recommendedMarginPct
) {}
