package com.chicu.marginoptimizer.analysis;

import lombok.Builder;

/**
 * Пороги анализа. Значения по умолчанию совпадают с CLI.
 */
@Builder(toBuilder = true)
public record AnalysisThresholds(
        String controlContains,
        int minImpressions,
        double minProfit,
        double maxImprDropPct,
        double maxSrpmDropPct,
        double minSrpmPctOfControl
) {

    public static AnalysisThresholds defaults() {
        return AnalysisThresholds.builder()
                .controlContains(null)
                .minImpressions(50_000)
                .minProfit(50.0)
                .maxImprDropPct(10.0)
                .maxSrpmDropPct(10.0)
                .minSrpmPctOfControl(90.0)
                .build();
    }
}
