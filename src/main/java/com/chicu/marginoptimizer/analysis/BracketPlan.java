package com.chicu.marginoptimizer.analysis;

import lombok.Builder;

import java.util.List;

/**
 * План следующего раунда: вилка маржи вокруг arm-а с максимальной маржой.
 *
 * @param armsByMargin   arm-ы по возрастанию маржи
 * @param srpmRatioPct   sRPM лучшего arm-а в процентах от control (или от arm-а с минимальной маржой)
 * @param recommendations по одной на arm, в порядке armsByMargin
 */
@Builder
public record BracketPlan(
        List<ArmMetrics> armsByMargin,
        List<TrendStep> trend,
        boolean profitStillGrowing,
        double avgMarginGap,
        ArmMetrics bestArm,
        double srpmRatioPct,
        double srpmGuardrailPct,
        List<MarginRecommendation> recommendations
) {

    public BracketPlan {
        armsByMargin = armsByMargin == null ? List.of() : List.copyOf(armsByMargin);
        trend = trend == null ? List.of() : List.copyOf(trend);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public boolean srpmGuardrailPassed() {
        return srpmRatioPct >= srpmGuardrailPct;
    }
}
