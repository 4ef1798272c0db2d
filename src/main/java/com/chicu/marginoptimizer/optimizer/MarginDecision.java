package com.chicu.marginoptimizer.optimizer;

import com.chicu.marginoptimizer.metrics.WindowMetrics;
import com.chicu.marginoptimizer.optimizer.guard.GuardDecision;
import lombok.Builder;

@Builder
public record MarginDecision(
        DecisionType type,
        double windowMargin,           // маржа, на которой получено окно
        double nextMargin,             // что применять дальше
        double step,                   // шаг после решения
        Double profitImprovementPct,   // null для COLD_START / ROLLBACK
        WindowMetrics metrics,
        GuardDecision guard,
        String reason
) {

    public boolean rejected() {
        return type == DecisionType.ROLLBACK || type == DecisionType.HOLD;
    }
}
