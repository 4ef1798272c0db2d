package com.chicu.marginoptimizer.optimizer.guard;

import com.chicu.marginoptimizer.metrics.WindowMetrics;
import com.chicu.marginoptimizer.optimizer.OptimizerState;

/**
 * Guardrails: sRPM и bid rate окна не должны просесть больше чем на dropPct% от baseline.
 * Оба условия обязательны.
 */
public final class MarginGuardrail {

    private final double threshold;

    public MarginGuardrail(double guardrailDropPct) {
        this.threshold = 1.0 - (guardrailDropPct / 100.0);
    }

    public GuardDecision check(WindowMetrics wm, OptimizerState state) {
        if (state == null || !state.hasBaseline()) {
            return GuardDecision.notEvaluated();
        }

        double srpmFloor = threshold * nz(state.baselineSrpm());
        double bidRateFloor = threshold * nz(state.baselineBidRate());

        boolean srpmOk = wm.srpm() >= srpmFloor;
        boolean bidRateOk = wm.bidRate() >= bidRateFloor;

        if (srpmOk && bidRateOk) {
            return GuardDecision.allow(threshold);
        }

        StringBuilder why = new StringBuilder("guardrail failed:");
        if (!srpmOk) {
            why.append(" srpm=").append(wm.srpm()).append(" < ").append(srpmFloor);
        }
        if (!bidRateOk) {
            why.append(" bidRate=").append(wm.bidRate()).append(" < ").append(bidRateFloor);
        }
        return GuardDecision.deny(srpmOk, bidRateOk, threshold, why.toString());
    }

    private static double nz(Double v) {
        return v != null ? v : 0.0;
    }
}
