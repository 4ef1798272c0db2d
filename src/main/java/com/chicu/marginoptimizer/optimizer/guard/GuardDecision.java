package com.chicu.marginoptimizer.optimizer.guard;

import lombok.Builder;

/**
 * Вердикт guardrail-проверки окна против baseline.
 */
@Builder
public record GuardDecision(
        boolean allowed,
        boolean srpmOk,
        boolean bidRateOk,
        double threshold,     // 0.9 при просадке 10%
        String reason
) {
    public static GuardDecision allow(double threshold) {
        return GuardDecision.builder()
                .allowed(true)
                .srpmOk(true)
                .bidRateOk(true)
                .threshold(threshold)
                .reason("OK")
                .build();
    }

    public static GuardDecision deny(boolean srpmOk, boolean bidRateOk, double threshold, String reason) {
        return GuardDecision.builder()
                .allowed(false)
                .srpmOk(srpmOk)
                .bidRateOk(bidRateOk)
                .threshold(threshold)
                .reason(reason)
                .build();
    }

    /**
     * Для cold start: сравнивать ещё не с чем.
     */
    public static GuardDecision notEvaluated() {
        return GuardDecision.builder()
                .allowed(true)
                .srpmOk(true)
                .bidRateOk(true)
                .threshold(Double.NaN)
                .reason("baseline not set")
                .build();
    }
}
