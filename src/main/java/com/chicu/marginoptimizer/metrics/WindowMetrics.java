package com.chicu.marginoptimizer.metrics;

import lombok.Builder;

/**
 * Окно + его производные метрики (то, что видит оптимизатор).
 */
@Builder
public record WindowMetrics(
        double margin,
        double impressions,
        double responses,
        double bidRate,

        double profit,
        double profitPer1k,
        double revenuePer1k,
        double costPer1k,
        double srpm,
        double impressionRate
) {}
