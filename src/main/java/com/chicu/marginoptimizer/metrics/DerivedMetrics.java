package com.chicu.marginoptimizer.metrics;

/**
 * Производные KPI окна. Считаются только через {@link MetricsEngine#derive}.
 * revenuePer1k и srpm всегда равны, но хранятся отдельно.
 */
public record DerivedMetrics(
        double profit,
        double profitPer1k,
        double revenuePer1k,
        double costPer1k,
        double srpm,
        double impressionRate
) {}
