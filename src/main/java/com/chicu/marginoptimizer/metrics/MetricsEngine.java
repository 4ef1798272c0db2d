package com.chicu.marginoptimizer.metrics;

import org.jetbrains.annotations.Contract;

/**
 * Единственный источник производных метрик (profit, per-1k, sRPM, impression rate).
 * Используется и CSV-анализом, и оптимизатором: больше нигде эти формулы не считаются.
 */
public final class MetricsEngine {

    private MetricsEngine() {}

    /**
     * Никогда не бросает исключений: знаменатель <= 0 заменяется на 1
     * (отдельно для impressions и для responses).
     */
    @Contract(pure = true)
    public static DerivedMetrics derive(double impressions, double revenue, double cost, double responses) {
        double denomImpr = impressions > 0 ? impressions : 1.0;
        double denomResp = responses > 0 ? responses : 1.0;

        double profit = revenue - cost;

        // порядок операций важен: сначала деление, потом *1000
        double profitPer1k = (profit / denomImpr) * 1000.0;
        double revenuePer1k = (revenue / denomImpr) * 1000.0;
        double costPer1k = (cost / denomImpr) * 1000.0;
        double srpm = (revenue / denomImpr) * 1000.0;
        double impressionRate = impressions / denomResp;

        return new DerivedMetrics(profit, profitPer1k, revenuePer1k, costPer1k, srpm, impressionRate);
    }

    @Contract(pure = true)
    public static WindowMetrics windowMetrics(PerformanceWindow w) {
        DerivedMetrics d = derive(w.impressions(), w.revenue(), w.cost(), w.responses());

        return WindowMetrics.builder()
                .margin(w.margin())
                .impressions(w.impressions())
                .responses(w.responses())
                .bidRate(w.bidRate())
                .profit(d.profit())
                .profitPer1k(d.profitPer1k())
                .revenuePer1k(d.revenuePer1k())
                .costPer1k(d.costPer1k())
                .srpm(d.srpm())
                .impressionRate(d.impressionRate())
                .build();
    }
}
