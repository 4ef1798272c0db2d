package com.chicu.marginoptimizer.optimizer;

import com.chicu.marginoptimizer.metrics.PerformanceWindow;
import com.chicu.marginoptimizer.metrics.WindowMetrics;
import lombok.Builder;

import java.time.Instant;

/**
 * Запись аудита: окно + посчитанные метрики. Логика решений её не читает.
 */
@Builder
public record HistoryEntry(
        Instant recordedAt,

        double margin,
        double impressions,
        double revenue,
        double cost,
        double bidRate,
        double responses,

        double profit,
        double profitPer1k,
        double revenuePer1k,
        double costPer1k,
        double srpm,
        double impressionRate
) {

    public static HistoryEntry of(PerformanceWindow w, WindowMetrics m, Instant at) {
        return HistoryEntry.builder()
                .recordedAt(at)
                .margin(w.margin())
                .impressions(w.impressions())
                .revenue(w.revenue())
                .cost(w.cost())
                .bidRate(w.bidRate())
                .responses(w.responses())
                .profit(m.profit())
                .profitPer1k(m.profitPer1k())
                .revenuePer1k(m.revenuePer1k())
                .costPer1k(m.costPer1k())
                .srpm(m.srpm())
                .impressionRate(m.impressionRate())
                .build();
    }
}
