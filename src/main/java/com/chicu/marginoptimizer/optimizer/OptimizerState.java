package com.chicu.marginoptimizer.optimizer;

import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Персистентное состояние оптимизатора (один экземпляр на arm).
 * Неизменяемое: каждый шаг {@link MarginOptimizer} строит новый экземпляр через toBuilder().
 */
@Builder(toBuilder = true)
public record OptimizerState(
        int schemaVersion,

        double baselineMargin,        // с чем стартовали, дальше не меняется

        // null = baseline ещё не зафиксирован (до первого окна)
        Double baselineSrpm,
        Double baselineBidRate,
        Double baselineProfit,

        double lastSafeMargin,
        double currentMargin,
        double step,

        List<HistoryEntry> history,
        Instant updatedAt
) {

    public static final int SCHEMA_VERSION = 1;

    public OptimizerState {
        history = history == null ? List.of() : List.copyOf(history);
    }

    /**
     * Свежее состояние: все маржи = baselineMargin, baseline метрик нет.
     */
    public static OptimizerState fresh(double baselineMargin, double step) {
        return OptimizerState.builder()
                .schemaVersion(SCHEMA_VERSION)
                .baselineMargin(baselineMargin)
                .lastSafeMargin(baselineMargin)
                .currentMargin(baselineMargin)
                .step(step)
                .history(List.of())
                .build();
    }

    public boolean hasBaseline() {
        return baselineSrpm != null && baselineBidRate != null && baselineProfit != null;
    }

    /**
     * Добавить запись и оставить только последние {@code limit}.
     */
    public OptimizerState withHistoryEntry(HistoryEntry entry, int limit) {
        List<HistoryEntry> next = new ArrayList<>(history.size() + 1);
        next.addAll(history);
        next.add(entry);
        return toBuilder().history(lastN(next, limit)).build();
    }

    public static <T> List<T> lastN(List<T> list, int limit) {
        if (list == null) return List.of();
        int n = Math.max(0, limit);
        if (list.size() <= n) return list;
        return list.subList(list.size() - n, list.size());
    }
}
