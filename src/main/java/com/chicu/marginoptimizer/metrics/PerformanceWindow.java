package com.chicu.marginoptimizer.metrics;

import lombok.Builder;

/**
 * Одно окно наблюдения (обычно час) для одного arm.
 * Все поля уже числовые: пустые/отсутствующие значения обнуляет тот, кто окно собирает.
 */
@Builder(toBuilder = true)
public record PerformanceWindow(
        double margin,       // %, маржа, при которой получено окно
        double impressions,
        double revenue,
        double cost,
        double bidRate,      // %
        double responses
) {}
