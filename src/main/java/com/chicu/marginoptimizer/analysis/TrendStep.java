package com.chicu.marginoptimizer.analysis;

/**
 * Переход между соседними (по марже) arm-ами.
 * profitPerPoint = 0, если разрыв по марже не положительный.
 */
public record TrendStep(
        String fromName,
        double fromMarginPct,
        String toName,
        double toMarginPct,
        double marginGap,
        double profitGap,
        double profitPerPoint
) {}
