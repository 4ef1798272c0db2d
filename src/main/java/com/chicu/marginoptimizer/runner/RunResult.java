package com.chicu.marginoptimizer.runner;

import com.chicu.marginoptimizer.optimizer.MarginDecision;
import lombok.Builder;

/**
 * Итог одного тика: окно -> решение -> применение -> аудит.
 */
@Builder
public record RunResult(
        double currentMargin,
        double nextMargin,
        MarginDecision decision,
        boolean applied,
        boolean runLogged
) {}
