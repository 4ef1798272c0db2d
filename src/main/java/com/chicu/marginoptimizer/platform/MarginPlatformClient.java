package com.chicu.marginoptimizer.platform;

import com.chicu.marginoptimizer.metrics.PerformanceWindow;

/**
 * Рекламная платформа: откуда берём часовое окно и куда применяем маржу.
 */
public interface MarginPlatformClient {

    PerformanceWindow fetchHourlyWindow();

    /**
     * @param margin маржа в процентах (0-100)
     * @return true, если платформа приняла значение. Ретраев нет.
     */
    boolean updateMargin(double margin);
}
