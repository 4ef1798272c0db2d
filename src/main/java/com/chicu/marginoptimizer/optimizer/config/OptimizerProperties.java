package com.chicu.marginoptimizer.optimizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "margin.optimizer")
public class OptimizerProperties {

    /**
     * Локальный файл состояния (авторитетный).
     */
    private String statePath = "optimizer_state.json";

    /**
     * Отдельный файл состояния для прогонов по CSV (--csv), чтобы не портить боевое.
     */
    private String csvRunStatePath = "optimizer_state_csv_run.json";

    /**
     * local-only (false) или local + remote fallback (true).
     * Для true нужен margin.remote.base-url.
     */
    private boolean remoteStoreEnabled = false;

    /** Стартовая маржа, % */
    private double baselineMargin = 35.0;

    /** Начальный шаг исследования, п.п. */
    private double step = 1.0;

    /** Ниже этого шаг не уменьшается */
    private double minStep = 0.25;

    /** Допустимая просадка sRPM / bid rate относительно baseline, % (10 -> порог 0.9) */
    private double guardrailDropPct = 10.0;

    /** Минимальный прирост profit относительно baseline для принятия шага, % */
    private double minProfitImprovementPct = 2.0;

    /** Сколько последних окон держим в history */
    private int historyLimit = 100;
}
