package com.chicu.marginoptimizer.analysis;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "margin.analysis")
public class AnalysisProperties {

    /** Подстрока в Demand Name, по которой ищется control arm */
    private String controlContains = "LowMar";

    private int minImpressions = 50_000;
    private double minProfit = 50.0;
    private double maxImprDropPct = 10.0;
    private double maxSrpmDropPct = 10.0;

    /** Рекомендованный arm должен держать sRPM не ниже этого % от control */
    private double minSrpmPctOfControl = 90.0;

    /** Guardrail для вилки следующего раунда */
    private double srpmGuardrailPct = 90.0;

    /**
     * Ключ CSV в удалённом хранилище для --recommend без --csv.
     * Берётся как есть, без prefix.
     */
    private String sourceKey = "MarginT/Margin Data - S3 file_analytics_report.csv";

    /** Куда писать margin_recommendations_s3.csv / analysis_results.json */
    private String outputDir = ".";

    public AnalysisThresholds thresholds() {
        return AnalysisThresholds.builder()
                .controlContains(controlContains)
                .minImpressions(minImpressions)
                .minProfit(minProfit)
                .maxImprDropPct(maxImprDropPct)
                .maxSrpmDropPct(maxSrpmDropPct)
                .minSrpmPctOfControl(minSrpmPctOfControl)
                .build();
    }
}
