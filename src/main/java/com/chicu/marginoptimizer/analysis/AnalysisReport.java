package com.chicu.marginoptimizer.analysis;

import lombok.Builder;

import java.util.List;
import java.util.Optional;

/**
 * Результат анализа CSV.
 *
 * @param arms        arm-ы, отсортированные по profit/1k по убыванию
 * @param control     control arm (null, если не задан или не найден)
 * @param recommended победитель с учётом sRPM guardrail; null = оставить control
 * @param guardrailWarnings пусто, если control не задан
 */
@Builder
public record AnalysisReport(
        List<ArmMetrics> arms,
        ArmMetrics winner,
        ArmMetrics control,
        ArmMetrics recommended,
        DataSufficiency sufficiency,
        List<String> guardrailWarnings,
        AnalysisThresholds thresholds
) {

    public AnalysisReport {
        arms = arms == null ? List.of() : List.copyOf(arms);
        guardrailWarnings = guardrailWarnings == null ? List.of() : List.copyOf(guardrailWarnings);
    }

    public Optional<ArmMetrics> controlArm() {
        return Optional.ofNullable(control);
    }

    public Optional<ArmMetrics> recommendedArm() {
        return Optional.ofNullable(recommended);
    }

    /**
     * Имя рекомендованного arm-а; если никто не прошёл guardrail, то control, иначе "N/A".
     */
    public String recommendedName() {
        if (recommended != null) return recommended.name();
        if (control != null) return control.name();
        return "N/A";
    }
}
