package com.chicu.marginoptimizer.analysis;

import com.chicu.marginoptimizer.metrics.DerivedMetrics;
import com.chicu.marginoptimizer.metrics.MetricsEngine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Анализ A/B теста маржи по агрегированным строкам CSV.
 * Статистическую значимость по таким данным не посчитать: только KPI, пороги и guardrails.
 */
@Slf4j
public class MarginTestAnalyzer {

    static final String UNNAMED = "<unnamed>";

    private static final Comparator<ArmMetrics> BY_PROFIT_PER_1K = Comparator.comparingDouble(ArmMetrics::profitPer1k);

    public List<ArmMetrics> computeMetrics(List<ArmRow> rows) {
        List<ArmMetrics> out = new ArrayList<>(rows.size());

        for (ArmRow r : rows) {
            DerivedMetrics d = MetricsEngine.derive(r.impressions(), r.revenue(), r.cost(), r.responses());

            String name = r.demandName() == null ? "" : r.demandName().trim();

            out.add(ArmMetrics.builder()
                    .name(name.isEmpty() ? UNNAMED : name)
                    .demandId(r.demandId() == null ? "" : r.demandId())
                    .impressions(r.impressions())
                    .responses(r.responses())
                    .marginPct(r.marginPct())
                    .winRatePct(r.winRatePct())
                    .profit(d.profit())
                    .profitPer1k(d.profitPer1k())
                    .revenuePer1k(d.revenuePer1k())
                    .costPer1k(d.costPer1k())
                    .impressionRate(d.impressionRate())
                    .ourBidfloor(r.ourBidfloor())
                    .supplyBidfloor(r.supplyBidfloor())
                    .demandEcpm(r.demandEcpm())
                    .srpm(d.srpm())
                    .build());
        }
        return out;
    }

    /**
     * Максимальный profit/1k среди всех arm-ов. При равенстве берётся первый.
     */
    public ArmMetrics pickWinner(List<ArmMetrics> ms) {
        if (ms == null || ms.isEmpty()) {
            throw new IllegalArgumentException("No arms to pick a winner from");
        }
        ArmMetrics best = ms.get(0);
        for (ArmMetrics m : ms) {
            if (m.profitPer1k() > best.profitPer1k()) best = m;
        }
        return best;
    }

    public Optional<ArmMetrics> findControl(List<ArmMetrics> ms, String controlContains) {
        if (controlContains == null || controlContains.isEmpty()) {
            return Optional.empty();
        }
        String needle = controlContains.toLowerCase(Locale.ROOT);
        return ms.stream()
                .filter(m -> m.name().toLowerCase(Locale.ROOT).contains(needle))
                .findFirst();
    }

    /**
     * Лучший profit/1k среди arm-ов, у которых sRPM не ниже pct% от control.
     * Без control (или при sRPM control <= 0) берём обычного победитель.
     * Empty = никто не прошёл, оставляем control.
     */
    public Optional<ArmMetrics> pickRecommendedWinner(List<ArmMetrics> ms, ArmMetrics control, double minSrpmPctOfControl) {
        if (control == null || control.srpm() <= 0) {
            return Optional.of(pickWinner(ms));
        }

        double threshold = control.srpm() * (minSrpmPctOfControl / 100.0);

        List<ArmMetrics> qualified = ms.stream()
                .filter(m -> m.srpm() >= threshold)
                .toList();

        if (qualified.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(pickWinner(qualified));
    }

    public DataSufficiency assessEnoughData(List<ArmMetrics> ms, int minImpressions, double minProfit) {
        List<String> reasons = new ArrayList<>();

        for (ArmMetrics m : ms) {
            if (m.impressions() < minImpressions) {
                reasons.add(String.format(Locale.ROOT, "'%s': impressions %d < min %d",
                        m.name(), (long) m.impressions(), minImpressions));
            }
            if (m.profit() < minProfit) {
                reasons.add(String.format(Locale.ROOT, "'%s': profit $%.4f < min $%.4f",
                        m.name(), m.profit(), minProfit));
            }
        }
        return new DataSufficiency(reasons.isEmpty(), reasons);
    }

    /**
     * Предупреждения по просадке показов и sRPM относительно control.
     * Проверка пропускается, если соответствующее значение control равно 0.
     */
    public List<String> assessGuardrailsVsControl(List<ArmMetrics> ms, ArmMetrics control,
                                                  double maxImprDropPct, double maxSrpmDropPct) {
        List<String> warnings = new ArrayList<>();

        for (ArmMetrics m : ms) {
            if (m.name().equals(control.name())) continue;

            if (control.impressions() > 0) {
                double drop = (control.impressions() - m.impressions()) / control.impressions() * 100.0;
                if (drop > maxImprDropPct) {
                    warnings.add(String.format(Locale.ROOT,
                            "Guardrail: '%s' impressions drop %.1f%% vs control (>%.1f%%)", m.name(), drop, maxImprDropPct));
                }
            }
            if (control.srpm() > 0) {
                double drop = (control.srpm() - m.srpm()) / control.srpm() * 100.0;
                if (drop > maxSrpmDropPct) {
                    warnings.add(String.format(Locale.ROOT,
                            "Guardrail: '%s' sRPM drop %.1f%% vs control (>%.1f%%)", m.name(), drop, maxSrpmDropPct));
                }
            }
        }
        return warnings;
    }

    public AnalysisReport analyze(List<ArmRow> rows, AnalysisThresholds t) {
        List<ArmMetrics> ms = computeMetrics(rows);

        List<ArmMetrics> sorted = new ArrayList<>(ms);
        sorted.sort(BY_PROFIT_PER_1K.reversed());

        ArmMetrics winner = pickWinner(sorted);
        ArmMetrics control = findControl(ms, t.controlContains()).orElse(null);

        ArmMetrics recommended = control == null
                ? winner
                : pickRecommendedWinner(ms, control, t.minSrpmPctOfControl()).orElse(null);

        List<String> warnings = control == null
                ? List.of()
                : assessGuardrailsVsControl(ms, control, t.maxImprDropPct(), t.maxSrpmDropPct());

        DataSufficiency sufficiency = assessEnoughData(ms, t.minImpressions(), t.minProfit());

        log.info("📊 ANALYSIS arms={} winner={} control={} recommended={} enoughData={}",
                ms.size(),
                winner.name(),
                control == null ? "-" : control.name(),
                recommended == null ? "KEEP_CONTROL" : recommended.name(),
                sufficiency.ok());

        return AnalysisReport.builder()
                .arms(sorted)
                .winner(winner)
                .control(control)
                .recommended(recommended)
                .sufficiency(sufficiency)
                .guardrailWarnings(warnings)
                .thresholds(t)
                .build();
    }
}
