package com.chicu.marginoptimizer.analysis;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Рекомендации маржи на следующий раунд теста по кросс-arm тренду прибыли.
 * Для трёх arm-ов вилка получается: ниже лучшего / на уровне лучшего / выше лучшего.
 */
@Slf4j
public class BracketRecommender {

    public BracketPlan recommend(List<ArmMetrics> metrics, List<ArmRow> rows, ArmMetrics control, double srpmGuardrailPct) {
        if (metrics == null || metrics.isEmpty()) {
            throw new IllegalArgumentException("No arms to build a bracket from");
        }

        List<ArmMetrics> byMargin = new ArrayList<>(metrics);
        byMargin.sort(Comparator.comparingDouble(ArmMetrics::marginPct));

        List<TrendStep> trend = new ArrayList<>();
        for (int i = 1; i < byMargin.size(); i++) {
            ArmMetrics prev = byMargin.get(i - 1);
            ArmMetrics curr = byMargin.get(i);

            double marginGap = curr.marginPct() - prev.marginPct();
            double profitGap = curr.profitPer1k() - prev.profitPer1k();
            double perPoint = marginGap > 0 ? profitGap / marginGap : 0.0;

            trend.add(new TrendStep(prev.name(), prev.marginPct(), curr.name(), curr.marginPct(),
                    marginGap, profitGap, perPoint));
        }

        boolean stillGrowing = !trend.isEmpty() && trend.stream().allMatch(s -> s.profitPerPoint() > 0);

        ArmMetrics lowest = byMargin.get(0);
        ArmMetrics best = byMargin.get(byMargin.size() - 1);

        double avgGap = (best.marginPct() - lowest.marginPct()) / Math.max(byMargin.size() - 1, 1);

        double baseSrpm = control != null ? control.srpm() : lowest.srpm();
        double srpmRatio = baseSrpm > 0 ? best.srpm() / baseSrpm * 100.0 : 100.0;

        Map<String, ArmRow> rowByName = new HashMap<>();
        for (ArmRow r : rows) {
            rowByName.put(r.demandName() == null ? "" : r.demandName().trim(), r);
        }
        ArmRow fallback = rows.isEmpty() ? null : rows.get(0);

        List<MarginRecommendation> recs = new ArrayList<>(byMargin.size());
        for (int i = 0; i < byMargin.size(); i++) {
            ArmMetrics m = byMargin.get(i);
            ArmRow row = rowByName.getOrDefault(m.name(), fallback);
            String demandId = row == null || row.demandId() == null ? "" : row.demandId();

            // rint: до целого процента, половины к чётному
            double next = Math.rint(best.marginPct() + (i - 1) * avgGap);

            recs.add(new MarginRecommendation(demandId, m.name(), next));
            log.info("🎯 BRACKET {}: current={}% -> recommended={}%", m.name(), m.marginPct(), next);
        }

        log.info("🎯 BRACKET best={} ({}%) growing={} avgGap={} srpmRatio={}% (guardrail >= {}%)",
                best.name(), best.marginPct(), stillGrowing, avgGap, srpmRatio, srpmGuardrailPct);

        return BracketPlan.builder()
                .armsByMargin(byMargin)
                .trend(trend)
                .profitStillGrowing(stillGrowing)
                .avgMarginGap(avgGap)
                .bestArm(best)
                .srpmRatioPct(srpmRatio)
                .srpmGuardrailPct(srpmGuardrailPct)
                .recommendations(recs)
                .build();
    }
}
