package com.chicu.marginoptimizer.analysis;

import java.util.Locale;

/**
 * Текстовый отчёт для консоли.
 */
public final class AnalysisReportPrinter {

    private AnalysisReportPrinter() {}

    public static String format(AnalysisReport r) {
        StringBuilder sb = new StringBuilder();
        AnalysisThresholds t = r.thresholds();

        sb.append("Derived KPIs (sorted by profit/1k impressions):\n");
        for (ArmMetrics m : r.arms()) {
            sb.append(f("- %s\n", m.name()));
            sb.append(f("  impressions=%d responses=%d impression_rate=%.4f%%\n",
                    (long) m.impressions(), (long) m.responses(), m.impressionRate() * 100.0));
            sb.append(f("  margin%%=%.2f win%%=%.2f\n", m.marginPct(), m.winRatePct()));
            sb.append(f("  profit=%.4f profit/1k=%.4f rev/1k=%.4f cost/1k=%.4f\n",
                    m.profit(), m.profitPer1k(), m.revenuePer1k(), m.costPer1k()));
            sb.append(f("  our_bidfloor=%.2f supply_bidfloor=%.2f demand_eCPM=%.2f sRPM=%.4f\n",
                    m.ourBidfloor(), m.supplyBidfloor(), m.demandEcpm(), m.srpm()));
        }

        ArmMetrics w = r.winner();
        sb.append("\nWinner by profit/1k impressions:\n");
        sb.append(f("- %s (profit/1k=%.4f, profit=%.4f, margin%%=%.2f)\n",
                w.name(), w.profitPer1k(), w.profit(), w.marginPct()));

        sb.append("\nRecommendation (profit + sRPM guardrail):\n");
        ArmMetrics control = r.control();
        if (control == null) {
            sb.append(f("- No control specified; raw winner = %s\n", w.name()));
        } else if (r.recommended() != null) {
            ArmMetrics rec = r.recommended();
            double vsControl = control.srpm() > 0 ? rec.srpm() / control.srpm() * 100.0 : 100.0;
            sb.append(f("- RECOMMEND: %s\n", rec.name()));
            sb.append(f("  Reason: highest profit among arms with sRPM at/above %.0f%% of control.\n",
                    t.minSrpmPctOfControl()));
            sb.append(f("  sRPM=%.4f (%.1f%% of control) - supply/revenue performance preserved.\n",
                    rec.srpm(), vsControl));
        } else {
            sb.append(f("- KEEP CONTROL: %s\n", control.name()));
            sb.append(f("  Reason: no arm has sRPM >= %.0f%% of control. Winner (%s) would hurt supply performance.\n",
                    t.minSrpmPctOfControl(), w.name()));
        }

        sb.append("\nEnough data check:\n");
        if (r.sufficiency().ok()) {
            sb.append("- PASS: meets minimum per-arm thresholds\n");
        } else {
            sb.append("- FAIL: not enough data yet\n");
            r.sufficiency().reasons().forEach(reason -> sb.append("  - ").append(reason).append('\n'));
        }

        if (control == null) {
            sb.append("\nGuardrails vs control: skipped (no control arm provided)\n");
        } else {
            sb.append("\nGuardrails vs control:\n");
            if (r.guardrailWarnings().isEmpty()) {
                sb.append("- OK\n");
            } else {
                r.guardrailWarnings().forEach(x -> sb.append("- ").append(x).append('\n'));
            }
        }

        sb.append("\nNote: aggregated rows give no statistical significance.\n")
                .append("For real stopping rules, export event-level or time-bucketed data (per hour/day) per arm.\n");

        return sb.toString();
    }

    private static String f(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
