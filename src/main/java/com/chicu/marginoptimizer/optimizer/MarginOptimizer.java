package com.chicu.marginoptimizer.optimizer;

import com.chicu.marginoptimizer.metrics.MetricsEngine;
import com.chicu.marginoptimizer.metrics.PerformanceWindow;
import com.chicu.marginoptimizer.metrics.WindowMetrics;
import com.chicu.marginoptimizer.optimizer.config.OptimizerProperties;
import com.chicu.marginoptimizer.optimizer.guard.GuardDecision;
import com.chicu.marginoptimizer.optimizer.guard.MarginGuardrail;
import com.chicu.marginoptimizer.state.StateCodec;
import com.chicu.marginoptimizer.state.StateStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;

/**
 * Максимизирует суммарный profit, не давая sRPM и bid rate просесть
 * больше чем на guardrailDropPct% от baseline. Safe hill-climb с откатом:
 * <ol>
 *     <li>ingest: метрики окна -> history -> сохранить</li>
 *     <li>cold start: первое окно становится baseline, предлагаем margin + step</li>
 *     <li>guardrails не прошли -> откат на lastSafeMargin, шаг / 2</li>
 *     <li>profit вырос на >= minProfitImprovementPct% -> новый baseline, margin + step;
 *     иначе откат на lastSafeMargin, шаг / 2</li>
 * </ol>
 * Шаг только уменьшается (не ниже minStep). Исследуем только вверх от baseline.
 *
 * <p>Не потокобезопасен: один вызов decide на arm за раз обеспечивает вызывающий.</p>
 */
@Slf4j
public class MarginOptimizer {

    private final double baselineMargin;
    private final double initialStep;
    private final double minStep;
    private final double minProfitImprovementPct;
    private final int historyLimit;

    private final MarginGuardrail guardrail;
    private final StateStore store;
    private final StateCodec codec;
    private final Clock clock;

    private OptimizerState state;

    public MarginOptimizer(OptimizerProperties props, StateStore store, StateCodec codec) {
        this(props, store, codec, Clock.systemUTC());
    }

    public MarginOptimizer(OptimizerProperties props, StateStore store, StateCodec codec, Clock clock) {
        if (!(props.getStep() > 0)) {
            throw new IllegalArgumentException("step must be > 0, got " + props.getStep());
        }
        if (!(props.getMinStep() > 0)) {
            throw new IllegalArgumentException("minStep must be > 0, got " + props.getMinStep());
        }
        // иначе первый же откат увеличит шаг до minStep
        if (props.getMinStep() > props.getStep()) {
            throw new IllegalArgumentException("minStep must be <= step, got minStep=" + props.getMinStep()
                    + " step=" + props.getStep());
        }

        // копируем: дальше настройки не зависят от мутабельного properties-бина
        this.baselineMargin = props.getBaselineMargin();
        this.initialStep = props.getStep();
        this.minStep = props.getMinStep();
        this.minProfitImprovementPct = props.getMinProfitImprovementPct();
        this.historyLimit = Math.max(1, props.getHistoryLimit());

        this.guardrail = new MarginGuardrail(props.getGuardrailDropPct());
        this.store = store;
        this.codec = codec;
        this.clock = clock;

        this.state = loadState();
    }

    public OptimizerState state() {
        return state;
    }

    /**
     * Обработать окно и вернуть маржу для следующего окна.
     */
    public double suggestNextMargin(PerformanceWindow window) {
        return decide(window).nextMargin();
    }

    public MarginDecision decide(PerformanceWindow window) {
        WindowMetrics wm = ingest(window);
        double margin = window.margin();

        // =========================================================
        // cold start: baseline из первого окна
        // =========================================================
        if (!state.hasBaseline()) {
            state = state.toBuilder()
                    .baselineSrpm(wm.srpm())
                    .baselineBidRate(wm.bidRate())
                    .baselineProfit(wm.profit())
                    .lastSafeMargin(margin)
                    .currentMargin(margin + state.step())
                    .build();
            persist();

            return logged(MarginDecision.builder()
                    .type(DecisionType.COLD_START)
                    .windowMargin(margin)
                    .nextMargin(state.currentMargin())
                    .step(state.step())
                    .metrics(wm)
                    .guard(GuardDecision.notEvaluated())
                    .reason("baseline initialized")
                    .build());
        }

        // =========================================================
        // guardrails
        // =========================================================
        GuardDecision guard = guardrail.check(wm, state);
        if (!guard.allowed()) {
            state = state.toBuilder()
                    .currentMargin(state.lastSafeMargin())
                    .step(shrink(state.step()))
                    .build();
            persist();

            return logged(MarginDecision.builder()
                    .type(DecisionType.ROLLBACK)
                    .windowMargin(margin)
                    .nextMargin(state.currentMargin())
                    .step(state.step())
                    .metrics(wm)
                    .guard(guard)
                    .reason(guard.reason())
                    .build());
        }

        // =========================================================
        // profit improvement
        // =========================================================
        double improvement = profitImprovementPct(wm.profit(), state.baselineProfit());

        if (improvement >= minProfitImprovementPct) {
            state = state.toBuilder()
                    .lastSafeMargin(margin)
                    .baselineSrpm(wm.srpm())
                    .baselineBidRate(wm.bidRate())
                    .baselineProfit(wm.profit())
                    .currentMargin(margin + state.step())
                    .build();
            persist();

            return logged(MarginDecision.builder()
                    .type(DecisionType.ACCEPT)
                    .windowMargin(margin)
                    .nextMargin(state.currentMargin())
                    .step(state.step())
                    .profitImprovementPct(improvement)
                    .metrics(wm)
                    .guard(guard)
                    .reason("profit improved " + improvement + "% >= " + minProfitImprovementPct + "%")
                    .build());
        }

        state = state.toBuilder()
                .currentMargin(state.lastSafeMargin())
                .step(shrink(state.step()))
                .build();
        persist();

        return logged(MarginDecision.builder()
                .type(DecisionType.HOLD)
                .windowMargin(margin)
                .nextMargin(state.currentMargin())
                .step(state.step())
                .profitImprovementPct(improvement)
                .metrics(wm)
                .guard(guard)
                .reason("profit improvement " + improvement + "% < " + minProfitImprovementPct + "%")
                .build());
    }

    /**
     * Прирост profit к baseline в %. При baseline <= 0 делить нельзя:
     * 100% если окно в плюсе, иначе 0%.
     */
    static double profitImprovementPct(double profit, Double baselineProfit) {
        double base = baselineProfit != null ? baselineProfit : 0.0;
        if (base > 0) {
            return (profit - base) / base * 100.0;
        }
        return profit > 0 ? 100.0 : 0.0;
    }

    // =====================================================================
    // ingest / persistence
    // =====================================================================

    private WindowMetrics ingest(PerformanceWindow window) {
        WindowMetrics wm = MetricsEngine.windowMetrics(window);

        state = state.withHistoryEntry(HistoryEntry.of(window, wm, clock.instant()), historyLimit);
        // окно фиксируем сразу, даже если решение дальше не будет принято
        persist();
        return wm;
    }

    private OptimizerState loadState() {
        OptimizerState fresh = OptimizerState.fresh(baselineMargin, initialStep);

        Optional<String> blob = store.load();
        if (blob.isEmpty()) {
            log.info("🧠 No optimizer state in {}, starting fresh baseline={} step={}",
                    store.describe(), baselineMargin, initialStep);
            return fresh;
        }

        return codec.decode(blob.get(), fresh)
                .map(s -> {
                    log.info("🧠 Optimizer state loaded from {}: current={} lastSafe={} step={} baseline={}",
                            store.describe(), s.currentMargin(), s.lastSafeMargin(), s.step(), s.hasBaseline());
                    return s;
                })
                .orElseGet(() -> {
                    log.warn("⚠️ Optimizer state in {} is malformed, starting fresh baseline={} step={}",
                            store.describe(), baselineMargin, initialStep);
                    return fresh;
                });
    }

    private void persist() {
        state = state.toBuilder().updatedAt(clock.instant()).build();
        store.save(codec.encode(state));
    }

    private double shrink(double step) {
        return Math.max(step / 2, minStep);
    }

    private static MarginDecision logged(MarginDecision d) {
        WindowMetrics m = d.metrics();
        log.info("🧠 MARGIN {} window={} -> next={} step={} srpm={} bidRate={} profit={} reason={}",
                d.type(), d.windowMargin(), d.nextMargin(), d.step(),
                m.srpm(), m.bidRate(), m.profit(), d.reason());
        return d;
    }
}
