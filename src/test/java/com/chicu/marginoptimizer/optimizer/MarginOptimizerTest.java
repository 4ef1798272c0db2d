package com.chicu.marginoptimizer.optimizer;

import com.chicu.marginoptimizer.metrics.PerformanceWindow;
import com.chicu.marginoptimizer.optimizer.config.OptimizerProperties;
import com.chicu.marginoptimizer.state.InMemoryStateStore;
import com.chicu.marginoptimizer.state.StateCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class MarginOptimizerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T10:00:00Z"), ZoneOffset.UTC);

    private OptimizerProperties props;
    private InMemoryStateStore store;
    private StateCodec codec;

    @BeforeEach
    void setUp() {
        props = new OptimizerProperties();
        store = new InMemoryStateStore();
        codec = new StateCodec(new ObjectMapper(), props.getHistoryLimit());
    }

    private MarginOptimizer optimizer() {
        return new MarginOptimizer(props, store, codec, CLOCK);
    }

    private static PerformanceWindow window(double margin, double revenue, double cost) {
        return PerformanceWindow.builder()
                .margin(margin)
                .impressions(55_000)
                .revenue(revenue)
                .cost(cost)
                .bidRate(1.5)
                .responses(28_000)
                .build();
    }

    @Test
    void decide_shouldInitBaseline_onColdStart() {
        MarginOptimizer opt = optimizer();

        MarginDecision d = opt.decide(window(35, 25.0, 16.0));

        assertEquals(DecisionType.COLD_START, d.type());
        assertEquals(36.0, d.nextMargin());

        OptimizerState s = opt.state();
        assertEquals(25.0 / 55_000 * 1000.0, s.baselineSrpm(), 1e-12);
        assertEquals(0.4545, s.baselineSrpm(), 1e-4);
        assertEquals(1.5, s.baselineBidRate());
        assertEquals(9.0, s.baselineProfit());
        assertEquals(35.0, s.lastSafeMargin());
        assertEquals(36.0, s.currentMargin());
        assertEquals(1.0, s.step());
    }

    @Test
    void decide_shouldRollback_whenSrpmDropsBelowGuardrail() {
        MarginOptimizer opt = optimizer();
        opt.decide(window(35, 25.0, 16.0));

        // sRPM 0.3636 < 0.9 * 0.4545
        MarginDecision d = opt.decide(window(36, 20.0, 16.0));

        assertEquals(DecisionType.ROLLBACK, d.type());
        assertEquals(35.0, d.nextMargin());
        assertEquals(0.5, d.step());
        assertFalse(d.guard().allowed());
        assertFalse(d.guard().srpmOk());
        assertTrue(d.guard().bidRateOk());
        assertEquals(0.5, opt.state().step());
        // baseline не трогаем
        assertEquals(9.0, opt.state().baselineProfit());
    }

    @Test
    void decide_shouldRollback_whenBidRateDrops() {
        MarginOptimizer opt = optimizer();
        opt.decide(window(35, 25.0, 16.0));

        PerformanceWindow lowBid = window(36, 26.0, 16.0).toBuilder().bidRate(1.0).build();
        MarginDecision d = opt.decide(lowBid);

        assertEquals(DecisionType.ROLLBACK, d.type());
        assertFalse(d.guard().bidRateOk());
        assertEquals(35.0, d.nextMargin());
    }

    @Test
    void decide_shouldAcceptAndReanchor_whenProfitImproves() {
        MarginOptimizer opt = optimizer();
        opt.decide(window(35, 25.0, 16.0));

        // profit 9.5 vs 9.0 -> +5.6%
        MarginDecision d = opt.decide(window(36, 25.5, 16.0));

        assertEquals(DecisionType.ACCEPT, d.type());
        assertEquals(37.0, d.nextMargin());
        assertEquals(1.0, d.step());
        assertNotNull(d.profitImprovementPct());
        assertTrue(d.profitImprovementPct() >= 2.0);

        OptimizerState s = opt.state();
        assertEquals(36.0, s.lastSafeMargin());
        assertEquals(9.5, s.baselineProfit());
        assertEquals(25.5 / 55_000 * 1000.0, s.baselineSrpm(), 1e-12);
    }

    @Test
    void decide_shouldHold_whenImprovementTooSmall() {
        MarginOptimizer opt = optimizer();
        opt.decide(window(35, 25.0, 16.0));

        // profit 9.1 vs 9.0 -> +1.1% < 2%
        MarginDecision d = opt.decide(window(36, 25.1, 16.0));

        assertEquals(DecisionType.HOLD, d.type());
        assertTrue(d.rejected());
        assertEquals(35.0, d.nextMargin());
        assertEquals(0.5, d.step());
        assertEquals(9.0, opt.state().baselineProfit());
    }

    @Test
    void decide_shouldNotShrinkStepBelowMinStep() {
        MarginOptimizer opt = optimizer();
        opt.decide(window(35, 25.0, 16.0));

        assertEquals(0.5, opt.decide(window(36, 20.0, 16.0)).step());
        assertEquals(0.25, opt.decide(window(35, 20.0, 16.0)).step());
        assertEquals(0.25, opt.decide(window(35, 20.0, 16.0)).step());
    }

    @Test
    void decide_shouldAccept_whenBaselineProfitNotPositive() {
        MarginOptimizer opt = optimizer();
        opt.decide(window(35, 10.0, 16.0));
        assertEquals(-6.0, opt.state().baselineProfit());

        // sRPM тот же, profit > 0 -> считаем как +100%
        MarginDecision d = opt.decide(window(36, 10.0, 9.0));

        assertEquals(DecisionType.ACCEPT, d.type());
        assertEquals(100.0, d.profitImprovementPct());
        assertEquals(37.0, d.nextMargin());
    }

    @Test
    void profitImprovementPct_shouldHandleNonPositiveBaseline() {
        assertEquals(100.0, MarginOptimizer.profitImprovementPct(1.0, 0.0));
        assertEquals(0.0, MarginOptimizer.profitImprovementPct(-1.0, -5.0));
        assertEquals(0.0, MarginOptimizer.profitImprovementPct(0.0, null));
        assertEquals(50.0, MarginOptimizer.profitImprovementPct(15.0, 10.0), 1e-9);
    }

    @Test
    void decide_shouldPersistState_andReloadIt() {
        MarginOptimizer first = optimizer();
        first.decide(window(35, 25.0, 16.0));

        // ingest + решение = два сохранения
        assertEquals(2, store.saveCount());

        MarginOptimizer second = optimizer();
        assertEquals(36.0, second.state().currentMargin());
        assertTrue(second.state().hasBaseline());
        assertEquals(1, second.state().history().size());
        assertEquals(CLOCK.instant(), second.state().updatedAt());
    }

    @Test
    void decide_shouldCapHistory() {
        props.setHistoryLimit(3);
        codec = new StateCodec(new ObjectMapper(), 3);
        MarginOptimizer opt = optimizer();

        for (int i = 0; i < 5; i++) {
            opt.decide(window(35 + i, 25.0, 16.0));
        }

        assertEquals(3, opt.state().history().size());
        assertEquals(37.0, opt.state().history().get(0).margin());
        assertEquals(39.0, opt.state().history().get(2).margin());
    }

    @Test
    void constructor_shouldStartFresh_whenStateMalformed() {
        store = new InMemoryStateStore("{ not json");

        MarginOptimizer opt = optimizer();

        assertFalse(opt.state().hasBaseline());
        assertEquals(35.0, opt.state().currentMargin());
        assertEquals(1.0, opt.state().step());
        assertEquals(DecisionType.COLD_START, opt.decide(window(35, 25.0, 16.0)).type());
    }

    @Test
    void constructor_shouldRejectNonPositiveStep() {
        props.setStep(0);
        assertThrows(IllegalArgumentException.class, this::optimizer);

        props.setStep(1.0);
        props.setMinStep(-1);
        assertThrows(IllegalArgumentException.class, this::optimizer);

        // minStep больше step: откат увеличил бы шаг
        props.setStep(0.1);
        props.setMinStep(0.25);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, this::optimizer);
        assertTrue(e.getMessage().startsWith("minStep must be <= step"));

        props.setMinStep(0.1);
        assertEquals(0.1, optimizer().state().step());
    }

    @Test
    void constructor_shouldStartFresh_whenStoredStepNotPositive() {
        store = new InMemoryStateStore("{\"step\": -5, \"baseline_srpm\": 0.4545, \"baseline_bid_rate\": 1.5,"
                + " \"baseline_profit\": 9.0, \"last_safe_margin\": 35}");

        MarginOptimizer opt = optimizer();

        assertFalse(opt.state().hasBaseline());
        assertEquals(1.0, opt.state().step());

        MarginDecision d = opt.decide(window(35, 26.0, 16.0));
        assertEquals(DecisionType.COLD_START, d.type());
        assertEquals(36.0, d.nextMargin());
    }

    @Test
    void decide_shouldAccept_whenImprovementEqualsMinimum() {
        props.setMinProfitImprovementPct(50.0);
        MarginOptimizer opt = optimizer();
        opt.decide(window(35, 24.0, 16.0));
        assertEquals(8.0, opt.state().baselineProfit());

        // profit 12 vs 8 -> ровно +50%
        MarginDecision d = opt.decide(window(36, 28.0, 16.0));

        assertEquals(DecisionType.ACCEPT, d.type());
        assertEquals(50.0, d.profitImprovementPct());
        assertEquals(37.0, d.nextMargin());
        assertEquals(36.0, opt.state().lastSafeMargin());
    }

    @Test
    void decide_shouldUseConfiguredGuardrailDrop() {
        props.setGuardrailDropPct(50.0);
        MarginOptimizer opt = optimizer();
        opt.decide(window(35, 24.0, 16.0));

        // sRPM ровно вдвое ниже baseline: при 50% проходит guardrail, profit упал -> HOLD
        MarginDecision d = opt.decide(window(36, 12.0, 16.0));

        assertEquals(DecisionType.HOLD, d.type());
        assertTrue(d.guard().allowed());
        assertEquals(0.5, d.guard().threshold());

        // ниже половины -> откат
        MarginDecision r = opt.decide(window(35, 11.0, 16.0));
        assertEquals(DecisionType.ROLLBACK, r.type());
        assertFalse(r.guard().srpmOk());
    }

    @Test
    void decide_shouldBeDeterministic_forSameStateAndWindow() {
        String blob = codec.encode(OptimizerState.fresh(35.0, 1.0).toBuilder()
                .baselineSrpm(25.0 / 55_000 * 1000.0)
                .baselineBidRate(1.5)
                .baselineProfit(9.0)
                .currentMargin(36.0)
                .build());

        MarginOptimizer a = new MarginOptimizer(props, new InMemoryStateStore(blob), codec, CLOCK);
        MarginOptimizer b = new MarginOptimizer(props, new InMemoryStateStore(blob), codec, CLOCK);

        MarginDecision da = a.decide(window(36, 25.5, 16.0));
        MarginDecision db = b.decide(window(36, 25.5, 16.0));

        assertEquals(DecisionType.ACCEPT, da.type());
        assertEquals(da.type(), db.type());
        assertEquals(da.nextMargin(), db.nextMargin());
        assertEquals(da.step(), db.step());
        assertEquals(a.state(), b.state());
    }

    @Test
    void suggestNextMargin_shouldReturnDecisionMargin() {
        assertEquals(36.0, optimizer().suggestNextMargin(window(35, 25.0, 16.0)));
    }
}
