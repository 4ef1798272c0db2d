package com.chicu.marginoptimizer.state;

import com.chicu.marginoptimizer.optimizer.HistoryEntry;
import com.chicu.marginoptimizer.optimizer.OptimizerState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * OptimizerState <-> JSON.
 *
 * <p>Decode никогда не бросает: любой мусор (не JSON, не объект, не-число в числовом поле,
 * schema_version новее нашей) -> {@code Optional.empty()}, и оптимизатор стартует с нуля.</p>
 *
 * <p>Дефолты при отсутствии полей:</p>
 * <ul>
 *     <li>baseline_srpm / baseline_bid_rate / baseline_profit -> "не задано"</li>
 *     <li>baseline_margin / last_safe_margin / current_margin -> baselineMargin из defaults</li>
 *     <li>step -> step из defaults; step <= 0 -> {@code Optional.empty()}</li>
 *     <li>history -> пусто; всегда обрезается до historyLimit (и при чтении, и при записи)</li>
 * </ul>
 */
@Slf4j
public class StateCodec {

    private final ObjectMapper om;
    private final int historyLimit;

    public StateCodec(ObjectMapper objectMapper, int historyLimit) {
        this.om = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
        this.historyLimit = historyLimit;
    }

    public String encode(OptimizerState s) {
        StateDocument doc = StateDocument.builder()
                .schemaVersion(OptimizerState.SCHEMA_VERSION)
                .baselineMargin(s.baselineMargin())
                .lastSafeMargin(s.lastSafeMargin())
                .currentMargin(s.currentMargin())
                .step(s.step())
                .baselineSrpm(s.baselineSrpm())
                .baselineBidRate(s.baselineBidRate())
                .baselineProfit(s.baselineProfit())
                .history(OptimizerState.lastN(s.history(), historyLimit).stream().map(StateCodec::toEntry).toList())
                .updatedAt(s.updatedAt())
                .build();

        try {
            return om.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize optimizer state: " + e.getMessage(), e);
        }
    }

    public Optional<OptimizerState> decode(String blob, OptimizerState defaults) {
        if (blob == null || blob.isBlank()) {
            return Optional.empty();
        }

        StateDocument doc;
        try {
            doc = om.readValue(blob, StateDocument.class);
        } catch (Exception e) {
            log.warn("⚠️ Optimizer state is not parseable: {}", e.getMessage());
            return Optional.empty();
        }

        if (doc == null) {
            return Optional.empty();
        }

        // нет версии = документ старого формата, он совместим с v1
        int version = doc.getSchemaVersion() != null ? doc.getSchemaVersion() : OptimizerState.SCHEMA_VERSION;
        if (version > OptimizerState.SCHEMA_VERSION) {
            log.warn("⚠️ Optimizer state schema_version={} is newer than supported {}", version, OptimizerState.SCHEMA_VERSION);
            return Optional.empty();
        }

        // шаг <= 0 развернул бы поиск вниз от baseline: такой документ считаем битым
        double step = nz(doc.getStep(), defaults.step());
        if (!(step > 0)) {
            log.warn("⚠️ Optimizer state step={} is not positive", step);
            return Optional.empty();
        }

        double margin0 = nz(doc.getBaselineMargin(), defaults.baselineMargin());

        List<HistoryEntry> history = new ArrayList<>();
        if (doc.getHistory() != null) {
            doc.getHistory().stream()
                    .filter(Objects::nonNull)
                    .map(StateCodec::fromEntry)
                    .forEach(history::add);
        }

        return Optional.of(OptimizerState.builder()
                .schemaVersion(OptimizerState.SCHEMA_VERSION)
                .baselineMargin(margin0)
                .lastSafeMargin(nz(doc.getLastSafeMargin(), defaults.baselineMargin()))
                .currentMargin(nz(doc.getCurrentMargin(), defaults.baselineMargin()))
                .step(step)
                .baselineSrpm(doc.getBaselineSrpm())
                .baselineBidRate(doc.getBaselineBidRate())
                .baselineProfit(doc.getBaselineProfit())
                .history(OptimizerState.lastN(history, historyLimit))
                .updatedAt(doc.getUpdatedAt())
                .build());
    }

    private static StateDocument.Entry toEntry(HistoryEntry h) {
        return StateDocument.Entry.builder()
                .recordedAt(h.recordedAt())
                .margin(h.margin())
                .impressions(h.impressions())
                .revenue(h.revenue())
                .cost(h.cost())
                .bidRate(h.bidRate())
                .responses(h.responses())
                .profit(h.profit())
                .profitPer1k(h.profitPer1k())
                .revenuePer1k(h.revenuePer1k())
                .costPer1k(h.costPer1k())
                .srpm(h.srpm())
                .impressionRate(h.impressionRate())
                .build();
    }

    private static HistoryEntry fromEntry(StateDocument.Entry e) {
        return HistoryEntry.builder()
                .recordedAt(e.getRecordedAt())
                .margin(nz(e.getMargin(), 0.0))
                .impressions(nz(e.getImpressions(), 0.0))
                .revenue(nz(e.getRevenue(), 0.0))
                .cost(nz(e.getCost(), 0.0))
                .bidRate(nz(e.getBidRate(), 0.0))
                .responses(nz(e.getResponses(), 0.0))
                .profit(nz(e.getProfit(), 0.0))
                .profitPer1k(nz(e.getProfitPer1k(), 0.0))
                .revenuePer1k(nz(e.getRevenuePer1k(), 0.0))
                .costPer1k(nz(e.getCostPer1k(), 0.0))
                .srpm(nz(e.getSrpm(), 0.0))
                .impressionRate(nz(e.getImpressionRate(), 0.0))
                .build();
    }

    private static double nz(Double v, double def) {
        return v != null ? v : def;
    }
}
