package com.chicu.marginoptimizer.analysis;

import com.chicu.marginoptimizer.remote.BlobStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Пишет рекомендации (CSV) и сводку анализа (JSON), затем загружает их в удалённое хранилище.
 */
@Slf4j
public class RecommendationWriter {

    public static final String CSV_NAME = "margin_recommendations_s3.csv";
    public static final String JSON_NAME = "analysis_results.json";

    private static final CsvSchema RECOMMENDATION_SCHEMA = CsvSchema.builder()
            .addColumn("demand_id")
            .addColumn("demand_name")
            .addNumberColumn("recommended_margin_pct")
            .setUseHeader(true)
            .build();

    private final BlobStorage storage;
    private final ObjectMapper om;
    private final CsvMapper csvMapper = new CsvMapper();

    public RecommendationWriter(BlobStorage storage, ObjectMapper objectMapper) {
        this.storage = storage;
        this.om = objectMapper.copy().configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    public byte[] recommendationsCsv(List<MarginRecommendation> recs) {
        List<Map<String, Object>> rows = new ArrayList<>(recs.size());
        for (MarginRecommendation r : recs) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("demand_id", r.demandId());
            row.put("demand_name", r.demandName());
            row.put("recommended_margin_pct", r.recommendedMarginPct());
            rows.add(row);
        }
        try {
            return csvMapper.writer(RECOMMENDATION_SCHEMA)
                    .with(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                    .writeValueAsBytes(rows);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot write recommendations CSV: " + e.getMessage(), e);
        }
    }

    public Map<String, Object> analysisSummary(String sourceFile, int hourUsed, AnalysisReport report, BracketPlan plan) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("source_file", sourceFile);
        out.put("hour_used", hourUsed);
        out.put("winner", report.winner().name());
        out.put("recommended", report.recommendedName());

        List<Map<String, Object>> arms = new ArrayList<>();
        for (ArmMetrics m : report.arms()) {
            Map<String, Object> a = new LinkedHashMap<>();
            a.put("name", m.name());
            a.put("margin_pct", m.marginPct());
            a.put("impressions", (long) m.impressions());
            a.put("profit", round4(m.profit()));
            a.put("profit_per_1k", round4(m.profitPer1k()));
            a.put("srpm", round4(m.srpm()));
            arms.add(a);
        }
        out.put("arms", arms);
        out.put("recommendations", plan.recommendations());
        return out;
    }

    public RecommendationOutput write(Path outputDir, String sourceFile, int hourUsed,
                                      AnalysisReport report, BracketPlan plan) {
        byte[] csv = recommendationsCsv(plan.recommendations());
        byte[] json;
        try {
            json = om.writeValueAsBytes(analysisSummary(sourceFile, hourUsed, report, plan));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot write analysis JSON: " + e.getMessage(), e);
        }

        Path csvFile = outputDir.resolve(CSV_NAME);
        Path jsonFile = outputDir.resolve(JSON_NAME);
        try {
            Files.createDirectories(outputDir);
            Files.write(csvFile, csv);
            Files.write(jsonFile, json);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot write recommendations to " + outputDir + ": " + e.getMessage(), e);
        }
        log.info("💾 Recommendations saved: {}, {}", csvFile, jsonFile);

        if (!storage.enabled()) {
            log.info("Remote storage disabled, upload skipped");
            return new RecommendationOutput(csvFile, jsonFile, List.of());
        }

        String csvKey = storage.keyFor(CSV_NAME);
        String jsonKey = storage.keyFor(JSON_NAME);
        storage.put(csvKey, csv, "text/csv");
        storage.put(jsonKey, json, "application/json");
        log.info("☁️ Uploaded {} and {}", csvKey, jsonKey);

        return new RecommendationOutput(csvFile, jsonFile, List.of(csvKey, jsonKey));
    }

    static double round4(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return v;
        return BigDecimal.valueOf(v).setScale(4, RoundingMode.HALF_EVEN).doubleValue();
    }
}
