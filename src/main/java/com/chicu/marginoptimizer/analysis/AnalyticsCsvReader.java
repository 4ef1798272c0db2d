package com.chicu.marginoptimizer.analysis;

import com.chicu.marginoptimizer.metrics.WindowParser;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Чтение аналитической CSV-выгрузки (колонки как в отчёте платформы: "Demand Name", "Margin %", ...).
 * Отсутствующая колонка или пустое значение -> 0; не-число -> IllegalArgumentException.
 */
@Slf4j
public class AnalyticsCsvReader {

    public static final String DEMAND_NAME = "Demand Name";
    public static final String DEMAND_ID = "Demand ID";
    public static final String HOUR = "Hour";
    public static final String COST = "Cost";
    public static final String REVENUE = "Revenue";
    public static final String MARGIN = "Margin %";
    public static final String BID_RATE = "Demand Bid Rate %";
    public static final String RESPONSES = "Supply Responses";
    public static final String IMPRESSIONS = "Supply Impressions";
    public static final String WIN_RATE = "Demand Win Rate %";
    public static final String SUPPLY_BIDFLOOR = "Supply Bidfloor";
    public static final String OUR_BIDFLOOR = "Our Bidfloor";
    public static final String DEMAND_ECPM = "Demand eCPM";

    private final CsvMapper csvMapper = new CsvMapper();

    public List<ArmRow> read(Path csv) {
        try (Reader r = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
            return read(r, csv.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read CSV " + csv + ": " + e.getMessage(), e);
        }
    }

    public List<ArmRow> read(Reader reader, String source) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();

        List<Map<String, String>> raw;
        try (MappingIterator<Map<String, String>> it = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(reader)) {
            raw = it.readAll();
        }

        if (raw.isEmpty()) {
            throw new IllegalArgumentException("CSV contains no data rows.");
        }

        List<ArmRow> rows = new ArrayList<>(raw.size());
        for (Map<String, String> r : raw) {
            rows.add(toRow(normalizeKeys(r)));
        }

        log.debug("📄 CSV {}: {} rows", source, rows.size());
        return rows;
    }

    /**
     * Первая строка, где Demand Name содержит подстроку (без учёта регистра).
     */
    public static ArmRow findArm(List<ArmRow> rows, String armContains) {
        String needle = armContains == null ? "" : armContains.toLowerCase(Locale.ROOT);
        return rows.stream()
                .filter(r -> r.demandName() != null && r.demandName().toLowerCase(Locale.ROOT).contains(needle))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No row matching '" + armContains + "'"));
    }

    /**
     * Оставить только строки последнего часа, в котором были показы.
     */
    public static List<ArmRow> lastHourWithData(List<ArmRow> rows) {
        int lastHour = lastHour(rows);
        return rows.stream().filter(r -> r.hour() == lastHour).toList();
    }

    public static int lastHour(List<ArmRow> rows) {
        return rows.stream()
                .filter(r -> r.impressions() > 0)
                .mapToInt(ArmRow::hour)
                .max()
                .orElseThrow(() -> new IllegalArgumentException("CSV has no hour with impressions"));
    }

    private static ArmRow toRow(Map<String, String> r) {
        return ArmRow.builder()
                .demandName(text(r.get(DEMAND_NAME)))
                .demandId(text(r.get(DEMAND_ID)))
                .hour((int) num(r, HOUR))
                .impressions(num(r, IMPRESSIONS))
                .responses(num(r, RESPONSES))
                .cost(num(r, COST))
                .revenue(num(r, REVENUE))
                .marginPct(num(r, MARGIN))
                .bidRatePct(num(r, BID_RATE))
                .winRatePct(num(r, WIN_RATE))
                .supplyBidfloor(num(r, SUPPLY_BIDFLOOR))
                .ourBidfloor(num(r, OUR_BIDFLOOR))
                .demandEcpm(num(r, DEMAND_ECPM))
                .build();
    }

    private static double num(Map<String, String> r, String column) {
        return WindowParser.number(column, r.get(column));
    }

    private static String text(String v) {
        return v == null ? "" : v.trim();
    }

    private static Map<String, String> normalizeKeys(Map<String, String> r) {
        Map<String, String> out = new HashMap<>(r.size());
        r.forEach((k, v) -> out.put(k == null ? "" : k.replace("\uFEFF", "").trim(), v));
        return out;
    }
}
