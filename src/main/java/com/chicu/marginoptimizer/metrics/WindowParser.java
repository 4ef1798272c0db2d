package com.chicu.marginoptimizer.metrics;

import java.util.Map;

/**
 * Сборка {@link PerformanceWindow} из "сырых" значений (JSON API, CSV).
 * null / пустая строка -> 0; не-число -> IllegalArgumentException (молча в 0 не превращаем).
 */
public final class WindowParser {

    private WindowParser() {}

    public static PerformanceWindow fromMap(Map<String, ?> raw) {
        if (raw == null) {
            throw new IllegalArgumentException("window is null");
        }
        return PerformanceWindow.builder()
                .margin(number("margin", raw.get("margin")))
                .impressions(number("impressions", raw.get("impressions")))
                .revenue(number("revenue", raw.get("revenue")))
                .cost(number("cost", raw.get("cost")))
                .bidRate(number("bid_rate", raw.get("bid_rate")))
                .responses(number("responses", raw.get("responses")))
                .build();
    }

    public static double number(String field, Object v) {
        if (v == null) return 0.0;
        if (v instanceof Number n) return n.doubleValue();

        String s = String.valueOf(v).trim();
        if (s.isEmpty()) return 0.0;

        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Не число в поле '" + field + "': '" + s + "'", e);
        }
    }
}
