package com.chicu.marginoptimizer.platform;

import com.chicu.marginoptimizer.metrics.PerformanceWindow;
import com.chicu.marginoptimizer.metrics.WindowParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Клиент к generic HTTP эндпоинтам платформы.
 * Пока URL не заданы, работает на mock-данных (удобно гонять оптимизатор локально).
 */
@Slf4j
public class HttpMarginPlatformClient implements MarginPlatformClient {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    static final PerformanceWindow MOCK_WINDOW = PerformanceWindow.builder()
            .impressions(55_000)
            .revenue(25.0)
            .cost(16.0)
            .bidRate(1.5)
            .responses(28_000)
            .margin(35)
            .build();

    private final OkHttpClient http;
    private final ObjectMapper objectMapper;
    private final PlatformProperties props;

    public HttpMarginPlatformClient(OkHttpClient baseClient, ObjectMapper objectMapper, PlatformProperties props) {
        this.objectMapper = objectMapper;
        this.props = props;
        this.http = baseClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(200, props.getConnectTimeoutMs())))
                .readTimeout(Duration.ofMillis(Math.max(500, props.getReadTimeoutMs())))
                .build();
    }

    @Override
    public PerformanceWindow fetchHourlyWindow() {
        if (isBlank(props.getMetricsUrl())) {
            log.info("[MOCK] metrics-url not set, using mock window {}", MOCK_WINDOW);
            return MOCK_WINDOW;
        }

        Request req = authorized(new Request.Builder().url(props.getMetricsUrl().trim()).get()).build();

        try (Response resp = http.newCall(req).execute()) {
            String body = resp.body() != null ? resp.body().string() : "";

            if (!resp.isSuccessful()) {
                throw new IllegalStateException("Metrics API HTTP " + resp.code() + ": " + shrink(body));
            }
            if (body.isBlank()) {
                throw new IllegalStateException("Metrics API пустой ответ");
            }

            Map<String, Object> raw = objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {});
            return WindowParser.fromMap(raw);

        } catch (IOException e) {
            throw new IllegalStateException("Metrics API IO error: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean updateMargin(double margin) {
        if (isBlank(props.getUpdateMarginUrl())) {
            log.info("[MOCK] Would update margin to {}% (no update-margin-url set)", margin);
            return true;
        }

        try {
            String json = objectMapper.writeValueAsString(Map.of("margin", margin));

            Request req = authorized(new Request.Builder()
                    .url(props.getUpdateMarginUrl().trim())
                    .post(RequestBody.create(json, JSON)))
                    .build();

            try (Response resp = http.newCall(req).execute()) {
                if (!resp.isSuccessful()) {
                    String body = resp.body() != null ? resp.body().string() : "";
                    log.warn("⚠️ Update margin HTTP {} body={}", resp.code(), shrink(body));
                    return false;
                }
                return true;
            }
        } catch (IOException e) {
            log.warn("⚠️ Update margin to {}% failed: {}", margin, e.getMessage());
            return false;
        }
    }

    private Request.Builder authorized(Request.Builder rb) {
        if (!isBlank(props.getApiKey())) {
            rb.header("Authorization", "Bearer " + props.getApiKey().trim());
        }
        return rb;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        if (x.length() <= 400) return x;
        return x.substring(0, 400) + "...";
    }
}
