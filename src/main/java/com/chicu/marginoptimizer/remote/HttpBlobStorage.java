package com.chicu.marginoptimizer.remote;

import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Blob storage поверх HTTP: GET / PUT {baseUrl}/{key}.
 * Подходит для S3-совместимых gateway и простых object-store эндпоинтов.
 */
@Slf4j
public class HttpBlobStorage implements BlobStorage {

    private final OkHttpClient http;
    private final HttpUrl baseUrl;
    private final RemoteStorageProperties props;

    public HttpBlobStorage(OkHttpClient baseClient, RemoteStorageProperties props) {
        this.props = props;
        this.baseUrl = HttpUrl.get(props.getBaseUrl().replaceAll("/+$", ""));
        this.http = baseClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(200, props.getConnectTimeoutMs())))
                .readTimeout(Duration.ofMillis(Math.max(500, props.getReadTimeoutMs())))
                .build();
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public Optional<byte[]> get(String key) {
        Request req = request(key).get().build();

        try (Response resp = http.newCall(req).execute()) {
            if (resp.code() == 404) {
                return Optional.empty();
            }
            byte[] body = resp.body() != null ? resp.body().bytes() : new byte[0];
            if (!resp.isSuccessful()) {
                throw new IllegalStateException("Remote GET " + key + " HTTP " + resp.code() + ": " + shrink(new String(body, StandardCharsets.UTF_8)));
            }
            return Optional.of(body);
        } catch (IOException e) {
            throw new IllegalStateException("Remote GET " + key + " IO error: " + e.getMessage(), e);
        }
    }

    @Override
    public void put(String key, byte[] body, String contentType) {
        MediaType type = MediaType.parse(contentType != null ? contentType : "application/octet-stream");
        Request req = request(key).put(RequestBody.create(body, type)).build();

        try (Response resp = http.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                String respBody = resp.body() != null ? resp.body().string() : "";
                throw new IllegalStateException("Remote PUT " + key + " HTTP " + resp.code() + ": " + shrink(respBody));
            }
            log.debug("☁️ PUT {} ({} bytes)", key, body.length);
        } catch (IOException e) {
            throw new IllegalStateException("Remote PUT " + key + " IO error: " + e.getMessage(), e);
        }
    }

    @Override
    public String keyFor(String name) {
        String prefix = props.getPrefix() == null ? "" : props.getPrefix().trim().replaceAll("/+$", "");
        return prefix.isEmpty() ? name : prefix + "/" + name;
    }

    private Request.Builder request(String key) {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegments(key.replaceAll("^/+", ""))
                .build();

        Request.Builder rb = new Request.Builder().url(url);

        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            rb.header("Authorization", "Bearer " + props.getApiKey().trim());
        }
        return rb;
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        if (x.length() <= 300) return x;
        return x.substring(0, 300) + "...";
    }
}
