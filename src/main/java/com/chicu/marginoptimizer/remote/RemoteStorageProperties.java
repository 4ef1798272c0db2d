package com.chicu.marginoptimizer.remote;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "margin.remote")
public class RemoteStorageProperties {

    /**
     * Базовый URL объектного хранилища (bucket endpoint / gateway).
     * Пусто = удалённое хранилище выключено.
     * Пример: https://storage.example.com/my-bucket
     */
    private String baseUrl = "";

    /**
     * Префикс ключей внутри bucket.
     */
    private String prefix = "margin-optimizer/";

    /**
     * Bearer-токен (если gateway требует).
     */
    private String apiKey = "";

    private long connectTimeoutMs = 2000;
    private long readTimeoutMs = 10000;

    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
