package com.chicu.marginoptimizer.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    /**
     * 🌐 Общий OkHttpClient: платформа и удалённое хранилище.
     * Таймауты каждый клиент подстраивает сам через newBuilder().
     */
    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .readTimeout(Duration.ofSeconds(15))
                .writeTimeout(Duration.ofSeconds(15))
                .retryOnConnectionFailure(true)
                .build();
    }
}
