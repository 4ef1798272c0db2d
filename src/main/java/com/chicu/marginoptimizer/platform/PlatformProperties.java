package com.chicu.marginoptimizer.platform;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "margin.platform")
public class PlatformProperties {

    /**
     * GET -> JSON окна {impressions, revenue, cost, bid_rate, responses, margin}.
     * Пусто = mock-данные.
     */
    private String metricsUrl = "";

    /**
     * POST {"margin": x}. Пусто = mock (только лог).
     */
    private String updateMarginUrl = "";

    private String apiKey = "";

    private long connectTimeoutMs = 2000;
    private long readTimeoutMs = 10000;
}
