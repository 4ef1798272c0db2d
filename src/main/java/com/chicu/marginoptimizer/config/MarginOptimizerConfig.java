package com.chicu.marginoptimizer.config;

import com.chicu.marginoptimizer.analysis.AnalysisProperties;
import com.chicu.marginoptimizer.analysis.AnalyticsCsvReader;
import com.chicu.marginoptimizer.analysis.BracketRecommender;
import com.chicu.marginoptimizer.analysis.MarginTestAnalyzer;
import com.chicu.marginoptimizer.analysis.RecommendationWriter;
import com.chicu.marginoptimizer.optimizer.config.OptimizerProperties;
import com.chicu.marginoptimizer.platform.HttpMarginPlatformClient;
import com.chicu.marginoptimizer.platform.MarginPlatformClient;
import com.chicu.marginoptimizer.platform.PlatformProperties;
import com.chicu.marginoptimizer.remote.BlobStorage;
import com.chicu.marginoptimizer.remote.HttpBlobStorage;
import com.chicu.marginoptimizer.remote.RemoteStorageProperties;
import com.chicu.marginoptimizer.runlog.BlobRunLogSink;
import com.chicu.marginoptimizer.runlog.NoopRunLogSink;
import com.chicu.marginoptimizer.runlog.RunLogSink;
import com.chicu.marginoptimizer.state.StateCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties({
        OptimizerProperties.class,
        RemoteStorageProperties.class,
        PlatformProperties.class,
        AnalysisProperties.class
})
public class MarginOptimizerConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Без margin.remote.base-url remote выключен целиком: state только локально, run log не пишется.
     */
    @Bean
    @ConditionalOnMissingBean
    public BlobStorage blobStorage(OkHttpClient okHttpClient, RemoteStorageProperties props) {
        if (!props.isConfigured()) {
            log.info("☁️ Remote storage disabled (margin.remote.base-url is empty)");
            return BlobStorage.disabled();
        }
        log.info("☁️ Remote storage: {} prefix={}", props.getBaseUrl(), props.getPrefix());
        return new HttpBlobStorage(okHttpClient, props);
    }

    @Bean
    @ConditionalOnMissingBean
    public RunLogSink runLogSink(BlobStorage blobStorage, ObjectMapper om) {
        return blobStorage.enabled() ? new BlobRunLogSink(blobStorage, om) : new NoopRunLogSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public MarginPlatformClient marginPlatformClient(OkHttpClient okHttpClient, ObjectMapper om, PlatformProperties props) {
        return new HttpMarginPlatformClient(okHttpClient, om, props);
    }

    @Bean
    public StateCodec stateCodec(ObjectMapper om, OptimizerProperties props) {
        return new StateCodec(om, props.getHistoryLimit());
    }

    @Bean
    public AnalyticsCsvReader analyticsCsvReader() {
        return new AnalyticsCsvReader();
    }

    @Bean
    public MarginTestAnalyzer marginTestAnalyzer() {
        return new MarginTestAnalyzer();
    }

    @Bean
    public BracketRecommender bracketRecommender() {
        return new BracketRecommender();
    }

    @Bean
    public RecommendationWriter recommendationWriter(BlobStorage blobStorage, ObjectMapper om) {
        return new RecommendationWriter(blobStorage, om);
    }
}
