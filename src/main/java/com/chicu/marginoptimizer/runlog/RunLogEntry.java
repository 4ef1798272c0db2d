package com.chicu.marginoptimizer.runlog;

import com.chicu.marginoptimizer.metrics.PerformanceWindow;
import com.chicu.marginoptimizer.optimizer.DecisionType;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;

/**
 * Аудит одного запуска: что было, что предложили, применилось ли.
 */
@Builder
public record RunLogEntry(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("current_margin") double currentMargin,
        @JsonProperty("next_margin") double nextMargin,
        @JsonProperty("decision") DecisionType decision,
        @JsonProperty("metrics") PerformanceWindow metrics,
        @JsonProperty("success") boolean success
) {}
