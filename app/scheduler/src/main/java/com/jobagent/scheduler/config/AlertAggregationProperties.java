/*
 * Where: Scheduler configuration binding
 * What: Holds failure batching thresholds
 * Why: Operators tune how long and how many failures accumulate before one alert goes out
 */
package com.jobagent.scheduler.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "agent.alert.aggregation")
@Validated
public record AlertAggregationProperties(
    @NotNull Duration timeLimit, @Positive int maxBatchSize, @NotNull Duration minCheckInterval) {}
