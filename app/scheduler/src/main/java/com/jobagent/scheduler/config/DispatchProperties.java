/*
 * Where: Scheduler configuration binding
 * What: Holds the bounds of the job worker pool
 * Why: One worker per due job must not grow without limit
 */
package com.jobagent.scheduler.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "agent.dispatch")
@Validated
public record DispatchProperties(
    @Positive int maxWorkers,
    @PositiveOrZero int queueCapacity,
    @NotNull Duration awaitTermination) {}
