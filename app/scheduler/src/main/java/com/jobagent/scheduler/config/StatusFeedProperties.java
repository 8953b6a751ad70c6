/*
 * Where: Scheduler configuration binding
 * What: Holds retention settings for the job status feed table
 * Why: The feed grows with every finished run and needs periodic cleanup
 */
package com.jobagent.scheduler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.status-feed")
public record StatusFeedProperties(
    boolean retentionEnabled, int retentionDays, Duration cleanupInterval) {}
