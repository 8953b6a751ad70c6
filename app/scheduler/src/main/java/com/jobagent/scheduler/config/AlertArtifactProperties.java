/*
 * Where: Scheduler configuration binding
 * What: Holds where failure reports and unsent alerts are written and how long they are kept
 * Why: Report files are the audit trail when mail delivery fails
 */
package com.jobagent.scheduler.config;

import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.alert.artifacts")
public record AlertArtifactProperties(
    Path directory, boolean retentionEnabled, int retentionDays, Duration cleanupInterval) {}
