/*
 * Where: Scheduler configuration binding
 * What: Holds the diagnostic sources read for a failing job
 * Why: Log locations differ per host
 */
package com.jobagent.scheduler.config;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.alert.details")
public record AlertDetailProperties(
    Path jobLogDirectory,
    Path applicationLog,
    int applicationLogTailLines,
    int maxJobLogBytes,
    Path meminfo,
    Path loadavg) {}
