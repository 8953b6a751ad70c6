/*
 * Where: Scheduler cleanup worker
 * What: Triggers alert artifact retention on a schedule
 * Why: Automate deletion without manual intervention
 */
package com.jobagent.scheduler.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "agent.alert.artifacts.retention-enabled", havingValue = "true")
public class AlertArtifactRetentionWorker {

  private final AlertArtifactRetentionService retentionService;

  @Scheduled(fixedDelayString = "${agent.alert.artifacts.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
