/*
 * Where: Scheduler cleanup worker
 * What: Triggers status feed retention on a schedule
 * Why: Automate deletion without manual intervention
 */
package com.jobagent.scheduler.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "agent.status-feed.retention-enabled", havingValue = "true")
public class JobStatusRetentionWorker {

  private final JobStatusRetentionService retentionService;

  @Scheduled(fixedDelayString = "${agent.status-feed.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
