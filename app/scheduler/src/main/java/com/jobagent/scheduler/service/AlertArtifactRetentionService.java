/*
 * Where: Scheduler service layer
 * What: Deletes old report and unsent-alert files
 * Why: The artifact directory otherwise grows with every batch
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.config.AlertArtifactProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AlertArtifactRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(AlertArtifactRetentionService.class);

  private final AlertArtifactStore artifactStore;
  private final AlertArtifactProperties properties;
  private final Clock clock;

  public void cleanup() {
    final Instant threshold = Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    final int deleted = artifactStore.deleteOlderThan(threshold);
    logger.info(
        "alert artifact retention cleanup deleted files={} threshold={}", deleted, threshold);
  }
}
