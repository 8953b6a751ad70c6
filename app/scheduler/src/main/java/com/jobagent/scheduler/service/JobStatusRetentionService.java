/*
 * Where: Scheduler service layer
 * What: Applies the retention policy to the job status feed
 * Why: Every finished run adds a row, so the feed needs periodic pruning
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.config.StatusFeedProperties;
import com.jobagent.scheduler.repository.JobStatusEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobStatusRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(JobStatusRetentionService.class);

  private final JobStatusEventRepository statusEventRepository;
  private final StatusFeedProperties properties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int deleted = statusEventRepository.deleteOlderThan(threshold);
    logger.info("status feed retention cleanup deleted events={} threshold={}", deleted, threshold);
  }
}
