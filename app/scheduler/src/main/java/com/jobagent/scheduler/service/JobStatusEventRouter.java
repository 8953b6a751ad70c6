/*
 * Where: Scheduler service layer
 * What: Applies the notification policy to one status event and records it in the status feed
 * Why: Status recording and alerting are independent; a skipped alert still leaves a feed row
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.model.FailureRecord;
import com.jobagent.scheduler.model.JobStatus;
import com.jobagent.scheduler.model.JobStatusEvent;
import com.jobagent.scheduler.model.NotificationSettings;
import com.jobagent.scheduler.repository.JobStatusEventRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobStatusEventRouter {

  private static final Logger logger = LoggerFactory.getLogger(JobStatusEventRouter.class);

  private final NotificationPolicyService policyService;
  private final FailureDetailCollector detailCollector;
  private final FailureAlertPipeline alertPipeline;
  private final JobStatusEventRepository statusEventRepository;
  private final AgentMetrics metrics;
  private final Clock clock;

  public void route(JobStatusEvent event) {
    final Instant now = Instant.now(clock);
    metrics.recordStatusEvent(event.status().code());
    final NotificationSettings settings = policyService.loadSettings(event.jobId());
    final boolean notify = policyService.shouldNotify(settings, event.status(), now);
    if (notify) {
      // stamp before the slow part so a quick repeat is already debounced
      policyService.recordNotified(event.jobId(), now);
      if (wantsEmail(event, settings)) {
        logger.debug("job failed; collecting details jobId={}", event.jobId());
        alertPipeline.offer(toFailureRecord(event, settings), now);
      }
    }
    final boolean browser =
        notify && settings.browserEnabled() && !Boolean.FALSE.equals(event.browserRequested());
    try {
      statusEventRepository.insert(event, browser, now);
    } catch (DataAccessException ex) {
      logger.warn(
          "failed to record job status jobId={} status={}", event.jobId(), event.status(), ex);
    }
    logger.debug(
        "status routed jobId={} status={} notify={} browser={}",
        event.jobId(),
        event.status(),
        notify,
        browser);
  }

  private static boolean wantsEmail(JobStatusEvent event, NotificationSettings settings) {
    return event.status() == JobStatus.FAILURE
        && settings.emailEnabled()
        && !Boolean.FALSE.equals(event.emailRequested());
  }

  private FailureRecord toFailureRecord(JobStatusEvent event, NotificationSettings settings) {
    final String customText =
        event.customText() != null && !event.customText().isBlank()
            ? event.customText()
            : settings.customText();
    final LocalDateTime timestamp =
        event.timestamp() != null ? event.timestamp() : LocalDateTime.now(clock);
    return new FailureRecord(
        event.jobId(),
        timestamp,
        event.description(),
        detailCollector.collect(event.jobId()),
        settings.emailRecipients(),
        customText);
  }
}
