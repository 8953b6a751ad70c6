/*
 * Where: Scheduler service layer
 * What: Loads per-job notification settings and decides whether a status warrants a notification
 * Why: A broken settings lookup must never stop status recording, so lookups fall back to defaults
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.model.JobStatus;
import com.jobagent.scheduler.model.NotificationSettings;
import com.jobagent.scheduler.repository.NotificationSettingsRepository;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationPolicyService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationPolicyService.class);

  private final NotificationSettingsRepository settingsRepository;

  public NotificationSettings loadSettings(String jobId) {
    try {
      return settingsRepository
          .findByJobId(jobId)
          .orElseGet(() -> NotificationSettings.defaults(jobId));
    } catch (DataAccessException ex) {
      logger.warn("failed to load notification settings jobId={}; using defaults", jobId, ex);
      return NotificationSettings.defaults(jobId);
    }
  }

  /** Status match first, then the debounce window; the window can only suppress. */
  public boolean shouldNotify(NotificationSettings settings, JobStatus status, Instant now) {
    if (!settings.enabled() || !settings.when().matches(status)) {
      return false;
    }
    return !isDebounced(settings, now);
  }

  public void recordNotified(String jobId, Instant now) {
    try {
      final int updated = settingsRepository.updateLastNotification(jobId, now);
      if (updated == 0) {
        logger.debug("no notification settings row to stamp jobId={}", jobId);
      }
    } catch (DataAccessException ex) {
      logger.warn("failed to record notification time jobId={}", jobId, ex);
    }
  }

  private boolean isDebounced(NotificationSettings settings, Instant now) {
    if (settings.minIntervalSeconds() <= 0 || settings.lastNotificationAt() == null) {
      return false;
    }
    final Duration elapsed = Duration.between(settings.lastNotificationAt(), now);
    if (elapsed.compareTo(Duration.ofSeconds(settings.minIntervalSeconds())) < 0) {
      logger.debug(
          "notification debounced jobId={} elapsed={} minInterval={}s",
          settings.jobId(),
          elapsed,
          settings.minIntervalSeconds());
      return true;
    }
    return false;
  }
}
