/*
 * Where: Scheduler domain model
 * What: Snapshot of the pga_job_notification row of one job
 * Why: Loaded fresh for every event so operator edits apply immediately
 */
package com.jobagent.scheduler.model;

import java.time.Instant;

public record NotificationSettings(
    String jobId,
    boolean enabled,
    boolean browserEnabled,
    boolean emailEnabled,
    NotifyWhen when,
    int minIntervalSeconds,
    String emailRecipients,
    String customText,
    Instant lastNotificationAt) {

  public static NotificationSettings defaults(String jobId) {
    return new NotificationSettings(
        jobId, true, true, false, NotifyWhen.FAILURE_ONLY, 0, null, null, null);
  }
}
