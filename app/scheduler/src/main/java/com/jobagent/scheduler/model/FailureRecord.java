/*
 * Where: Scheduler domain model
 * What: One failing job waiting in the alert batch
 * Why: Carries everything the report needs after the event itself is gone
 */
package com.jobagent.scheduler.model;

import java.time.LocalDateTime;

public record FailureRecord(
    String jobId,
    LocalDateTime timestamp,
    String description,
    String detailedLog,
    String emailRecipients,
    String customText) {

  public boolean hasCustomText() {
    return customText != null && !customText.isBlank();
  }

  public boolean hasEmailRecipients() {
    return emailRecipients != null && !emailRecipients.isBlank();
  }
}
