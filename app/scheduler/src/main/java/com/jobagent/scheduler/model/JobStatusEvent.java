/*
 * Where: Scheduler domain model
 * What: One decoded job status notification
 * Why: Lives only for the listener iteration that drained it
 */
package com.jobagent.scheduler.model;

import java.time.LocalDateTime;

public record JobStatusEvent(
    String jobId,
    JobStatus status,
    String description,
    LocalDateTime timestamp,
    String customText,
    Boolean browserRequested,
    Boolean emailRequested) {

  public JobStatusEvent(
      String jobId, JobStatus status, String description, LocalDateTime timestamp) {
    this(jobId, status, description, timestamp, null, null, null);
  }
}
