/*
 * Where: Scheduler domain model
 * What: Which outcomes of a job trigger a notification
 * Why: Stored as a one-letter code next to the job
 */
package com.jobagent.scheduler.model;

import java.util.Optional;

public enum NotifyWhen {
  ALL("a"),
  SUCCESS_ONLY("s"),
  FAILURE_ONLY("f"),
  BOTH("b");

  private final String code;

  NotifyWhen(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean matches(JobStatus status) {
    return switch (this) {
      case ALL -> true;
      case SUCCESS_ONLY -> status == JobStatus.SUCCESS;
      case FAILURE_ONLY -> status == JobStatus.FAILURE;
      case BOTH -> status == JobStatus.SUCCESS || status == JobStatus.FAILURE;
    };
  }

  public static Optional<NotifyWhen> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    final String trimmed = code.trim();
    for (NotifyWhen when : values()) {
      if (when.code.equals(trimmed)) {
        return Optional.of(when);
      }
    }
    return Optional.empty();
  }
}
