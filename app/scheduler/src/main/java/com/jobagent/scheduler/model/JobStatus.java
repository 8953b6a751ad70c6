/*
 * Where: Scheduler domain model
 * What: Terminal outcome of a job run as carried by status events
 * Why: Policy matching only distinguishes success, failure and everything else
 */
package com.jobagent.scheduler.model;

public enum JobStatus {
  SUCCESS("s"),
  FAILURE("f"),
  OTHER_TERMINAL("d");

  private final String code;

  JobStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static JobStatus fromCode(String code) {
    if (SUCCESS.code.equals(code)) {
      return SUCCESS;
    }
    if (FAILURE.code.equals(code)) {
      return FAILURE;
    }
    return OTHER_TERMINAL;
  }
}
