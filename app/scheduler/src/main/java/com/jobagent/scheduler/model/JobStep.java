/*
 * Where: Scheduler domain model
 * What: One enabled step of a job as read from pga_jobstep
 * Why: The worker runs steps in order and applies the on-error rule of each
 */
package com.jobagent.scheduler.model;

public record JobStep(String stepId, String name, String kind, String code, String onError) {

  public static final String KIND_SQL = "s";
  public static final String ON_ERROR_FAIL = "f";
  public static final String ON_ERROR_SUCCEED = "s";
  public static final String ON_ERROR_IGNORE = "i";

  public boolean isSql() {
    return KIND_SQL.equals(kind);
  }
}
