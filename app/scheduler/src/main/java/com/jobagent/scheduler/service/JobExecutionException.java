/*
 * Where: Scheduler service layer
 * What: A job run that ended in failure
 * Why: The message becomes the description published with the failure status
 */
package com.jobagent.scheduler.service;

public class JobExecutionException extends RuntimeException {

  public JobExecutionException(String message) {
    super(message);
  }

  public JobExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
