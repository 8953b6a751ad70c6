/*
 * Where: Scheduler service layer
 * What: Runs the work of one claimed job
 * Why: The run bookkeeping does not depend on what a step actually does
 */
package com.jobagent.scheduler.service;

public interface JobExecutor {

  /**
   * Returns a description of the successful run, or throws {@link JobExecutionException} with a
   * description of the failure.
   */
  String execute(String jobId, long runLogId);
}
