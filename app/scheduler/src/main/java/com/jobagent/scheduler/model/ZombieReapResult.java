/*
 * Where: Scheduler domain model
 * What: Counts of what a zombie sweep cleaned up
 * Why: Logged after every (re)connect and used to decide on the abort event
 */
package com.jobagent.scheduler.model;

public record ZombieReapResult(
    int removedAgents,
    int abortedRuns,
    int abortedSteps,
    int releasedJobs,
    String firstAbortedJobId) {

  public boolean hasAbortedRuns() {
    return abortedRuns > 0 && firstAbortedJobId != null;
  }
}
