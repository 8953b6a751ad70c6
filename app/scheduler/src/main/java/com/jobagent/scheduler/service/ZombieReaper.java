/*
 * Where: Scheduler service layer
 * What: Cleans up after agents that died mid-run and raises one failure event for them
 * Why: Runs left in "running" state would block their jobs forever
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.db.PrimaryConnection;
import com.jobagent.scheduler.model.JobStatus;
import com.jobagent.scheduler.model.ZombieReapResult;
import com.jobagent.scheduler.repository.AgentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ZombieReaper {

  static final String ABORT_DESCRIPTION = "Job aborted: the agent running it is no longer alive";

  private static final Logger logger = LoggerFactory.getLogger(ZombieReaper.class);

  private final AgentRepository agentRepository;
  private final JobStatusPublisher statusPublisher;
  private final AgentMetrics metrics;

  public ZombieReapResult reap(PrimaryConnection connection) {
    logger.debug("clearing zombies");
    final ZombieReapResult result = agentRepository.reapZombies(connection);
    if (result.removedAgents() == 0) {
      return result;
    }
    logger.warn(
        "zombie agents removed agents={} abortedRuns={} abortedSteps={} releasedJobs={}",
        result.removedAgents(),
        result.abortedRuns(),
        result.abortedSteps(),
        result.releasedJobs());
    metrics.recordZombieAborted(result.abortedRuns());
    if (result.hasAbortedRuns()) {
      statusPublisher.publish(result.firstAbortedJobId(), JobStatus.FAILURE, ABORT_DESCRIPTION);
    }
    return result;
  }
}
