/*
 * Where: Scheduler worker
 * What: Claims one job, runs it, records the run and publishes its outcome
 * Why: Workers report only through the status channel, never through shared memory
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.model.JobStatus;
import com.jobagent.scheduler.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobRunService {

  static final String MDC_JOB_ID = "job_id";

  private static final Logger logger = LoggerFactory.getLogger(JobRunService.class);

  private final JobRepository jobRepository;
  private final JobExecutor jobExecutor;
  private final JobStatusPublisher statusPublisher;
  private final AgentIdentity identity;

  /** Never throws; once the job is claimed, its outcome is published. */
  public void run(String jobId, int agentPid) {
    MDC.put(MDC_JOB_ID, jobId);
    try {
      if (!claim(jobId, agentPid)) {
        return;
      }
      logger.info("job started agentPid={}", agentPid);
      final RunOutcome outcome;
      try {
        outcome = runClaimed(jobId);
      } finally {
        release(jobId, agentPid);
      }
      logger.info("job finished status={} description={}", outcome.status(), outcome.description());
      statusPublisher.publish(jobId, outcome.status(), outcome.description());
    } catch (RuntimeException ex) {
      logger.error("job run failed to report its outcome agentPid={}", agentPid, ex);
    } finally {
      MDC.remove(MDC_JOB_ID);
    }
  }

  private boolean claim(String jobId, int agentPid) {
    try {
      if (jobRepository.claim(jobId, agentPid) == 0) {
        logger.debug("job already claimed by another agent");
        return false;
      }
      return true;
    } catch (RuntimeException ex) {
      logger.error("failed to claim job agentPid={}", agentPid, ex);
      return false;
    }
  }

  private RunOutcome runClaimed(String jobId) {
    final long runLogId;
    try {
      runLogId = jobRepository.startRunLog(jobId);
    } catch (RuntimeException ex) {
      logger.error("failed to open the run log; job not executed", ex);
      return new RunOutcome(
          JobStatus.FAILURE, "Job failed: could not log the run: " + ex.getMessage());
    }
    final RunOutcome outcome = execute(jobId, runLogId);
    try {
      jobRepository.finishRunLog(runLogId, outcome.status().code());
    } catch (RuntimeException ex) {
      // the zombie sweep closes the row once this agent is gone
      logger.error("failed to close run log runLogId={}", runLogId, ex);
    }
    return outcome;
  }

  private void release(String jobId, int agentPid) {
    try {
      // a reconnect moves the claim to the new session pid, so match any of them
      if (jobRepository.release(jobId, identity.sessionPids()) == 0) {
        logger.warn("job finished but claim was lost agentPid={}", agentPid);
      }
    } catch (RuntimeException ex) {
      logger.error("failed to release job claim agentPid={}", agentPid, ex);
    }
  }

  private RunOutcome execute(String jobId, long runLogId) {
    try {
      return new RunOutcome(JobStatus.SUCCESS, jobExecutor.execute(jobId, runLogId));
    } catch (JobExecutionException ex) {
      return new RunOutcome(JobStatus.FAILURE, ex.getMessage());
    } catch (RuntimeException ex) {
      logger.error("job execution failed unexpectedly", ex);
      return new RunOutcome(JobStatus.FAILURE, "Job failed: " + ex.getMessage());
    }
  }

  private record RunOutcome(JobStatus status, String description) {}
}
