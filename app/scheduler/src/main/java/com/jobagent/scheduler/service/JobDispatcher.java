/*
 * Where: Scheduler service layer
 * What: Finds due jobs for this host and hands each to the worker pool
 * Why: The control thread never waits for a job; outcomes arrive later as status events
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.repository.JobRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobDispatcher {

  static final String RESULT_SUBMITTED = "submitted";
  static final String RESULT_REJECTED = "rejected";

  private static final Logger logger = LoggerFactory.getLogger(JobDispatcher.class);

  private final JobRepository jobRepository;
  private final JobRunService jobRunService;
  private final ThreadPoolTaskExecutor jobWorkerExecutor;
  private final AgentIdentity identity;
  private final AgentMetrics metrics;

  /** Earliest next run first. */
  public List<String> pollDue() {
    return jobRepository.findDueJobIds(identity.hostName());
  }

  /**
   * Returns false when the pool is saturated. The job stays unclaimed and is found again on a
   * later cycle.
   */
  public boolean dispatch(String jobId) {
    final int agentPid = identity.agentPid();
    try {
      jobWorkerExecutor.execute(() -> jobRunService.run(jobId, agentPid));
      logger.debug("job dispatched jobId={}", jobId);
      metrics.recordDispatch(RESULT_SUBMITTED);
      return true;
    } catch (TaskRejectedException ex) {
      logger.warn("worker pool saturated; job deferred jobId={}", jobId);
      metrics.recordDispatch(RESULT_REJECTED);
      return false;
    }
  }
}
