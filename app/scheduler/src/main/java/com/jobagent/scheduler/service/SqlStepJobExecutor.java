/*
 * Where: Scheduler service layer
 * What: Executes the enabled SQL steps of a job in order and logs each step
 * Why: Each step's on-error rule decides whether a failed step fails the job
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.model.JobStep;
import com.jobagent.scheduler.repository.JobRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SqlStepJobExecutor implements JobExecutor {

  static final String STEP_SUCCEEDED = "s";
  static final String STEP_FAILED = "f";
  static final String STEP_IGNORED = "i";

  private static final Logger logger = LoggerFactory.getLogger(SqlStepJobExecutor.class);

  private final JobRepository jobRepository;
  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public String execute(String jobId, long runLogId) {
    final List<JobStep> steps = jobRepository.findEnabledSteps(jobId);
    if (steps.isEmpty()) {
      return "Job completed: no enabled steps";
    }
    int failedSteps = 0;
    for (JobStep step : steps) {
      final long stepLogId = jobRepository.startStepLog(runLogId, step.stepId());
      final String error = runStep(step);
      if (error == null) {
        jobRepository.finishStepLog(stepLogId, STEP_SUCCEEDED, 0, null);
        continue;
      }
      logger.warn(
          "step failed jobId={} step={} onError={} error={}",
          jobId,
          step.name(),
          step.onError(),
          error);
      if (JobStep.ON_ERROR_SUCCEED.equals(step.onError())) {
        jobRepository.finishStepLog(stepLogId, STEP_SUCCEEDED, -1, error);
      } else if (JobStep.ON_ERROR_IGNORE.equals(step.onError())) {
        jobRepository.finishStepLog(stepLogId, STEP_IGNORED, -1, error);
        failedSteps++;
      } else {
        jobRepository.finishStepLog(stepLogId, STEP_FAILED, -1, error);
        throw new JobExecutionException("Step '" + step.name() + "' failed: " + error);
      }
    }
    if (failedSteps > 0) {
      return "Job completed with " + failedSteps + " ignored step failure(s)";
    }
    return "Job completed: " + steps.size() + " step(s) succeeded";
  }

  /** Returns null on success, else the error text. */
  private String runStep(JobStep step) {
    if (!step.isSql()) {
      return "unsupported step kind '" + step.kind() + "'";
    }
    if (step.code() == null || step.code().isBlank()) {
      return "empty step code";
    }
    try {
      // plain JdbcTemplate: step code may contain ':' that must not be read as a parameter
      jdbcTemplate.getJdbcTemplate().execute(step.code());
      return null;
    } catch (DataAccessException ex) {
      return ex.getMostSpecificCause().getMessage();
    }
  }
}
