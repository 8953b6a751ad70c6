/*
 * Where: Scheduler worker tests
 * What: Verifies the claim, run-log, release and publish sequence of one job run
 * Why: A run that loses its claim or fails must still leave the job runnable and reported
 */
package com.jobagent.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jobagent.scheduler.config.AgentProperties;
import com.jobagent.scheduler.model.JobStatus;
import com.jobagent.scheduler.repository.JobRepository;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class JobRunServiceTest {

  private static final int AGENT_PID = 4242;

  @Mock private JobRepository jobRepository;
  @Mock private JobExecutor jobExecutor;
  @Mock private JobStatusPublisher statusPublisher;

  private JobRunService service;

  @BeforeEach
  void setUp() {
    service = new JobRunService(jobRepository, jobExecutor, statusPublisher, identity(AGENT_PID));
  }

  @Test
  void successfulRunIsLoggedReleasedAndPublished() {
    final AtomicReference<String> mdcDuringRun = new AtomicReference<>();
    when(jobRepository.claim("7", AGENT_PID)).thenReturn(1);
    when(jobRepository.startRunLog("7")).thenReturn(100L);
    when(jobExecutor.execute("7", 100L))
        .thenAnswer(
            invocation -> {
              mdcDuringRun.set(MDC.get(JobRunService.MDC_JOB_ID));
              return "Job completed: 2 step(s) succeeded";
            });
    when(jobRepository.release("7", Set.of(AGENT_PID))).thenReturn(1);

    service.run("7", AGENT_PID);

    final InOrder order = inOrder(jobRepository, jobExecutor, statusPublisher);
    order.verify(jobRepository).claim("7", AGENT_PID);
    order.verify(jobRepository).startRunLog("7");
    order.verify(jobExecutor).execute("7", 100L);
    order.verify(jobRepository).finishRunLog(100L, "s");
    order.verify(jobRepository).release("7", Set.of(AGENT_PID));
    order
        .verify(statusPublisher)
        .publish("7", JobStatus.SUCCESS, "Job completed: 2 step(s) succeeded");
    assertThat(mdcDuringRun.get()).isEqualTo("7");
    assertThat(MDC.get(JobRunService.MDC_JOB_ID)).isNull();
  }

  @Test
  void failedRunPublishesFailureWithTheStepError() {
    when(jobRepository.claim("7", AGENT_PID)).thenReturn(1);
    when(jobRepository.startRunLog("7")).thenReturn(100L);
    when(jobExecutor.execute("7", 100L))
        .thenThrow(new JobExecutionException("Step 'load' failed: relation missing"));
    when(jobRepository.release("7", Set.of(AGENT_PID))).thenReturn(1);

    service.run("7", AGENT_PID);

    verify(jobRepository).finishRunLog(100L, "f");
    verify(statusPublisher)
        .publish("7", JobStatus.FAILURE, "Step 'load' failed: relation missing");
  }

  @Test
  void unexpectedExecutorErrorIsReportedAsFailure() {
    when(jobRepository.claim("7", AGENT_PID)).thenReturn(1);
    when(jobRepository.startRunLog("7")).thenReturn(100L);
    when(jobExecutor.execute("7", 100L)).thenThrow(new IllegalStateException("boom"));
    when(jobRepository.release("7", Set.of(AGENT_PID))).thenReturn(1);

    service.run("7", AGENT_PID);

    verify(jobRepository).finishRunLog(100L, "f");
    verify(statusPublisher).publish("7", JobStatus.FAILURE, "Job failed: boom");
  }

  @Test
  void jobClaimedElsewhereIsSkipped() {
    when(jobRepository.claim("7", AGENT_PID)).thenReturn(0);

    service.run("7", AGENT_PID);

    verify(jobRepository, never()).startRunLog(any());
    verify(jobExecutor, never()).execute(any(), anyLong());
    verify(statusPublisher, never()).publish(any(), any(), any());
    assertThat(MDC.get(JobRunService.MDC_JOB_ID)).isNull();
  }

  @Test
  void failureIsPublishedEvenWhenTheRunLogCannotBeClosed() {
    when(jobRepository.claim("7", AGENT_PID)).thenReturn(1);
    when(jobRepository.startRunLog("7")).thenReturn(100L);
    when(jobExecutor.execute("7", 100L))
        .thenThrow(new JobExecutionException("Step 'load' failed: relation missing"));
    doThrow(new DataAccessResourceFailureException("down"))
        .when(jobRepository)
        .finishRunLog(100L, "f");
    when(jobRepository.release("7", Set.of(AGENT_PID))).thenReturn(1);

    service.run("7", AGENT_PID);

    verify(jobRepository).release("7", Set.of(AGENT_PID));
    verify(statusPublisher)
        .publish("7", JobStatus.FAILURE, "Step 'load' failed: relation missing");
  }

  @Test
  void outcomeIsPublishedEvenWhenTheReleaseFails() {
    when(jobRepository.claim("7", AGENT_PID)).thenReturn(1);
    when(jobRepository.startRunLog("7")).thenReturn(100L);
    when(jobExecutor.execute("7", 100L)).thenReturn("Job completed: 1 step(s) succeeded");
    when(jobRepository.release("7", Set.of(AGENT_PID)))
        .thenThrow(new DataAccessResourceFailureException("down"));

    service.run("7", AGENT_PID);

    verify(statusPublisher)
        .publish("7", JobStatus.SUCCESS, "Job completed: 1 step(s) succeeded");
  }

  @Test
  void runLogErrorReleasesTheClaimAndReportsFailure() {
    when(jobRepository.claim("7", AGENT_PID)).thenReturn(1);
    when(jobRepository.startRunLog("7"))
        .thenThrow(new IllegalStateException("no run log id returned for job 7"));

    assertThatCode(() -> service.run("7", AGENT_PID)).doesNotThrowAnyException();

    verify(jobRepository).release("7", Set.of(AGENT_PID));
    verify(jobExecutor, never()).execute(any(), anyLong());
    verify(statusPublisher).publish(eq("7"), eq(JobStatus.FAILURE), startsWith("Job failed:"));
    assertThat(MDC.get(JobRunService.MDC_JOB_ID)).isNull();
  }

  @Test
  void claimMovedByAReconnectIsStillReleased() {
    service =
        new JobRunService(jobRepository, jobExecutor, statusPublisher, identity(AGENT_PID, 5151));
    when(jobRepository.claim("7", AGENT_PID)).thenReturn(1);
    when(jobRepository.startRunLog("7")).thenReturn(100L);
    when(jobExecutor.execute("7", 100L)).thenReturn("Job completed: 1 step(s) succeeded");
    when(jobRepository.release("7", Set.of(AGENT_PID, 5151))).thenReturn(1);

    service.run("7", AGENT_PID);

    verify(jobRepository).release("7", Set.of(AGENT_PID, 5151));
  }

  private static AgentIdentity identity(int... sessionPids) {
    final AgentIdentity identity =
        new AgentIdentity(
            new AgentProperties(
                true,
                3,
                Duration.ofSeconds(10),
                Duration.ofSeconds(30),
                "job_status_update",
                4,
                false,
                "db-host-1"));
    for (int pid : sessionPids) {
      identity.assignAgentPid(pid);
    }
    return identity;
  }
}
