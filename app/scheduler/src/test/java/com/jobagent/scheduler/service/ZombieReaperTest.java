package com.jobagent.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jobagent.scheduler.db.PrimaryConnection;
import com.jobagent.scheduler.model.JobStatus;
import com.jobagent.scheduler.model.ZombieReapResult;
import com.jobagent.scheduler.repository.AgentRepository;
import org.junit.jupiter.api.Test;

class ZombieReaperTest {

  private final AgentRepository agentRepository = mock(AgentRepository.class);
  private final JobStatusPublisher statusPublisher = mock(JobStatusPublisher.class);
  private final AgentMetrics metrics = mock(AgentMetrics.class);
  private final PrimaryConnection connection = mock(PrimaryConnection.class);
  private final ZombieReaper reaper = new ZombieReaper(agentRepository, statusPublisher, metrics);

  @Test
  void publishesOneFailureForAbortedRuns() {
    when(agentRepository.reapZombies(connection))
        .thenReturn(new ZombieReapResult(2, 3, 4, 3, "17"));

    final ZombieReapResult result = reaper.reap(connection);

    assertThat(result.abortedRuns()).isEqualTo(3);
    verify(metrics).recordZombieAborted(3);
    verify(statusPublisher).publish("17", JobStatus.FAILURE, ZombieReaper.ABORT_DESCRIPTION);
  }

  @Test
  void deadAgentWithoutRunningJobsRaisesNoEvent() {
    when(agentRepository.reapZombies(connection))
        .thenReturn(new ZombieReapResult(1, 0, 0, 0, null));

    reaper.reap(connection);

    verify(metrics).recordZombieAborted(0);
    verify(statusPublisher, never()).publish(any(), any(), any());
  }

  @Test
  void cleanSweepDoesNothing() {
    when(agentRepository.reapZombies(connection))
        .thenReturn(new ZombieReapResult(0, 0, 0, 0, null));

    reaper.reap(connection);

    verify(metrics, never()).recordZombieAborted(anyInt());
    verify(statusPublisher, never()).publish(any(), any(), any());
  }
}
