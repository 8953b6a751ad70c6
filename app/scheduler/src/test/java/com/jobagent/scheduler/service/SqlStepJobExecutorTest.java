/*
 * Where: Scheduler step execution tests
 * What: Verifies step ordering, step logging and each on-error rule
 * Why: The on-error rule alone decides whether a broken step fails the whole job
 */
package com.jobagent.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jobagent.scheduler.model.JobStep;
import com.jobagent.scheduler.repository.JobRepository;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@ExtendWith(MockitoExtension.class)
class SqlStepJobExecutorTest {

  private static final long RUN_LOG_ID = 100L;

  @Mock private JobRepository jobRepository;
  @Mock private NamedParameterJdbcTemplate namedJdbcTemplate;
  @Mock private JdbcTemplate jdbcTemplate;

  private SqlStepJobExecutor executor;

  @BeforeEach
  void setUp() {
    lenient().when(namedJdbcTemplate.getJdbcTemplate()).thenReturn(jdbcTemplate);
    executor = new SqlStepJobExecutor(jobRepository, namedJdbcTemplate);
  }

  @Test
  void runsEveryStepAndLogsSuccess() {
    when(jobRepository.findEnabledSteps("7"))
        .thenReturn(List.of(sqlStep("1", "SELECT 1", "f"), sqlStep("2", "SELECT 2", "f")));
    when(jobRepository.startStepLog(RUN_LOG_ID, "1")).thenReturn(11L);
    when(jobRepository.startStepLog(RUN_LOG_ID, "2")).thenReturn(12L);

    final String description = executor.execute("7", RUN_LOG_ID);

    assertThat(description).isEqualTo("Job completed: 2 step(s) succeeded");
    verify(jdbcTemplate).execute("SELECT 1");
    verify(jdbcTemplate).execute("SELECT 2");
    verify(jobRepository).finishStepLog(11L, "s", 0, null);
    verify(jobRepository).finishStepLog(12L, "s", 0, null);
  }

  @Test
  void failingStepWithFailRuleStopsTheJob() {
    when(jobRepository.findEnabledSteps("7"))
        .thenReturn(List.of(sqlStep("1", "SELECT broken", "f"), sqlStep("2", "SELECT 2", "f")));
    when(jobRepository.startStepLog(RUN_LOG_ID, "1")).thenReturn(11L);
    doThrow(badSql("column \"broken\" does not exist")).when(jdbcTemplate).execute("SELECT broken");

    assertThatThrownBy(() -> executor.execute("7", RUN_LOG_ID))
        .isInstanceOf(JobExecutionException.class)
        .hasMessage("Step 'step-1' failed: column \"broken\" does not exist");

    verify(jobRepository).finishStepLog(11L, "f", -1, "column \"broken\" does not exist");
    verify(jobRepository, never()).startStepLog(RUN_LOG_ID, "2");
  }

  @Test
  void ignoreRuleContinuesAndReportsIgnoredFailures() {
    when(jobRepository.findEnabledSteps("7"))
        .thenReturn(List.of(sqlStep("1", "SELECT broken", "i"), sqlStep("2", "SELECT 2", "f")));
    when(jobRepository.startStepLog(RUN_LOG_ID, "1")).thenReturn(11L);
    when(jobRepository.startStepLog(RUN_LOG_ID, "2")).thenReturn(12L);
    doThrow(badSql("nope")).when(jdbcTemplate).execute("SELECT broken");

    final String description = executor.execute("7", RUN_LOG_ID);

    assertThat(description).isEqualTo("Job completed with 1 ignored step failure(s)");
    verify(jobRepository).finishStepLog(11L, "i", -1, "nope");
    verify(jobRepository).finishStepLog(12L, "s", 0, null);
  }

  @Test
  void succeedRuleMarksTheFailedStepSuccessful() {
    when(jobRepository.findEnabledSteps("7"))
        .thenReturn(List.of(sqlStep("1", "SELECT broken", "s")));
    when(jobRepository.startStepLog(RUN_LOG_ID, "1")).thenReturn(11L);
    doThrow(badSql("nope")).when(jdbcTemplate).execute("SELECT broken");

    final String description = executor.execute("7", RUN_LOG_ID);

    assertThat(description).isEqualTo("Job completed: 1 step(s) succeeded");
    verify(jobRepository).finishStepLog(11L, "s", -1, "nope");
  }

  @Test
  void batchStepsAreNotSupported() {
    when(jobRepository.findEnabledSteps("7"))
        .thenReturn(List.of(new JobStep("1", "step-1", "b", "echo hi", "f")));
    when(jobRepository.startStepLog(RUN_LOG_ID, "1")).thenReturn(11L);

    assertThatThrownBy(() -> executor.execute("7", RUN_LOG_ID))
        .isInstanceOf(JobExecutionException.class)
        .hasMessageContaining("unsupported step kind 'b'");
    verify(jdbcTemplate, never()).execute(anyString());
  }

  @Test
  void jobWithoutStepsCompletes() {
    when(jobRepository.findEnabledSteps("7")).thenReturn(List.of());

    assertThat(executor.execute("7", RUN_LOG_ID)).isEqualTo("Job completed: no enabled steps");
    verify(jobRepository, never()).startStepLog(anyLong(), any());
    verify(jobRepository, never()).finishStepLog(anyLong(), any(), anyInt(), any());
  }

  private static JobStep sqlStep(String id, String code, String onError) {
    return new JobStep(id, "step-" + id, JobStep.KIND_SQL, code, onError);
  }

  private static BadSqlGrammarException badSql(String message) {
    return new BadSqlGrammarException("step", "SELECT", new SQLException(message));
  }
}
