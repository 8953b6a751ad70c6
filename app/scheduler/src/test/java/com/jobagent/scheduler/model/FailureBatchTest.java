package com.jobagent.scheduler.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FailureBatchTest {

  private static final LocalDateTime AT = LocalDateTime.of(2026, 1, 17, 9, 0, 0);

  @Test
  void recipientOverrideComesFromFirstRecordThatHasOne() {
    final FailureBatch batch =
        new FailureBatch(
            List.of(
                record("1", null),
                record("2", " "),
                record("3", "a@example.com"),
                record("4", "b@example.com")),
            Instant.EPOCH);

    assertThat(batch.recipientOverride()).contains("a@example.com");
  }

  @Test
  void snapshotIsDetachedFromSourceList() {
    final List<FailureRecord> source = new ArrayList<>(List.of(record("1", null)));
    final FailureBatch batch = new FailureBatch(source, Instant.EPOCH);

    source.clear();

    assertThat(batch.size()).isEqualTo(1);
    assertThatThrownBy(() -> batch.records().add(record("2", null)))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  private static FailureRecord record(String jobId, String recipients) {
    return new FailureRecord(jobId, AT, "failed", "log", recipients, null);
  }
}
