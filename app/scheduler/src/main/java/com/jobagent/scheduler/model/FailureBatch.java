/*
 * Where: Scheduler domain model
 * What: Immutable snapshot of the failures flushed together
 * Why: Composition and delivery work on a copy while the aggregator starts over
 */
package com.jobagent.scheduler.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public record FailureBatch(List<FailureRecord> records, Instant startedAt) {

  public FailureBatch {
    records = List.copyOf(records);
  }

  public int size() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  /** Recipients of the first record that overrides them, if any. */
  public Optional<String> recipientOverride() {
    return records.stream()
        .filter(FailureRecord::hasEmailRecipients)
        .map(FailureRecord::emailRecipients)
        .findFirst();
  }
}
