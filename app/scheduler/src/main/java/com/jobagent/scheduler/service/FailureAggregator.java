/*
 * Where: Scheduler service layer
 * What: Buffers failure records until the batch is old enough or large enough to send
 * Why: One consolidated alert per window instead of one mail per failing job
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.config.AlertAggregationProperties;
import com.jobagent.scheduler.model.FailureBatch;
import com.jobagent.scheduler.model.FailureRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Not thread-safe. Only the control thread offers and flushes, so the buffer carries no lock.
 *
 * <p>The batch is non-empty exactly when {@link #batchStartedAt()} is present.
 */
@Component
public class FailureAggregator {

  private final Duration timeLimit;
  private final int maxBatchSize;
  private final List<FailureRecord> buffer = new ArrayList<>();
  private Instant batchStartedAt;

  public FailureAggregator(AlertAggregationProperties properties) {
    this.timeLimit = properties.timeLimit();
    this.maxBatchSize = properties.maxBatchSize();
  }

  public void offer(FailureRecord record, Instant now) {
    if (buffer.isEmpty()) {
      batchStartedAt = now;
    }
    buffer.add(record);
  }

  public Optional<FailureBatch> maybeFlush(Instant now) {
    if (buffer.isEmpty()) {
      return Optional.empty();
    }
    final Duration elapsed = Duration.between(batchStartedAt, now);
    if (elapsed.compareTo(timeLimit) >= 0 || isFull()) {
      return Optional.of(flush());
    }
    return Optional.empty();
  }

  /** Clears the buffer whatever happens to the returned batch afterwards. */
  public FailureBatch flush() {
    final FailureBatch batch = new FailureBatch(buffer, batchStartedAt);
    buffer.clear();
    batchStartedAt = null;
    return batch;
  }

  public boolean isFull() {
    return buffer.size() >= maxBatchSize;
  }

  public int size() {
    return buffer.size();
  }

  public boolean isEmpty() {
    return buffer.isEmpty();
  }

  public Optional<Instant> batchStartedAt() {
    return Optional.ofNullable(batchStartedAt);
  }
}
