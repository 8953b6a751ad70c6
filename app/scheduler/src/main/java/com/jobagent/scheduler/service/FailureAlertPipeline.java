/*
 * Where: Scheduler service layer
 * What: Feeds failures into the aggregator and hands flushed batches to delivery
 * Why: Keeps the flush checks cheap while never letting a batch outlive its window
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.config.AlertAggregationProperties;
import com.jobagent.scheduler.model.FailureRecord;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Control-thread only, like the aggregator it owns. */
@Service
public class FailureAlertPipeline {

  private static final Logger logger = LoggerFactory.getLogger(FailureAlertPipeline.class);

  private final FailureAggregator aggregator;
  private final AlertDeliveryService deliveryService;
  private final AgentMetrics metrics;
  private final Duration minCheckInterval;
  private Instant lastCheckAt;

  public FailureAlertPipeline(
      FailureAggregator aggregator,
      AlertDeliveryService deliveryService,
      AgentMetrics metrics,
      AlertAggregationProperties properties) {
    this.aggregator = aggregator;
    this.deliveryService = deliveryService;
    this.metrics = metrics;
    this.minCheckInterval = properties.minCheckInterval();
  }

  public void offer(FailureRecord record, Instant now) {
    aggregator.offer(record, now);
    logger.debug("failure buffered jobId={} pending={}", record.jobId(), aggregator.size());
    if (aggregator.isFull()) {
      logger.info("failure batch full; sending now size={}", aggregator.size());
      deliveryService.sendWithFallback(aggregator.flush());
    }
    metrics.updatePendingFailures(aggregator.size());
  }

  /** Checks the batch window at most once per minimum check interval. */
  public void checkPending(Instant now) {
    if (lastCheckAt != null && Duration.between(lastCheckAt, now).compareTo(minCheckInterval) < 0) {
      return;
    }
    lastCheckAt = now;
    aggregator.maybeFlush(now).ifPresent(deliveryService::sendWithFallback);
    metrics.updatePendingFailures(aggregator.size());
  }

  /** Sends whatever is buffered; used when the agent stops. */
  public void flushRemaining() {
    if (aggregator.isEmpty()) {
      return;
    }
    logger.info("sending buffered failures before stop size={}", aggregator.size());
    deliveryService.sendWithFallback(aggregator.flush());
    metrics.updatePendingFailures(0);
  }
}
