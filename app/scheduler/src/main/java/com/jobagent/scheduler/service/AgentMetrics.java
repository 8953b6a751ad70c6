/*
 * Where: Scheduler service layer
 * What: Records agent-specific meters for alerts, status events, dispatch and crash recovery
 * Why: Alert delivery and dispatch pressure are observable without reading logs
 */
package com.jobagent.scheduler.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class AgentMetrics {

  static final String METRIC_ALERT_DELIVERY_TOTAL = "agent.alert.delivery.total";
  static final String METRIC_ALERT_PENDING = "agent.alert.pending.current";
  static final String METRIC_STATUS_EVENTS_TOTAL = "agent.status.events.total";
  static final String METRIC_MALFORMED_EVENTS_TOTAL = "agent.status.events.malformed.total";
  static final String METRIC_DISPATCH_TOTAL = "agent.dispatch.total";
  static final String METRIC_ZOMBIE_ABORTED_TOTAL = "agent.zombie.aborted.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger pendingFailures = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> taggedCounters = new ConcurrentHashMap<>();
  private final Counter malformedEvents;
  private final Counter zombieAborted;

  public AgentMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_ALERT_PENDING, pendingFailures, AtomicInteger::get)
        .description("Failure records waiting in the alert batch")
        .register(meterRegistry);
    this.malformedEvents =
        Counter.builder(METRIC_MALFORMED_EVENTS_TOTAL)
            .description("Status notifications skipped because the payload could not be decoded")
            .register(meterRegistry);
    this.zombieAborted =
        Counter.builder(METRIC_ZOMBIE_ABORTED_TOTAL)
            .description("Job runs marked aborted after their agent disappeared")
            .register(meterRegistry);
  }

  public void recordAlertDelivery(String result) {
    tagged(METRIC_ALERT_DELIVERY_TOTAL, "Alert batch delivery outcomes", "result", result)
        .increment();
  }

  public void recordStatusEvent(String status) {
    tagged(METRIC_STATUS_EVENTS_TOTAL, "Job status events received", "status", status).increment();
  }

  public void recordDispatch(String result) {
    tagged(METRIC_DISPATCH_TOTAL, "Job dispatch outcomes", "result", result).increment();
  }

  public void recordMalformedEvent() {
    malformedEvents.increment();
  }

  public void recordZombieAborted(int abortedRuns) {
    if (abortedRuns > 0) {
      zombieAborted.increment(abortedRuns);
    }
  }

  public void updatePendingFailures(int pending) {
    pendingFailures.set(Math.max(pending, 0));
  }

  private Counter tagged(String name, String description, String tagKey, String tagValue) {
    return taggedCounters.computeIfAbsent(
        name + '|' + tagValue,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of(tagKey, tagValue))
                .register(meterRegistry));
  }
}
