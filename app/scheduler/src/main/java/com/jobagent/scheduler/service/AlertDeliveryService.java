/*
 * Where: Scheduler service layer
 * What: Delivers composed alerts with bounded retry and writes unsent ones to disk
 * Why: A relay outage must cost at most a few retries and must leave an audit trail
 */
package com.jobagent.scheduler.service;

import com.google.common.annotations.VisibleForTesting;
import com.jobagent.scheduler.config.AlertMailProperties;
import com.jobagent.scheduler.model.FailureBatch;
import com.jobagent.scheduler.model.OutboundAlert;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AlertDeliveryService {

  static final String RESULT_SENT = "sent";
  static final String RESULT_FALLBACK = "fallback";
  static final String RESULT_LOST = "lost";

  private static final Logger logger = LoggerFactory.getLogger(AlertDeliveryService.class);

  private final AlertSender sender;
  private final AlertComposer composer;
  private final AlertArtifactStore artifactStore;
  private final AlertMailProperties properties;
  private final AgentMetrics metrics;

  /** Returns false instead of throwing; the caller decides about fallback. */
  public boolean send(OutboundAlert alert) {
    if (properties.enabled() && !properties.hasCredentials()) {
      logger.error(
          "mail configuration incomplete (sender, recipients and password are required);"
              + " alert not sent subject={}",
          alert.subject());
      return false;
    }
    final List<String> recipients =
        alert.recipients().isEmpty()
            ? AlertRecipients.parse(properties.recipients())
            : alert.recipients();
    if (recipients.isEmpty()) {
      logger.error("no alert recipients resolved subject={}", alert.subject());
      return false;
    }
    final OutboundAlert resolved = alert.withRecipients(recipients);
    final int maxAttempts = Math.max(properties.maxAttempts(), 1);
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        sender.send(resolved);
        return true;
      } catch (AlertDeliveryException ex) {
        if (attempt >= maxAttempts) {
          logger.error(
              "alert delivery failed after {} attempts subject={}", attempt, alert.subject(), ex);
          return false;
        }
        final Duration backoff = computeBackoffDuration(attempt);
        logger.warn(
            "alert delivery failed attempt={} retryIn={} subject={}",
            attempt,
            backoff,
            alert.subject(),
            ex);
        if (!pause(backoff)) {
          logger.warn("alert delivery interrupted subject={}", alert.subject());
          return false;
        }
      } catch (RuntimeException ex) {
        logger.error("alert delivery failed unexpectedly subject={}", alert.subject(), ex);
        return false;
      }
    }
    return false;
  }

  /** Terminal for the batch: it is either sent or written to disk, never queued again. */
  public void sendWithFallback(FailureBatch batch) {
    if (batch.isEmpty()) {
      return;
    }
    final OutboundAlert alert = composer.compose(batch);
    if (send(alert)) {
      logger.info("alert sent failures={} subject={}", batch.size(), alert.subject());
      metrics.recordAlertDelivery(RESULT_SENT);
      return;
    }
    final Optional<Path> fallback =
        artifactStore.writeUnsentAlert(alert.subject(), alert.bodyHtml());
    if (fallback.isPresent()) {
      logger.warn("alert not delivered; saved to {} failures={}", fallback.get(), batch.size());
      metrics.recordAlertDelivery(RESULT_FALLBACK);
    } else {
      logger.error("alert not delivered and could not be saved failures={}", batch.size());
      metrics.recordAlertDelivery(RESULT_LOST);
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(2, attempt - 1);
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    return Duration.ofMillis((long) Math.ceil(capped * jitter));
  }

  /** Returns false when interrupted; the interrupt flag is restored. */
  @VisibleForTesting
  boolean pause(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
