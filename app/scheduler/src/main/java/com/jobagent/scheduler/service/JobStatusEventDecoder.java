/*
 * Where: Scheduler service layer
 * What: Turns a raw notification payload into a JobStatusEvent
 * Why: A single bad payload must be skipped without affecting the rest of the drain
 */
package com.jobagent.scheduler.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.jobagent.common.event.JobStatusPayload;
import com.jobagent.common.event.JobStatusPayloadCodec;
import com.jobagent.scheduler.model.JobStatus;
import com.jobagent.scheduler.model.JobStatusEvent;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JobStatusEventDecoder {

  private static final Logger logger = LoggerFactory.getLogger(JobStatusEventDecoder.class);

  private final JobStatusPayloadCodec codec;
  private final AgentMetrics metrics;

  public Optional<JobStatusEvent> decode(String rawPayload) {
    final JobStatusPayload payload;
    try {
      payload = codec.decode(rawPayload);
    } catch (JsonProcessingException ex) {
      return skip("unparseable payload", rawPayload, ex);
    }
    if (payload == null || isBlank(payload.jobId()) || isBlank(payload.status())) {
      return skip("payload without job_id or status", rawPayload, null);
    }
    final LocalDateTime timestamp;
    try {
      timestamp =
          isBlank(payload.timestamp())
              ? null
              : LocalDateTime.parse(payload.timestamp().trim(), JobStatusPayload.TIMESTAMP_FORMAT);
    } catch (DateTimeParseException ex) {
      return skip("invalid timestamp", rawPayload, ex);
    }
    final JobStatusPayload.Notification channels = payload.notification();
    return Optional.of(
        new JobStatusEvent(
            payload.jobId().trim(),
            JobStatus.fromCode(payload.status().trim()),
            payload.description(),
            timestamp,
            payload.customText(),
            channels == null ? null : channels.browser(),
            channels == null ? null : channels.email()));
  }

  private Optional<JobStatusEvent> skip(String reason, String rawPayload, Exception cause) {
    metrics.recordMalformedEvent();
    if (cause == null) {
      logger.warn("skipping status notification: {} payload={}", reason, rawPayload);
    } else {
      logger.warn("skipping status notification: {} payload={}", reason, rawPayload, cause);
    }
    return Optional.empty();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
