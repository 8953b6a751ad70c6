/*
 * Where: Scheduler service layer
 * What: Publishes job status updates on the status channel
 * Why: Workers and the zombie sweep report outcomes only through NOTIFY
 */
package com.jobagent.scheduler.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.jobagent.common.event.JobStatusPayload;
import com.jobagent.common.event.JobStatusPayloadCodec;
import com.jobagent.scheduler.config.AgentProperties;
import com.jobagent.scheduler.model.JobStatus;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobStatusPublisher {

  private static final Logger logger = LoggerFactory.getLogger(JobStatusPublisher.class);
  private static final RowCallbackHandler IGNORE_ROWS = rs -> {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final JobStatusPayloadCodec codec;
  private final AgentProperties agentProperties;
  private final Clock clock;

  /** Returns false when the update could not be published; the run itself is unaffected. */
  public boolean publish(String jobId, JobStatus status, String description) {
    final JobStatusPayload payload =
        new JobStatusPayload(
            jobId,
            status.code(),
            description,
            LocalDateTime.now(clock).format(JobStatusPayload.TIMESTAMP_FORMAT),
            null,
            null);
    final String json;
    try {
      json = codec.encode(payload);
    } catch (JsonProcessingException ex) {
      logger.error("failed to encode job status jobId={} status={}", jobId, status, ex);
      return false;
    }
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("channel", agentProperties.statusChannel())
            .addValue("payload", json);
    try {
      jdbcTemplate.query("SELECT pg_notify(:channel, :payload)", params, IGNORE_ROWS);
      logger.debug("job status published jobId={} status={}", jobId, status);
      return true;
    } catch (DataAccessException ex) {
      logger.warn("failed to publish job status jobId={} status={}", jobId, status, ex);
      return false;
    }
  }
}
