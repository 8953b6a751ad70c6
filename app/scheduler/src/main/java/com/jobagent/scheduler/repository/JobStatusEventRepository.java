/*
 * Where: Scheduler data access
 * What: Appends to and prunes the pga_job_status_event feed
 * Why: Every status is recorded for browser consumers whether or not an alert is sent
 */
package com.jobagent.scheduler.repository;

import static com.jobagent.common.JdbcTimestampUtils.toTimestamp;

import com.jobagent.scheduler.model.JobStatusEvent;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobStatusEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(JobStatusEvent event, boolean browserNotify, Instant createdAt) {
    final String sql =
        """
        INSERT INTO pgagent.pga_job_status_event (
          jsejobid,
          jsestatus,
          jsedescription,
          jseoccurredat,
          jsebrowser,
          jsecreated
        ) VALUES (
          CAST(:jobId AS int4),
          :status,
          :description,
          :occurredAt,
          :browser,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", event.jobId())
            .addValue("status", event.status().code())
            .addValue("description", event.description())
            .addValue("occurredAt", toLocalTimestamp(event.timestamp()))
            .addValue("browser", browserNotify)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM pgagent.pga_job_status_event
        WHERE jsecreated < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private static Timestamp toLocalTimestamp(LocalDateTime occurredAt) {
    return occurredAt == null ? null : Timestamp.valueOf(occurredAt);
  }
}
