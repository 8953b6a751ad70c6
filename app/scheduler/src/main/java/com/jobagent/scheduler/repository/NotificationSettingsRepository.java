/*
 * Where: Scheduler data access
 * What: Reads and stamps pga_job_notification rows
 * Why: Notification policy is stored next to the job definitions
 */
package com.jobagent.scheduler.repository;

import static com.jobagent.common.JdbcTimestampUtils.toInstant;
import static com.jobagent.common.JdbcTimestampUtils.toTimestamp;

import com.jobagent.scheduler.model.NotificationSettings;
import com.jobagent.scheduler.model.NotifyWhen;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationSettingsRepository {

  private static final Logger logger =
      LoggerFactory.getLogger(NotificationSettingsRepository.class);

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<NotificationSettings> findByJobId(String jobId) {
    final String sql =
        """
        SELECT jnjobid::text AS job_id, jnenabled, jnbrowser, jnemail, jnwhen,
               jnmininterval::text AS min_interval_text,
               jnemailrecipients, jncustomtext, jnlastnotification
        FROM pgagent.pga_job_notification
        WHERE jnjobid = CAST(:jobId AS int4)
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    final List<NotificationSettings> rows = jdbcTemplate.query(sql, params, this::mapRow);
    return rows.stream().findFirst();
  }

  public int updateLastNotification(String jobId, Instant notifiedAt) {
    final String sql =
        """
        UPDATE pgagent.pga_job_notification
        SET jnlastnotification = :notifiedAt
        WHERE jnjobid = CAST(:jobId AS int4)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notifiedAt", toTimestamp(notifiedAt))
            .addValue("jobId", jobId);
    return jdbcTemplate.update(sql, params);
  }

  private NotificationSettings mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String jobId = rs.getString("job_id");
    return new NotificationSettings(
        jobId,
        rs.getBoolean("jnenabled"),
        rs.getBoolean("jnbrowser"),
        rs.getBoolean("jnemail"),
        parseWhen(jobId, rs.getString("jnwhen")),
        parseMinInterval(jobId, rs.getString("min_interval_text")),
        rs.getString("jnemailrecipients"),
        rs.getString("jncustomtext"),
        toInstant(rs.getTimestamp("jnlastnotification")));
  }

  private NotifyWhen parseWhen(String jobId, String code) {
    return NotifyWhen.fromCode(code)
        .orElseGet(
            () -> {
              logger.warn(
                  "unknown notify-when code jobId={} code={}; using failure only", jobId, code);
              return NotifyWhen.FAILURE_ONLY;
            });
  }

  static int parseMinInterval(String jobId, String value) {
    if (value == null || value.isBlank()) {
      return 0;
    }
    try {
      return Math.max(0, Integer.parseInt(value.trim()));
    } catch (NumberFormatException ex) {
      logger.warn(
          "non-numeric minimum interval jobId={} value={}; debounce disabled", jobId, value);
      return 0;
    }
  }
}
