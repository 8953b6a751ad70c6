/*
 * Where: Scheduler database access
 * What: The dedicated session the control loop listens on and registers the agent with
 * Why: pg_backend_pid() of this session is the agent id, so it must not come from the pool
 */
package com.jobagent.scheduler.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

public class PrimaryConnection implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(PrimaryConnection.class);

  private final Connection connection;
  private final NamedParameterJdbcTemplate jdbcTemplate;

  public PrimaryConnection(Connection connection) {
    this.connection = connection;
    // suppressClose: templates must not close the session between statements
    this.jdbcTemplate =
        new NamedParameterJdbcTemplate(new SingleConnectionDataSource(connection, true));
  }

  public NamedParameterJdbcTemplate jdbc() {
    return jdbcTemplate;
  }

  /** The channel name is validated by configuration binding; LISTEN takes no bind parameter. */
  public void listen(String channel) {
    jdbcTemplate.getJdbcTemplate().execute("LISTEN " + channel);
  }

  /**
   * Returns the payloads received so far, in delivery order. Never blocks waiting for new ones.
   */
  public List<String> drainNotifications() {
    // pgjdbc only reads pending notifications off the socket during a round trip
    jdbcTemplate.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
    final PGNotification[] notifications;
    try {
      notifications = connection.unwrap(PGConnection.class).getNotifications();
    } catch (SQLException ex) {
      throw new DataAccessResourceFailureException("failed to read notifications", ex);
    }
    if (notifications == null) {
      return List.of();
    }
    final List<String> payloads = new ArrayList<>(notifications.length);
    for (PGNotification notification : notifications) {
      payloads.add(notification.getParameter());
    }
    return payloads;
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (SQLException ex) {
      logger.warn("failed to close primary connection", ex);
    }
  }
}
