/*
 * Where: Scheduler database access
 * What: Returns idle pooled connections when a cycle found nothing to run
 * Why: An idle agent should not pin server connections between polls
 */
package com.jobagent.scheduler.db;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import java.sql.SQLException;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class IdleConnectionReleaser {

  private static final Logger logger = LoggerFactory.getLogger(IdleConnectionReleaser.class);

  private final DataSource dataSource;

  public void releaseIdle() {
    try {
      if (!dataSource.isWrapperFor(HikariDataSource.class)) {
        return;
      }
      final HikariPoolMXBean pool = dataSource.unwrap(HikariDataSource.class).getHikariPoolMXBean();
      if (pool != null && pool.getIdleConnections() > 0) {
        pool.softEvictConnections();
        logger.debug("released idle pooled connections");
      }
    } catch (SQLException ex) {
      logger.warn("failed to release idle pooled connections", ex);
    }
  }
}
