/*
 * Where: Scheduler database access
 * What: Opens an unpooled session from the spring.datasource settings
 * Why: The control loop owns its session for LISTEN and agent registration
 */
package com.jobagent.scheduler.db;

import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;
import org.springframework.stereotype.Component;

@Component
public class PrimaryConnectionFactory {

  private final DataSource dataSource;

  public PrimaryConnectionFactory(DataSourceProperties properties) {
    this.dataSource =
        properties.initializeDataSourceBuilder().type(SimpleDriverDataSource.class).build();
  }

  public PrimaryConnection open() throws SQLException {
    final Connection connection = dataSource.getConnection();
    connection.setAutoCommit(true);
    return new PrimaryConnection(connection);
  }
}
