/*
 * Where: Common utilities
 * What: Converts Instant to and from JDBC Timestamp explicitly
 * Why: PostgreSQL JDBC cannot always infer the SQL type of a bound Instant
 */
package com.jobagent.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is UTC, so Timestamp.from keeps it in UTC regardless of the server time zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
