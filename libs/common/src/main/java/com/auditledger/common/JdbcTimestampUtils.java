/*
 * Where: shared JDBC helpers
 * What: binds ledger instants as explicit Timestamps and reads them back
 * Why: the PostgreSQL driver cannot infer a SQL type for a bare Instant parameter
 */
package com.auditledger.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is UTC, so Timestamp.from keeps the same epoch value regardless of the DB time zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
