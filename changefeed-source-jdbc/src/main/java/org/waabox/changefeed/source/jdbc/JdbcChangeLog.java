package org.waabox.changefeed.source.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Objects;

import javax.sql.DataSource;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.changefeed.ChangefeedException;
import org.waabox.changefeed.record.ChangeRecordCodec;

/**
 * The change-log table a JDBC changefeed reads from.
 *
 * <p>Every row is one change of one record: its logical table, its id,
 * the value before and the value after the change, both as JSON text. A
 * creation has no old value and a deletion no new value. Rows are ordered
 * by the {@code seq} identity column, which cursors use as their position.
 *
 * <p>The table is created on demand with {@code CREATE TABLE IF NOT
 * EXISTS}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcChangeLog {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      JdbcChangeLog.class);

  /** The configuration, never null. */
  private final JdbcFeedConfig config;

  /**
   * Creates a change log over the configured table.
   *
   * @param theConfig the configuration, never null
   */
  public JdbcChangeLog(final JdbcFeedConfig theConfig) {
    Objects.requireNonNull(theConfig, "config cannot be null");
    config = theConfig;
  }

  /**
   * Appends a change to the log.
   *
   * @param table    the logical table name, never null
   * @param recordId the id of the changed record, never null
   * @param oldValue the value before the change, null for a creation
   * @param newValue the value after the change, null for a deletion
   *
   * @return the position of the new row, always positive
   *
   * @throws IllegalArgumentException if both values are null
   * @throws ChangefeedException if the row could not be written
   */
  public long append(final String table, final String recordId,
      final JsonNode oldValue, final JsonNode newValue) {
    Objects.requireNonNull(table, "table cannot be null");
    Objects.requireNonNull(recordId, "recordId cannot be null");

    final String oldJson = ChangeRecordCodec.writeValue(oldValue);
    final String newJson = ChangeRecordCodec.writeValue(newValue);
    if (oldJson == null && newJson == null) {
      throw new IllegalArgumentException(
          "A change needs an old or a new value");
    }

    createTableIfNotExists(config.dataSource());

    final String sql = "INSERT INTO " + config.tableName()
        + " (table_name, record_id, old_val, new_val, changed_at)"
        + " VALUES (?, ?, ?, ?, ?)";

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql,
             Statement.RETURN_GENERATED_KEYS)) {

      ps.setString(1, table);
      ps.setString(2, recordId);
      ps.setString(3, oldJson);
      ps.setString(4, newJson);
      ps.setTimestamp(5, Timestamp.from(Instant.now()));
      ps.executeUpdate();

      try (final ResultSet keys = ps.getGeneratedKeys()) {
        keys.next();
        final long seq = keys.getLong(1);
        log.debug("Appended change #{} of {}/{}", seq, table, recordId);
        return seq;
      }

    } catch (final SQLException e) {
      throw new ChangefeedException("Failed to append change of "
          + table + "/" + recordId + " to '" + config.tableName() + "'", e);
    }
  }

  /**
   * Creates the change-log table if it does not already exist.
   *
   * @param dataSource where to create it, never null
   *
   * @throws org.waabox.changefeed.source.FeedException if the DDL fails
   */
  void createTableIfNotExists(final DataSource dataSource) {
    final String ddl = "CREATE TABLE IF NOT EXISTS " + config.tableName()
        + " ("
        + "seq BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
        + "table_name VARCHAR(255) NOT NULL, "
        + "record_id VARCHAR(255) NOT NULL, "
        + "old_val VARCHAR(65535), "
        + "new_val VARCHAR(65535), "
        + "changed_at TIMESTAMP NOT NULL"
        + ")";

    try (final Connection conn = dataSource.getConnection();
         final PreparedStatement ps = conn.prepareStatement(ddl)) {

      ps.execute();
      log.debug("Ensured change-log table '{}' exists", config.tableName());

    } catch (final SQLException e) {
      throw SqlErrors.translate(
          "Creating change-log table '" + config.tableName() + "'", e);
    }
  }
}
