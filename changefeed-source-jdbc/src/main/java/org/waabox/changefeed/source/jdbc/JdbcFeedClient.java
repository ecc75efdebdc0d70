package org.waabox.changefeed.source.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.changefeed.record.ChangeBatch;
import org.waabox.changefeed.record.ChangeRecord;
import org.waabox.changefeed.record.ChangeRecordCodec;
import org.waabox.changefeed.source.FeedClient;
import org.waabox.changefeed.source.FeedCursor;

/**
 * A {@link FeedClient} that follows a {@link JdbcChangeLog} table.
 *
 * <p>Opening a subscription records the current end of the log; the
 * returned cursor then polls for rows past that position. The connection
 * a handler returns from init is the {@link DataSource} to read from; a
 * null connection falls back to the configured one.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcFeedClient implements FeedClient<ChangeQuery, DataSource> {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      JdbcFeedClient.class);

  /** The configuration, never null. */
  private final JdbcFeedConfig config;

  /** The change log, used to create the table on demand. */
  private final JdbcChangeLog changeLog;

  private JdbcFeedClient(final JdbcFeedConfig theConfig) {
    config = theConfig;
    changeLog = new JdbcChangeLog(theConfig);
  }

  /**
   * Creates a client over the configured change-log table.
   *
   * @param config the configuration, never null
   *
   * @return a new client, never null
   */
  public static JdbcFeedClient create(final JdbcFeedConfig config) {
    Objects.requireNonNull(config, "config cannot be null");
    return new JdbcFeedClient(config);
  }

  /** {@inheritDoc} */
  @Override
  public FeedCursor open(final ChangeQuery query,
      final DataSource connection) {
    Objects.requireNonNull(query, "query cannot be null");
    final DataSource dataSource =
        connection != null ? connection : config.dataSource();

    changeLog.createTableIfNotExists(dataSource);

    try (final Connection conn = dataSource.getConnection()) {
      final long position = highWaterMark(conn);
      final ChangeBatch first = query.includeInitial()
          ? currentValues(conn, query, position)
          : ChangeBatch.empty();

      log.debug("Opened changefeed on {} at position {}", query, position);
      return new JdbcFeedCursor(dataSource, config, query, position, first);

    } catch (final SQLException e) {
      throw SqlErrors.translate("Subscribing to " + query, e);
    }
  }

  private long highWaterMark(final Connection conn) throws SQLException {
    final String sql = "SELECT COALESCE(MAX(seq), 0) FROM "
        + config.tableName();
    try (final PreparedStatement ps = conn.prepareStatement(sql);
         final ResultSet rs = ps.executeQuery()) {
      rs.next();
      return rs.getLong(1);
    }
  }

  /**
   * Folds the log up to the given position into the latest value of each
   * matching record. Deleted records are left out.
   */
  private ChangeBatch currentValues(final Connection conn,
      final ChangeQuery query, final long position) throws SQLException {
    final StringBuilder sql = new StringBuilder("SELECT record_id, new_val"
        + " FROM " + config.tableName()
        + " WHERE table_name = ? AND seq <= ?");
    if (query.recordId() != null) {
      sql.append(" AND record_id = ?");
    }
    sql.append(" ORDER BY seq");

    final Map<String, String> latest = new LinkedHashMap<>();
    try (final PreparedStatement ps = conn.prepareStatement(sql.toString())) {
      ps.setString(1, query.table());
      ps.setLong(2, position);
      if (query.recordId() != null) {
        ps.setString(3, query.recordId());
      }
      try (final ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          final String id = rs.getString("record_id");
          latest.remove(id);
          latest.put(id, rs.getString("new_val"));
        }
      }
    }

    final List<ChangeRecord> records = new ArrayList<>();
    for (final String value : latest.values()) {
      if (value != null) {
        records.add(ChangeRecord.created(ChangeRecordCodec.readValue(value)));
      }
    }
    return new ChangeBatch(records);
  }
}
