package org.waabox.changefeed.source.jdbc;

import java.time.Duration;
import java.util.Objects;

import javax.sql.DataSource;

/**
 * Configuration of the JDBC change-log source.
 *
 * <p>Holds the {@link DataSource} used when a handler does not provide its
 * own connection, the name of the change-log table, and the interval at
 * which an idle cursor polls the table for new changes.
 *
 * <p>The gap timeout bounds how long a cursor waits for a missing
 * {@code seq} below rows it already saw: concurrent writers may commit out
 * of order, and a rolled back insert leaves a hole that never fills.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create(DataSource)},
 * {@link #create(DataSource, String, Duration)} and
 * {@link #create(DataSource, String, Duration, Duration)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcFeedConfig {

  /** Default change-log table name. */
  private static final String DEFAULT_TABLE_NAME = "changefeed_log";

  /** Default poll interval (200 milliseconds). */
  private static final Duration DEFAULT_POLL_INTERVAL =
      Duration.ofMillis(200);

  /** Default gap timeout (5 seconds). */
  private static final Duration DEFAULT_GAP_TIMEOUT = Duration.ofSeconds(5);

  /** The JDBC data source, never null. */
  private final DataSource dataSource;

  /** The change-log table name, never null. */
  private final String tableName;

  /** The polling interval, never null. */
  private final Duration pollInterval;

  /** How long a missing seq is waited for, never null. */
  private final Duration gapTimeout;

  /** Private constructor; use static factories.
   *
   * @param theDataSource   the JDBC data source
   * @param theTableName    the change-log table name
   * @param thePollInterval the poll interval
   * @param theGapTimeout   the gap timeout
   */
  private JdbcFeedConfig(final DataSource theDataSource,
      final String theTableName, final Duration thePollInterval,
      final Duration theGapTimeout) {
    dataSource = theDataSource;
    tableName = theTableName;
    pollInterval = thePollInterval;
    gapTimeout = theGapTimeout;
  }

  /**
   * Creates a configuration with all custom values.
   *
   * @param dataSource   the JDBC data source, never null
   * @param tableName    the change-log table name, never null or empty
   * @param pollInterval the polling interval, must be positive, never null
   * @param gapTimeout   how long a cursor waits for a change committed out
   *                     of order, must not be negative, never null
   *
   * @return a new configuration instance, never null
   */
  public static JdbcFeedConfig create(final DataSource dataSource,
      final String tableName, final Duration pollInterval,
      final Duration gapTimeout) {
    Objects.requireNonNull(dataSource, "dataSource cannot be null");
    Objects.requireNonNull(tableName, "tableName cannot be null");
    Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
    Objects.requireNonNull(gapTimeout, "gapTimeout cannot be null");

    if (tableName.isBlank()) {
      throw new IllegalArgumentException("tableName cannot be blank");
    }
    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException(
          "pollInterval must be positive, got: " + pollInterval);
    }
    if (gapTimeout.isNegative()) {
      throw new IllegalArgumentException(
          "gapTimeout cannot be negative, got: " + gapTimeout);
    }

    return new JdbcFeedConfig(dataSource, tableName, pollInterval,
        gapTimeout);
  }

  /**
   * Creates a configuration with the default gap timeout of 5 seconds.
   *
   * @param dataSource   the JDBC data source, never null
   * @param tableName    the change-log table name, never null or empty
   * @param pollInterval the polling interval, must be positive, never null
   *
   * @return a new configuration instance, never null
   */
  public static JdbcFeedConfig create(final DataSource dataSource,
      final String tableName, final Duration pollInterval) {
    return create(dataSource, tableName, pollInterval, DEFAULT_GAP_TIMEOUT);
  }

  /**
   * Creates a configuration with default table name and poll interval.
   *
   * <p>Defaults:
   * <ul>
   *   <li>Table name: {@code changefeed_log}</li>
   *   <li>Poll interval: 200 milliseconds</li>
   *   <li>Gap timeout: 5 seconds</li>
   * </ul>
   *
   * @param dataSource the JDBC data source, never null
   *
   * @return a new configuration instance, never null
   */
  public static JdbcFeedConfig create(final DataSource dataSource) {
    return create(dataSource, DEFAULT_TABLE_NAME, DEFAULT_POLL_INTERVAL);
  }

  /**
   * Returns the JDBC data source.
   *
   * @return the data source, never null
   */
  public DataSource dataSource() {
    return dataSource;
  }

  /**
   * Returns the change-log table name.
   *
   * @return the table name, never null
   */
  public String tableName() {
    return tableName;
  }

  /**
   * Returns the polling interval.
   *
   * @return the poll interval, never null
   */
  public Duration pollInterval() {
    return pollInterval;
  }

  /**
   * Returns how long a cursor waits for a missing seq.
   *
   * @return the gap timeout, never null
   */
  public Duration gapTimeout() {
    return gapTimeout;
  }
}
