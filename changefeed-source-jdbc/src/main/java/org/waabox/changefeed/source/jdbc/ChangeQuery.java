package org.waabox.changefeed.source.jdbc;

import java.util.Objects;

/**
 * What a JDBC changefeed subscribes to: the changes of one logical table,
 * optionally narrowed to a single record.
 *
 * <p>With {@link #includeInitial()} the first batch of the subscription
 * carries the current value of every matching record, as creations,
 * before any change is streamed.
 *
 * @param table          the logical table name, never null or blank
 * @param recordId       the record id, null to follow the whole table
 * @param includeInitial whether the first batch holds the current values
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangeQuery(String table, String recordId,
    boolean includeInitial) {

  /**
   * Creates a new query.
   *
   * @throws IllegalArgumentException if the table name is blank
   */
  public ChangeQuery {
    Objects.requireNonNull(table, "table cannot be null");
    if (table.isBlank()) {
      throw new IllegalArgumentException("table cannot be blank");
    }
  }

  /**
   * Follows every change of a table.
   *
   * @param table the logical table name, never null
   *
   * @return the query, never null
   */
  public static ChangeQuery table(final String table) {
    return new ChangeQuery(table, null, false);
  }

  /**
   * Follows the changes of a single record.
   *
   * @param table    the logical table name, never null
   * @param recordId the record id, never null
   *
   * @return the query, never null
   */
  public static ChangeQuery record(final String table,
      final String recordId) {
    Objects.requireNonNull(recordId, "recordId cannot be null");
    return new ChangeQuery(table, recordId, false);
  }

  /**
   * Returns a copy of this query whose first batch carries the current
   * values.
   *
   * @return the query, never null
   */
  public ChangeQuery withInitial() {
    return new ChangeQuery(table, recordId, true);
  }
}
