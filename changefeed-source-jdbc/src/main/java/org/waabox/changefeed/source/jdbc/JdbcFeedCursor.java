package org.waabox.changefeed.source.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.changefeed.record.ChangeBatch;
import org.waabox.changefeed.record.ChangeRecord;
import org.waabox.changefeed.record.ChangeRecordCodec;
import org.waabox.changefeed.source.ConnectionClosedException;
import org.waabox.changefeed.source.FeedCursor;
import org.waabox.changefeed.source.TransientFeedException;

/**
 * A cursor over the change-log rows past a position.
 *
 * <p>{@link #next()} polls the table every poll interval until unseen
 * matching rows past the current position exist, and returns them in log
 * order.
 *
 * <p>A {@code seq} is allocated when a row is inserted, not when it is
 * committed, so a row may become visible after rows with a higher
 * {@code seq}. The position therefore only moves up to the first missing
 * {@code seq}; rows past it that were already returned are remembered and
 * skipped, and the late row is returned once it shows up. A missing
 * {@code seq} that does not show up within the gap timeout is given up
 * on, as a rolled back insert never commits.
 *
 * <p>Closing the cursor makes a running or later {@link #next()} fail with
 * {@link ConnectionClosedException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class JdbcFeedCursor implements FeedCursor {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      JdbcFeedCursor.class);

  /** Where to read from. */
  private final DataSource dataSource;

  /** The table and poll interval. */
  private final JdbcFeedConfig config;

  /** What to follow. */
  private final ChangeQuery query;

  /** The first batch, computed when the subscription was opened. */
  private final ChangeBatch firstBatch;

  /**
   * Every seq up to this one was seen or given up on. Only the fetch thread
   * touches this and the fields below.
   */
  private long position;

  /** The seqs past the position already seen, all past a missing one. */
  private final SortedSet<Long> seenAhead = new TreeSet<>();

  /** The missing seq being waited for, 0 if none. */
  private long gap;

  /** When the gap was noticed, in {@link System#nanoTime()} units. */
  private long gapNoticedAt;

  /** Whether the cursor was released. */
  private volatile boolean closed;

  JdbcFeedCursor(final DataSource theDataSource, final JdbcFeedConfig theConfig,
      final ChangeQuery theQuery, final long thePosition,
      final ChangeBatch theFirstBatch) {
    dataSource = theDataSource;
    config = theConfig;
    query = theQuery;
    position = thePosition;
    firstBatch = theFirstBatch;
  }

  /** {@inheritDoc} */
  @Override
  public ChangeBatch firstBatch() {
    return firstBatch;
  }

  /** {@inheritDoc} */
  @Override
  public ChangeBatch next() {
    while (true) {
      if (closed) {
        throw new ConnectionClosedException("The cursor on " + query
            + " was closed");
      }
      final List<ChangeRecord> changes = poll();
      if (!changes.isEmpty()) {
        return new ChangeBatch(changes);
      }
      try {
        Thread.sleep(config.pollInterval().toMillis());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TransientFeedException("Interrupted while waiting for "
            + "changes on " + query, e);
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    closed = true;
    log.debug("Closed cursor on {} at position {}", query, position);
  }

  /**
   * Reads every row past the position, since rows of other tables or
   * records also fill the seq range the position moves through.
   */
  private List<ChangeRecord> poll() {
    final String sql = "SELECT seq, table_name, record_id, old_val, new_val"
        + " FROM " + config.tableName()
        + " WHERE seq > ? ORDER BY seq";

    final List<ChangeRecord> changes = new ArrayList<>();
    try (final Connection conn = dataSource.getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql)) {

      ps.setLong(1, position);

      try (final ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          if (!seenAhead.add(rs.getLong("seq"))) {
            continue;
          }
          if (matches(rs.getString("table_name"),
              rs.getString("record_id"))) {
            changes.add(new ChangeRecord(
                ChangeRecordCodec.readValue(rs.getString("old_val")),
                ChangeRecordCodec.readValue(rs.getString("new_val"))));
          }
        }
      }

    } catch (final SQLException e) {
      throw SqlErrors.translate("Polling changes of " + query, e);
    }
    advance();
    return changes;
  }

  private boolean matches(final String table, final String recordId) {
    return query.table().equals(table)
        && (query.recordId() == null || query.recordId().equals(recordId));
  }

  /** Moves the position over the seen seqs, up to the first missing one. */
  private void advance() {
    while (!seenAhead.isEmpty()) {
      final long next = seenAhead.first();
      if (next == position + 1) {
        seenAhead.remove(next);
        position = next;
        continue;
      }
      final long missing = position + 1;
      final long now = System.nanoTime();
      if (gap != missing) {
        gap = missing;
        gapNoticedAt = now;
        return;
      }
      if (now - gapNoticedAt < config.gapTimeout().toNanos()) {
        return;
      }
      log.debug("Giving up on seq {} to {} of '{}'", missing, next - 1,
          config.tableName());
      position = next - 1;
    }
    gap = 0;
  }
}
