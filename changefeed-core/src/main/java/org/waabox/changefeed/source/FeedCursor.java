package org.waabox.changefeed.source;

import org.waabox.changefeed.record.ChangeBatch;

/**
 * A streaming cursor over a change feed.
 *
 * <p>The engine reads {@link #firstBatch()} once, right after the cursor
 * is opened, and then calls {@link #next()} from a worker thread, one call
 * at a time. {@link #close()} may be called from the feed thread while a
 * {@code next()} call is blocked; implementations must make that call
 * return, typically by throwing {@link ConnectionClosedException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface FeedCursor extends AutoCloseable {

  /**
   * Returns the batch that came back with the subscription itself.
   *
   * @return the first batch, never null, may be empty
   */
  ChangeBatch firstBatch();

  /**
   * Blocks until the next batch of changes is available.
   *
   * @return the next batch, never null
   *
   * @throws FeedException if the batch cannot be fetched
   */
  ChangeBatch next();

  /** Releases the cursor. Safe to call more than once. */
  @Override
  void close();
}
