package org.waabox.changefeed;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import org.waabox.changefeed.record.ChangeBatch;
import org.waabox.changefeed.source.FeedCursor;

/**
 * Pulls the next batch from a cursor on a dedicated worker thread.
 *
 * <p>Each fetch gets a fresh correlation token; its outcome is posted to
 * the feed's mailbox as exactly one {@link FeedEvent.FetchSucceeded} or
 * {@link FeedEvent.FetchFailed} carrying that token, whatever the cursor
 * throws.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class Fetcher {

  /** Runs the blocking cursor reads. */
  private final ExecutorService worker;

  /** Where completion events are posted. */
  private final Consumer<FeedEvent> sink;

  /** The last token handed out. */
  private final AtomicLong tokens = new AtomicLong();

  /**
   * Creates a new fetcher.
   *
   * @param feedName the feed name, used for the worker thread name
   * @param theSink  receives completion events, never null
   */
  Fetcher(final String feedName, final Consumer<FeedEvent> theSink) {
    sink = Objects.requireNonNull(theSink, "sink must not be null");
    worker = Executors.newSingleThreadExecutor(r -> {
      final Thread thread = new Thread(r, "changefeed-" + feedName + "-fetch");
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Starts fetching the next batch.
   *
   * @param cursor the cursor to read from, never null
   *
   * @return the pending fetch, never null
   */
  PendingFetch begin(final FeedCursor cursor) {
    Objects.requireNonNull(cursor, "cursor must not be null");
    final long token = tokens.incrementAndGet();
    final Future<?> future = worker.submit(() -> fetch(token, cursor));
    return new PendingFetch(token, future);
  }

  /** Stops the worker, interrupting any fetch in progress. */
  void shutdown() {
    worker.shutdownNow();
  }

  private void fetch(final long token, final FeedCursor cursor) {
    final ChangeBatch batch;
    try {
      batch = cursor.next();
    } catch (final RuntimeException | Error e) {
      sink.accept(new FeedEvent.FetchFailed(token, e));
      return;
    }
    sink.accept(new FeedEvent.FetchSucceeded(token, batch));
  }
}
