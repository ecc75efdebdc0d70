package org.waabox.changefeed;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.waabox.changefeed.record.ChangeBatch;
import org.waabox.changefeed.source.FeedCursor;
import org.waabox.changefeed.source.TransientFeedException;

/**
 * Tests for {@link Fetcher}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FetcherTest {

  private final BlockingQueue<FeedEvent> events = new LinkedBlockingQueue<>();

  private final Fetcher fetcher = new Fetcher("test-feed", events::add);

  @AfterEach
  void tearDown() {
    fetcher.shutdown();
  }

  @Test
  void whenFetching_givenBatch_shouldPostOneSuccessWithItsToken()
      throws Exception {
    final FeedCursor cursor = createMock(FeedCursor.class);
    final ChangeBatch batch = ChangeBatch.empty();
    expect(cursor.next()).andReturn(batch);
    replay(cursor);

    final PendingFetch pending = fetcher.begin(cursor);

    final FeedEvent event = events.poll(5, TimeUnit.SECONDS);
    final FeedEvent.FetchSucceeded success =
        assertInstanceOf(FeedEvent.FetchSucceeded.class, event);
    assertEquals(pending.token(), success.token());
    assertSame(batch, success.batch());
    assertNull(events.poll(100, TimeUnit.MILLISECONDS));
    verify(cursor);
  }

  @Test
  void whenFetching_givenCursorFailure_shouldPostFailure() throws Exception {
    final FeedCursor cursor = createMock(FeedCursor.class);
    final TransientFeedException failure =
        new TransientFeedException("lost");
    expect(cursor.next()).andThrow(failure);
    replay(cursor);

    final PendingFetch pending = fetcher.begin(cursor);

    final FeedEvent.FetchFailed failed = assertInstanceOf(
        FeedEvent.FetchFailed.class, events.poll(5, TimeUnit.SECONDS));
    assertEquals(pending.token(), failed.token());
    assertSame(failure, failed.error());
    verify(cursor);
  }

  @Test
  void whenFetching_givenCursorError_shouldStillPostOneFailure()
      throws Exception {
    final FeedCursor cursor = createMock(FeedCursor.class);
    final AssertionError error = new AssertionError("corrupt cursor");
    expect(cursor.next()).andThrow(error);
    replay(cursor);

    final PendingFetch pending = fetcher.begin(cursor);

    final FeedEvent.FetchFailed failed = assertInstanceOf(
        FeedEvent.FetchFailed.class, events.poll(5, TimeUnit.SECONDS));
    assertEquals(pending.token(), failed.token());
    assertSame(error, failed.error());
    assertNull(events.poll(100, TimeUnit.MILLISECONDS));
    verify(cursor);
  }

  @Test
  void whenFetchingTwice_shouldHandOutIncreasingTokens() throws Exception {
    final FeedCursor cursor = createMock(FeedCursor.class);
    expect(cursor.next()).andReturn(ChangeBatch.empty()).times(2);
    replay(cursor);

    final PendingFetch first = fetcher.begin(cursor);
    events.poll(5, TimeUnit.SECONDS);
    final PendingFetch second = fetcher.begin(cursor);
    events.poll(5, TimeUnit.SECONDS);

    assertTrue(second.token() > first.token());
    verify(cursor);
  }
}
