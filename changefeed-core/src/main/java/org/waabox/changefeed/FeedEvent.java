package org.waabox.changefeed;

import java.util.concurrent.CompletableFuture;

import org.waabox.changefeed.record.ChangeBatch;

/**
 * The events a feed's mailbox carries. Timers, callers and the fetch
 * worker all post into the same mailbox; only the feed thread consumes it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
interface FeedEvent {

  /** The backoff timer elapsed; connect again. */
  record Retry() implements FeedEvent {
  }

  /** The fetch identified by {@code token} produced a batch. */
  record FetchSucceeded(long token, ChangeBatch batch) implements FeedEvent {
  }

  /** The fetch identified by {@code token} failed. */
  record FetchFailed(long token, Throwable error) implements FeedEvent {
  }

  /** A synchronous request. */
  record Call(Object request, ReplyTo from) implements FeedEvent {
  }

  /** A fire-and-forget message. */
  record Cast(Object message) implements FeedEvent {
  }

  /** An out-of-band message. */
  record Info(Object message) implements FeedEvent {
  }

  /** A state migration request. */
  record Migrate(Object fromVersion, Object extra,
      CompletableFuture<Void> result) implements FeedEvent {
  }

  /** An idle timeout armed after the event numbered {@code sequence}. */
  record IdleTimeout(long sequence) implements FeedEvent {
  }

  /** A stop request from outside the feed. */
  record Stop(ExitReason reason) implements FeedEvent {
  }
}
