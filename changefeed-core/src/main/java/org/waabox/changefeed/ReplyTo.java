package org.waabox.changefeed;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The caller of a synchronous {@link Changefeed#call}.
 *
 * <p>Handlers normally answer by returning {@link CallResult#reply}. A
 * handler that answers {@link CallResult#noReply} can keep this object in
 * its state and answer later through {@link #reply(Object)}, from any
 * callback. Only the first reply counts.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ReplyTo {

  /** Completed with the reply, or failed when the feed stops first. */
  private final CompletableFuture<Object> result = new CompletableFuture<>();

  /** Package private, created by the engine for each call. */
  ReplyTo() {
  }

  /**
   * Sends the reply to the caller.
   *
   * @param reply the reply, may be null
   *
   * @return true if this was the first reply, false if the caller was
   *         already answered or the feed stopped
   */
  public boolean reply(final Object reply) {
    return result.complete(reply);
  }

  /**
   * Whether the caller was already answered or failed.
   *
   * @return true if no further reply will be delivered
   */
  public boolean isDone() {
    return result.isDone();
  }

  /**
   * Fails the caller.
   *
   * @param error the failure to report, never null
   */
  void fail(final RuntimeException error) {
    result.completeExceptionally(error);
  }

  /**
   * Blocks until the reply arrives.
   *
   * @param feedName the feed name for error reporting, never null
   * @param timeout  the maximum time to wait, never null
   *
   * @return the reply, may be null
   *
   * @throws CallTimeoutException if no reply arrived in time
   */
  Object await(final String feedName, final Duration timeout) {
    try {
      return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final TimeoutException e) {
      throw new CallTimeoutException(feedName, timeout);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChangefeedException(
          "Interrupted while calling changefeed '" + feedName + "'", e);
    } catch (final ExecutionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new ChangefeedException(
          "Call to changefeed '" + feedName + "' failed", e.getCause());
    }
  }
}
