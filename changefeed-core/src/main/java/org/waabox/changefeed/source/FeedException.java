package org.waabox.changefeed.source;

import org.waabox.changefeed.ChangefeedException;

/**
 * Base exception raised by a {@link FeedClient} or a {@link FeedCursor}.
 *
 * <p>The engine reacts to the concrete subclass: a
 * {@link TransientFeedException} is retried with backoff, a
 * {@link FatalQueryException} aborts the feed, and a
 * {@link ConnectionClosedException} stops it with a distinguished reason.
 * Any other {@code FeedException} raised while fetching is handled as a
 * lost connection.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class FeedException extends ChangefeedException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public FeedException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, may be null.
   */
  public FeedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
