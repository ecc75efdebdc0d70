package org.waabox.changefeed.source;

/**
 * Signals that the connection or cursor was closed out of band.
 *
 * <p>Unlike a {@link TransientFeedException} this is not retried: the feed
 * stops with {@link org.waabox.changefeed.ExitReason#CONNECTION_CLOSED}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ConnectionClosedException extends FeedException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ConnectionClosedException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, may be null.
   */
  public ConnectionClosedException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
