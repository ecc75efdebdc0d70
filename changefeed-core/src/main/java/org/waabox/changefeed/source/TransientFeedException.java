package org.waabox.changefeed.source;

/**
 * A recoverable data source failure, such as a server that is temporarily
 * unavailable. The feed backs off and reconnects.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class TransientFeedException extends FeedException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public TransientFeedException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, may be null.
   */
  public TransientFeedException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
