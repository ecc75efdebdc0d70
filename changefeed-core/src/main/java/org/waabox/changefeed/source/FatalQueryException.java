package org.waabox.changefeed.source;

/**
 * An unrecoverable error reported by the data source for the subscription
 * query itself, for example a malformed query or a missing table.
 *
 * <p>It is never retried: the feed terminates with an error reason.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class FatalQueryException extends FeedException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public FatalQueryException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, may be null.
   */
  public FatalQueryException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
