package org.waabox.changefeed;

/**
 * Base exception for all changefeed related errors.
 *
 * <p>This is an unchecked exception. Subclasses distinguish startup
 * failures, calls against a feed that is no longer running, call timeouts
 * and rejected state migrations.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ChangefeedException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ChangefeedException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, may be null.
   */
  public ChangefeedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
