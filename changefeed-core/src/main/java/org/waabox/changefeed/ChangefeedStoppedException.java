package org.waabox.changefeed;

/**
 * Thrown when a request targets a feed that is not running, or when the
 * feed terminates before answering it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ChangefeedStoppedException extends ChangefeedException {

  private static final long serialVersionUID = 1L;

  /** The reason the feed terminated, may be null if still unknown. */
  private final transient ExitReason reason;

  /**
   * Creates a new exception.
   *
   * @param feedName  the name of the feed, never null
   * @param theReason the reason the feed terminated, may be null
   */
  public ChangefeedStoppedException(final String feedName,
      final ExitReason theReason) {
    super("Changefeed '" + feedName + "' is not running"
        + (theReason == null ? "" : ": " + theReason),
        theReason == null ? null : theReason.cause().orElse(null));
    reason = theReason;
  }

  /**
   * Returns the reason the feed terminated.
   *
   * @return the exit reason, or null if the feed had not finished
   *         terminating when the request was rejected
   */
  public ExitReason reason() {
    return reason;
  }
}
