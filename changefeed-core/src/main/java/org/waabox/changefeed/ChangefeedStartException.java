package org.waabox.changefeed;

/**
 * Thrown by {@link Changefeed#start} when a feed could not be started.
 *
 * <p>This happens when the handler's {@code init} answers with a stop
 * directive, when {@code init} itself throws, or when it does not return
 * within the configured start timeout.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ChangefeedStartException extends ChangefeedException {

  private static final long serialVersionUID = 1L;

  /** The reason the feed did not start, never null. */
  private final transient ExitReason reason;

  /**
   * Creates a new exception for the given reason.
   *
   * @param feedName the name of the feed, never null
   * @param theReason the reason the feed did not start, never null
   */
  public ChangefeedStartException(final String feedName,
      final ExitReason theReason) {
    super("Changefeed '" + feedName + "' failed to start: " + theReason,
        theReason.cause().orElse(null));
    reason = theReason;
  }

  /**
   * Returns the reason the feed did not start.
   *
   * @return the exit reason, never null
   */
  public ExitReason reason() {
    return reason;
  }
}
