package org.waabox.changefeed;

import java.time.Duration;

/**
 * Thrown when a synchronous {@link Changefeed#call(Object, Duration)} gets
 * no reply within its timeout.
 *
 * <p>The feed itself is unaffected and keeps processing. A reply produced
 * after the timeout is discarded.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CallTimeoutException extends ChangefeedException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param feedName the name of the feed, never null
   * @param timeout  the elapsed timeout, never null
   */
  public CallTimeoutException(final String feedName, final Duration timeout) {
    super("Call to changefeed '" + feedName + "' timed out after "
        + timeout.toMillis() + " ms");
  }
}
