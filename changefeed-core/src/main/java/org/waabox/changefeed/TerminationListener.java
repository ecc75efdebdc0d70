package org.waabox.changefeed;

/**
 * A listener that is notified when a feed terminates.
 *
 * <p>Register it through {@link Changefeed#onTermination}. It is invoked
 * once, after the cursor was released and the handler's
 * {@code terminate} ran.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface TerminationListener {

  /**
   * Called when the feed terminated.
   *
   * @param feedName the name of the feed, never null
   * @param reason   the exit reason, never null
   */
  void onTermination(String feedName, ExitReason reason);
}
