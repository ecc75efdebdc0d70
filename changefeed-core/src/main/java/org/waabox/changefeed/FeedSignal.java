package org.waabox.changefeed;

/**
 * Signals the engine delivers to {@link ChangefeedHandler#handleInfo}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum FeedSignal {

  /**
   * Delivered when a directive asked for a timeout and no other message
   * reached the feed before it elapsed.
   */
  IDLE_TIMEOUT
}
