package org.waabox.changefeed;

/**
 * The lifecycle phase of a feed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum Phase {

  /** Initializing or opening the subscription against the source. */
  CONNECTING,

  /** Subscribed; batches are being pulled and dispatched. */
  STREAMING,

  /** The last connect or fetch failed; a retry is scheduled. */
  BACKING_OFF,

  /** Terminated. This phase is final. */
  STOPPED
}
