package org.waabox.changefeed;

import java.util.concurrent.Future;

/**
 * An in-flight fetch of the next batch.
 *
 * @param token  the correlation token its completion event carries
 * @param future the worker task
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
record PendingFetch(long token, Future<?> future) {

  /** Interrupts the worker. Its completion, if any, is ignored. */
  void cancel() {
    future.cancel(true);
  }
}
