package org.waabox.changefeed.metrics;

import java.time.Duration;

import org.waabox.changefeed.ExitReason;

/**
 * An abstraction for recording operational metrics of running feeds.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopChangefeedMetrics}
 * when metrics collection is not required.
 *
 * <p>All methods are invoked from the feed's own thread and must not
 * block.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangefeedMetrics {

  /**
   * Records a batch handed to the handler.
   *
   * @param feedName    the name of the feed, never null
   * @param recordCount the number of change records in the batch
   */
  void batchReceived(String feedName, int recordCount);

  /**
   * Records a failed connect or fetch that will be retried.
   *
   * @param feedName the name of the feed, never null
   * @param cause    the failure, never null
   */
  void connectFailed(String feedName, Throwable cause);

  /**
   * Records a scheduled reconnect attempt.
   *
   * @param feedName the name of the feed, never null
   * @param delay    the delay before the next connect attempt, never null
   */
  void reconnectScheduled(String feedName, Duration delay);

  /**
   * Records the termination of a feed.
   *
   * @param feedName the name of the feed, never null
   * @param reason   the exit reason, never null
   */
  void feedTerminated(String feedName, ExitReason reason);
}
