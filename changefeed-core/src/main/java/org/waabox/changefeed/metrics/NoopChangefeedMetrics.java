package org.waabox.changefeed.metrics;

import java.time.Duration;

import org.waabox.changefeed.ExitReason;

/**
 * A no-operation implementation of {@link ChangefeedMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopChangefeedMetrics implements ChangefeedMetrics {

  /** {@inheritDoc} */
  @Override
  public void batchReceived(final String feedName, final int recordCount) {
  }

  /** {@inheritDoc} */
  @Override
  public void connectFailed(final String feedName, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void reconnectScheduled(final String feedName,
      final Duration delay) {
  }

  /** {@inheritDoc} */
  @Override
  public void feedTerminated(final String feedName,
      final ExitReason reason) {
  }
}
