package org.waabox.changefeed;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines the exponential delay between reconnect attempts of a feed.
 *
 * <p>The first retry waits {@link #initialDelay()}; every further failed
 * attempt doubles the delay until it reaches {@link #maxDelay()}. A
 * successful connect starts over from the initial delay. The default
 * policy waits 1 second initially, capped at 64 seconds.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BackoffPolicy {

  /** The default initial delay. */
  private static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);

  /** The default maximum delay. */
  private static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(64);

  /** The delay before the first retry. */
  private final Duration initialDelay;

  /** The upper bound of any delay. */
  private final Duration maxDelay;

  /**
   * Creates a new backoff policy.
   *
   * @param theInitialDelay the first delay, never null
   * @param theMaxDelay     the delay cap, never null
   */
  private BackoffPolicy(final Duration theInitialDelay,
      final Duration theMaxDelay) {
    initialDelay = theInitialDelay;
    maxDelay = theMaxDelay;
  }

  /**
   * Creates a backoff policy with the given bounds.
   *
   * @param initialDelay the delay before the first retry, must be
   *                     positive, never null
   * @param maxDelay     the delay cap, must not be shorter than the
   *                     initial delay, never null
   * @return a new backoff policy, never null
   *
   * @throws IllegalArgumentException if initialDelay is not positive or
   *                                  maxDelay is shorter than initialDelay
   * @throws NullPointerException if any argument is null
   */
  public static BackoffPolicy of(final Duration initialDelay,
      final Duration maxDelay) {
    Objects.requireNonNull(initialDelay, "initialDelay must not be null");
    Objects.requireNonNull(maxDelay, "maxDelay must not be null");
    if (initialDelay.isZero() || initialDelay.isNegative()) {
      throw new IllegalArgumentException(
          "initialDelay must be positive, got: " + initialDelay);
    }
    if (maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("maxDelay " + maxDelay
          + " must not be shorter than initialDelay " + initialDelay);
    }
    return new BackoffPolicy(initialDelay, maxDelay);
  }

  /**
   * Creates the default policy: 1 second initial delay, 64 seconds cap.
   *
   * @return the default backoff policy, never null
   */
  public static BackoffPolicy defaultPolicy() {
    return new BackoffPolicy(DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY);
  }

  /**
   * Returns the delay before the first retry.
   *
   * @return the initial delay, never null
   */
  public Duration initialDelay() {
    return initialDelay;
  }

  /**
   * Returns the delay cap.
   *
   * @return the maximum delay, never null
   */
  public Duration maxDelay() {
    return maxDelay;
  }

  /**
   * Returns the delay to wait given the current backoff state.
   *
   * @param current the current backoff delay, never null
   *
   * @return the current delay capped at {@link #maxDelay()}, never null
   */
  public Duration delayFor(final Duration current) {
    Objects.requireNonNull(current, "current must not be null");
    return current.compareTo(maxDelay) > 0 ? maxDelay : current;
  }

  /**
   * Computes the backoff state that follows a failed attempt.
   *
   * @param previous the delay of the failed attempt, never null
   *
   * @return twice the capped previous delay, never null
   */
  public Duration next(final Duration previous) {
    return delayFor(previous).multipliedBy(2);
  }
}
