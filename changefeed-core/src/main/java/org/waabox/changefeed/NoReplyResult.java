package org.waabox.changefeed;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * The answer of {@link ChangefeedHandler#handleCast} and
 * {@link ChangefeedHandler#handleInfo}: keep running or stop.
 *
 * @param <S> the application state type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NoReplyResult<S> {

  /** The new application state, may be null. */
  private final S state;

  /** The idle timeout, may be null. */
  private final Duration timeout;

  /** The stop reason, null to keep running. */
  private final ExitReason reason;

  private NoReplyResult(final S theState, final Duration theTimeout,
      final ExitReason theReason) {
    state = theState;
    timeout = theTimeout;
    reason = theReason;
  }

  /**
   * Keeps running.
   *
   * @param state the new application state, may be null
   * @param <S>   the application state type
   *
   * @return the result, never null
   */
  public static <S> NoReplyResult<S> noReply(final S state) {
    return new NoReplyResult<>(state, null, null);
  }

  /**
   * Keeps running and arms an idle timeout.
   *
   * @param state   the new application state, may be null
   * @param timeout the idle timeout, never null
   * @param <S>     the application state type
   *
   * @return the result, never null
   */
  public static <S> NoReplyResult<S> noReply(final S state,
      final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout must not be null");
    return new NoReplyResult<>(state, timeout, null);
  }

  /**
   * Stops the feed.
   *
   * @param reason the reason, never null
   * @param state  the final application state, may be null
   * @param <S>    the application state type
   *
   * @return the result, never null
   */
  public static <S> NoReplyResult<S> stop(final ExitReason reason,
      final S state) {
    Objects.requireNonNull(reason, "reason must not be null");
    return new NoReplyResult<>(state, null, reason);
  }

  /**
   * Returns the new application state.
   *
   * @return the state, may be null
   */
  public S state() {
    return state;
  }

  /**
   * Returns the idle timeout.
   *
   * @return the timeout, empty if none was requested
   */
  public Optional<Duration> timeout() {
    return Optional.ofNullable(timeout);
  }

  /**
   * Whether this result stops the feed.
   *
   * @return true for stop results
   */
  public boolean isStop() {
    return reason != null;
  }

  /**
   * Returns the stop reason.
   *
   * @return the reason, null unless stopping
   */
  public ExitReason reason() {
    return reason;
  }
}
