package org.waabox.changefeed;

import java.util.Objects;

/**
 * The answer of {@link ChangefeedHandler#handleUpdate}: fetch the next
 * batch, or stop the feed.
 *
 * @param <S> the application state type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class UpdateResult<S> {

  /** The new application state, may be null. */
  private final S state;

  /** The stop reason, null to keep streaming. */
  private final ExitReason reason;

  private UpdateResult(final S theState, final ExitReason theReason) {
    state = theState;
    reason = theReason;
  }

  /**
   * Keeps the feed streaming: the next batch is requested.
   *
   * @param state the new application state, may be null
   * @param <S>   the application state type
   *
   * @return the result, never null
   */
  public static <S> UpdateResult<S> next(final S state) {
    return new UpdateResult<>(state, null);
  }

  /**
   * Stops the feed. No further batch is requested and
   * {@link ChangefeedHandler#terminate} is invoked with the reason.
   *
   * @param reason the reason, never null
   * @param state  the final application state, may be null
   * @param <S>    the application state type
   *
   * @return the result, never null
   */
  public static <S> UpdateResult<S> stop(final ExitReason reason,
      final S state) {
    Objects.requireNonNull(reason, "reason must not be null");
    return new UpdateResult<>(state, reason);
  }

  /**
   * Whether this result stops the feed.
   *
   * @return true if created by {@link #stop(ExitReason, Object)}
   */
  public boolean isStop() {
    return reason != null;
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
   * Returns the stop reason.
   *
   * @return the reason, null unless stopping
   */
  public ExitReason reason() {
    return reason;
  }
}
