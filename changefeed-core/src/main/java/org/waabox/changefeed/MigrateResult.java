package org.waabox.changefeed;

import java.util.Objects;

/**
 * The answer of {@link ChangefeedHandler#codeChange}: the migrated state,
 * or the reason the migration was rejected.
 *
 * @param <S> the application state type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MigrateResult<S> {

  /** The migrated state, may be null. */
  private final S state;

  /** The rejection reason, null on success. */
  private final String error;

  private MigrateResult(final S theState, final String theError) {
    state = theState;
    error = theError;
  }

  /**
   * Accepts the migration; the feed swaps to the given state.
   *
   * @param state the migrated state, may be null
   * @param <S>   the application state type
   *
   * @return the result, never null
   */
  public static <S> MigrateResult<S> ok(final S state) {
    return new MigrateResult<>(state, null);
  }

  /**
   * Rejects the migration; the feed keeps its current state.
   *
   * @param reason the rejection reason, never null
   * @param <S>    the application state type
   *
   * @return the result, never null
   */
  public static <S> MigrateResult<S> error(final String reason) {
    Objects.requireNonNull(reason, "reason must not be null");
    return new MigrateResult<>(null, reason);
  }

  /**
   * Whether the migration was accepted.
   *
   * @return true if created by {@link #ok(Object)}
   */
  public boolean isOk() {
    return error == null;
  }

  /**
   * Returns the migrated state.
   *
   * @return the state, may be null
   */
  public S state() {
    return state;
  }

  /**
   * Returns the rejection reason.
   *
   * @return the reason, null on success
   */
  public String error() {
    return error;
  }
}
