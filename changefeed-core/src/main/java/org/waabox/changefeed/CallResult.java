package org.waabox.changefeed;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * The answer of {@link ChangefeedHandler#handleCall}.
 *
 * <p>A call can be answered right away ({@link #reply}), later through
 * the {@link ReplyTo} ({@link #noReply}), or the feed can be stopped,
 * with or without a final reply.
 *
 * @param <S> the application state type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CallResult<S> {

  /** Whether a reply is carried. */
  private final boolean hasReply;

  /** The reply, may be null even when present. */
  private final Object reply;

  /** The new application state, may be null. */
  private final S state;

  /** The idle timeout, may be null. */
  private final Duration timeout;

  /** The stop reason, null to keep running. */
  private final ExitReason reason;

  private CallResult(final boolean theHasReply, final Object theReply,
      final S theState, final Duration theTimeout,
      final ExitReason theReason) {
    hasReply = theHasReply;
    reply = theReply;
    state = theState;
    timeout = theTimeout;
    reason = theReason;
  }

  /**
   * Answers the caller and keeps running.
   *
   * @param reply the reply, may be null
   * @param state the new application state, may be null
   * @param <S>   the application state type
   *
   * @return the result, never null
   */
  public static <S> CallResult<S> reply(final Object reply, final S state) {
    return new CallResult<>(true, reply, state, null, null);
  }

  /**
   * Answers the caller, keeps running, and arms an idle timeout.
   *
   * @param reply   the reply, may be null
   * @param state   the new application state, may be null
   * @param timeout the idle timeout, never null
   * @param <S>     the application state type
   *
   * @return the result, never null
   */
  public static <S> CallResult<S> reply(final Object reply, final S state,
      final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout must not be null");
    return new CallResult<>(true, reply, state, timeout, null);
  }

  /**
   * Keeps running without answering; the handler replies later through
   * {@link ReplyTo#reply(Object)}.
   *
   * @param state the new application state, may be null
   * @param <S>   the application state type
   *
   * @return the result, never null
   */
  public static <S> CallResult<S> noReply(final S state) {
    return new CallResult<>(false, null, state, null, null);
  }

  /**
   * Keeps running without answering, and arms an idle timeout.
   *
   * @param state   the new application state, may be null
   * @param timeout the idle timeout, never null
   * @param <S>     the application state type
   *
   * @return the result, never null
   */
  public static <S> CallResult<S> noReply(final S state,
      final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout must not be null");
    return new CallResult<>(false, null, state, timeout, null);
  }

  /**
   * Answers the caller, then stops the feed.
   *
   * @param reason the reason, never null
   * @param reply  the reply, may be null
   * @param state  the final application state, may be null
   * @param <S>    the application state type
   *
   * @return the result, never null
   */
  public static <S> CallResult<S> stop(final ExitReason reason,
      final Object reply, final S state) {
    Objects.requireNonNull(reason, "reason must not be null");
    return new CallResult<>(true, reply, state, null, reason);
  }

  /**
   * Stops the feed without answering; the caller fails with a
   * {@link ChangefeedStoppedException} unless it was answered through
   * {@link ReplyTo} before.
   *
   * @param reason the reason, never null
   * @param state  the final application state, may be null
   * @param <S>    the application state type
   *
   * @return the result, never null
   */
  public static <S> CallResult<S> stop(final ExitReason reason,
      final S state) {
    Objects.requireNonNull(reason, "reason must not be null");
    return new CallResult<>(false, null, state, null, reason);
  }

  /**
   * Whether this result carries a reply.
   *
   * @return true if the caller is answered by this result
   */
  public boolean hasReply() {
    return hasReply;
  }

  /**
   * Returns the reply.
   *
   * @return the reply, may be null
   */
  public Object reply() {
    return reply;
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
