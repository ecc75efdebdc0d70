package org.waabox.changefeed;

import java.time.Duration;

/**
 * The engine's own control directive, produced by the
 * {@link CallbackDispatcher} from whatever a handler callback returned.
 *
 * @param <S> the application state type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class Directive<S> {

  /** The state to keep, may be null. */
  private final S state;

  /** Whether the pending caller must be answered. */
  private final boolean hasReply;

  /** The reply for the pending caller, may be null. */
  private final Object reply;

  /** The idle timeout to arm, null for none. */
  private final Duration timeout;

  /** The stop reason, null to keep running. */
  private final ExitReason reason;

  private Directive(final S theState, final boolean theHasReply,
      final Object theReply, final Duration theTimeout,
      final ExitReason theReason) {
    state = theState;
    hasReply = theHasReply;
    reply = theReply;
    timeout = theTimeout;
    reason = theReason;
  }

  static <S> Directive<S> proceed(final S state, final Duration timeout) {
    return new Directive<>(state, false, null, timeout, null);
  }

  static <S> Directive<S> reply(final Object reply, final S state,
      final Duration timeout) {
    return new Directive<>(state, true, reply, timeout, null);
  }

  static <S> Directive<S> stop(final ExitReason reason, final S state) {
    return new Directive<>(state, false, null, null, reason);
  }

  static <S> Directive<S> replyAndStop(final ExitReason reason,
      final Object reply, final S state) {
    return new Directive<>(state, true, reply, null, reason);
  }

  S state() {
    return state;
  }

  boolean hasReply() {
    return hasReply;
  }

  Object reply() {
    return reply;
  }

  Duration timeout() {
    return timeout;
  }

  boolean isStop() {
    return reason != null;
  }

  ExitReason reason() {
    return reason;
  }
}
