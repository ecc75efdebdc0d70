package org.waabox.changefeed;

import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.changefeed.record.ChangeBatch;

/**
 * Invokes the callbacks of a {@link ChangefeedHandler} on behalf of the
 * state machine and turns their results into {@link Directive}s.
 *
 * <p>Exceptions thrown by the handler are not caught here, except for
 * {@link ChangefeedHandler#terminate}: they crash the feed. A callback
 * returning null is treated the same way.
 *
 * <p>Not thread-safe; only the feed thread uses it.
 *
 * @param <A> the start argument type
 * @param <S> the application state type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class CallbackDispatcher<A, S> {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(CallbackDispatcher.class);

  /** The feed name, for logging. */
  private final String feedName;

  /** The application handler. */
  private final ChangefeedHandler<A, S> handler;

  /**
   * Creates a new dispatcher.
   *
   * @param theFeedName the feed name, never null
   * @param theHandler  the handler, never null
   */
  CallbackDispatcher(final String theFeedName,
      final ChangefeedHandler<A, S> theHandler) {
    feedName = Objects.requireNonNull(theFeedName,
        "feedName must not be null");
    handler = Objects.requireNonNull(theHandler, "handler must not be null");
  }

  InitResult<S> initialize(final A args) {
    return require(handler.init(args), "init");
  }

  Directive<S> dispatchUpdate(final ChangeBatch batch, final S state) {
    final UpdateResult<S> result =
        require(handler.handleUpdate(batch, state), "handleUpdate");
    if (result.isStop()) {
      return Directive.stop(result.reason(), result.state());
    }
    return Directive.proceed(result.state(), null);
  }

  Directive<S> dispatchCall(final Object request, final ReplyTo from,
      final S state) {
    final CallResult<S> result =
        require(handler.handleCall(request, from, state), "handleCall");
    if (result.isStop()) {
      return result.hasReply()
          ? Directive.replyAndStop(result.reason(), result.reply(),
              result.state())
          : Directive.stop(result.reason(), result.state());
    }
    final Duration timeout = result.timeout().orElse(null);
    return result.hasReply()
        ? Directive.reply(result.reply(), result.state(), timeout)
        : Directive.proceed(result.state(), timeout);
  }

  Directive<S> dispatchCast(final Object message, final S state) {
    return toDirective(require(handler.handleCast(message, state),
        "handleCast"));
  }

  Directive<S> dispatchInfo(final Object message, final S state) {
    return toDirective(require(handler.handleInfo(message, state),
        "handleInfo"));
  }

  MigrateResult<S> dispatchMigrate(final Object fromVersion, final S state,
      final Object extra) {
    return require(handler.codeChange(fromVersion, state, extra),
        "codeChange");
  }

  /**
   * Invokes {@link ChangefeedHandler#terminate}. Failures are logged and
   * discarded.
   *
   * @param reason the exit reason, never null
   * @param state  the last state, may be null
   */
  void dispatchTerminate(final ExitReason reason, final S state) {
    try {
      handler.terminate(reason, state);
    } catch (final RuntimeException e) {
      log.error("Changefeed '{}': terminate callback failed, ignoring",
          feedName, e);
    }
  }

  private Directive<S> toDirective(final NoReplyResult<S> result) {
    if (result.isStop()) {
      return Directive.stop(result.reason(), result.state());
    }
    return Directive.proceed(result.state(), result.timeout().orElse(null));
  }

  private <R> R require(final R result, final String callback) {
    if (result == null) {
      throw new IllegalStateException("Handler "
          + handler.getClass().getName() + " returned null from " + callback);
    }
    return result;
  }
}
