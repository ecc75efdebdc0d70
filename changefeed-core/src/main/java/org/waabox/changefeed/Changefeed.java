package org.waabox.changefeed;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A running change-feed subscription.
 *
 * <p>A feed is started through {@link #start}, which runs the handler's
 * {@code init}, opens the subscription and keeps it alive: every batch the
 * source produces is delivered to {@link ChangefeedHandler#handleUpdate}
 * in order, lost connections are re-established with exponential backoff,
 * and the handler keeps answering messages while the feed reconnects.
 *
 * <pre>{@code
 * Changefeed feed = Changefeed.start(new PersonFeed(), "ada",
 *     ChangefeedOptions.builder(JdbcFeedClient.create(config)).build());
 *
 * Object person = feed.call("current");
 * feed.cast("reset");
 * feed.stop();
 * }</pre>
 *
 * <p>This class is thread-safe. None of its blocking operations may be
 * used from the feed's own handler callbacks.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Changefeed {

  /** The process behind this handle. */
  private final SubscriptionStateMachine<?, ?> machine;

  /** The default call timeout. */
  private final Duration callTimeout;

  private Changefeed(final SubscriptionStateMachine<?, ?> theMachine,
      final Duration theCallTimeout) {
    machine = theMachine;
    callTimeout = theCallTimeout;
  }

  /**
   * Starts a new feed and blocks until the handler's init returned.
   *
   * <p>The first subscription attempt happens after this method returned,
   * so a source that is down at start time does not fail the start: the
   * feed backs off and retries.
   *
   * @param handler the application handler, never null
   * @param args    the arguments handed to init, may be null
   * @param options the feed settings, never null
   * @param <A>     the start argument type
   * @param <S>     the application state type
   *
   * @return the running feed, never null
   *
   * @throws ChangefeedStartException if init asked to stop, threw an
   *                                  exception or did not return in time
   */
  public static <A, S> Changefeed start(final ChangefeedHandler<A, S> handler,
      final A args, final ChangefeedOptions options) {
    Objects.requireNonNull(handler, "handler must not be null");
    Objects.requireNonNull(options, "options must not be null");

    final SubscriptionStateMachine<A, S> machine =
        new SubscriptionStateMachine<>(options.name(), handler, args,
            options.feedClient(), options.backoffPolicy(), options.metrics());
    machine.start(options.startTimeout());
    return new Changefeed(machine, options.callTimeout());
  }

  /**
   * Sends a synchronous request, waiting up to the configured call timeout.
   *
   * @param request the request, may be null
   *
   * @return the handler's reply, may be null
   *
   * @throws CallTimeoutException        if no reply arrived in time
   * @throws ChangefeedStoppedException  if the feed is not running or
   *                                     terminated before replying
   */
  public Object call(final Object request) {
    return call(request, callTimeout);
  }

  /**
   * Sends a synchronous request.
   *
   * <p>The handler answers through {@link CallResult#reply}, or later
   * through {@link ReplyTo#reply}. If the handler stops with a reply, the
   * reply is still returned.
   *
   * @param request the request, may be null
   * @param timeout the maximum time to wait, never null
   *
   * @return the handler's reply, may be null
   *
   * @throws CallTimeoutException        if no reply arrived in time
   * @throws ChangefeedStoppedException  if the feed is not running or
   *                                     terminated before replying
   */
  public Object call(final Object request, final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout must not be null");
    return machine.call(request, timeout);
  }

  /**
   * Sends a fire-and-forget message to {@link ChangefeedHandler#handleCast}.
   * Messages sent to a stopped feed are discarded.
   *
   * @param message the message, may be null
   */
  public void cast(final Object message) {
    machine.cast(message);
  }

  /**
   * Sends an out-of-band message to {@link ChangefeedHandler#handleInfo}.
   * Messages sent to a stopped feed are discarded.
   *
   * @param message the message, may be null
   */
  public void send(final Object message) {
    machine.send(message);
  }

  /**
   * Asks the handler to migrate its state to a new code version, through
   * {@link ChangefeedHandler#codeChange}. The state is only replaced if the
   * handler answers {@link MigrateResult#ok}.
   *
   * @param fromVersion the previous code version, may be null
   * @param extra       extra migration data, may be null
   *
   * @throws MigrationException          if the handler rejected the
   *                                     migration
   * @throws ChangefeedStoppedException  if the feed is not running
   */
  public void migrate(final Object fromVersion, final Object extra) {
    machine.migrate(fromVersion, extra, callTimeout);
  }

  /**
   * Stops the feed normally and waits until it terminated.
   */
  public void stop() {
    stop(ExitReason.normal());
  }

  /**
   * Stops the feed and waits until it terminated. Stopping an already
   * stopped feed does nothing.
   *
   * @param reason the exit reason handed to terminate, never null
   */
  public void stop(final ExitReason reason) {
    Objects.requireNonNull(reason, "reason must not be null");
    machine.stop(reason);
  }

  /**
   * Registers a listener notified when the feed terminates. If the feed
   * already terminated, the listener is notified right away.
   *
   * @param listener the listener, never null
   */
  public void onTermination(final TerminationListener listener) {
    Objects.requireNonNull(listener, "listener must not be null");
    machine.addTerminationListener(listener);
  }

  /**
   * Waits for the feed to terminate.
   *
   * @param timeout the maximum time to wait, never null
   *
   * @return true if the feed terminated, false if the timeout elapsed
   */
  public boolean awaitTermination(final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout must not be null");
    return machine.awaitTermination(timeout);
  }

  public Phase phase() {
    return machine.phase();
  }

  public String name() {
    return machine.name();
  }

  public boolean isRunning() {
    return machine.phase() != Phase.STOPPED;
  }

  /**
   * Returns why the feed terminated.
   *
   * @return the exit reason, empty while the feed is running
   */
  public Optional<ExitReason> exitReason() {
    return machine.exitReason();
  }

  @Override
  public String toString() {
    return "Changefeed[" + name() + ", " + phase() + "]";
  }
}
