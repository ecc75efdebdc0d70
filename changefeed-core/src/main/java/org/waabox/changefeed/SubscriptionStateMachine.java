package org.waabox.changefeed;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.changefeed.metrics.ChangefeedMetrics;
import org.waabox.changefeed.record.ChangeBatch;
import org.waabox.changefeed.source.ConnectionClosedException;
import org.waabox.changefeed.source.FatalQueryException;
import org.waabox.changefeed.source.FeedClient;
import org.waabox.changefeed.source.FeedCursor;
import org.waabox.changefeed.source.FeedException;
import org.waabox.changefeed.source.TransientFeedException;

/**
 * The process that owns one subscription.
 *
 * <p>A single feed thread consumes one mailbox. Fetch completions, backoff
 * timers, idle timeouts and every external request are posted to it, so
 * the phase, the cursor and the handler state are only ever touched by
 * that thread and handler callbacks never overlap. The only work running
 * beside it is the {@link Fetcher}, with at most one fetch in flight.
 *
 * <p>Phases move as follows:
 * <ul>
 *   <li>{@code CONNECTING}: the subscription is opened. Success dispatches
 *       the first batch and enters {@code STREAMING}; a transient failure
 *       enters {@code BACKING_OFF}; a fatal query error or a closed
 *       connection stops the feed.</li>
 *   <li>{@code STREAMING}: every batch of the pending fetch is dispatched
 *       and the next fetch started. A failed fetch releases the cursor and
 *       enters {@code BACKING_OFF}.</li>
 *   <li>{@code BACKING_OFF}: when the retry timer fires, connect again.</li>
 *   <li>{@code STOPPED}: final. Entered on any stop directive, stop request
 *       or crash, after the cursor was released and the handler's
 *       {@code terminate} ran.</li>
 * </ul>
 * Calls, casts and info messages are dispatched in every phase.
 *
 * @param <A> the start argument type
 * @param <S> the application state type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class SubscriptionStateMachine<A, S> implements Runnable {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SubscriptionStateMachine.class);

  /** The feed name. */
  private final String name;

  /** The start arguments handed to init. */
  private final A args;

  /** Invokes the handler. */
  private final CallbackDispatcher<A, S> dispatcher;

  /** The data source client. */
  private final FeedClient<Object, Object> client;

  /** The reconnect backoff policy. */
  private final BackoffPolicy backoffPolicy;

  /** The metrics reporter. */
  private final ChangefeedMetrics metrics;

  /** The feed's only inbox. */
  private final BlockingQueue<FeedEvent> mailbox = new LinkedBlockingQueue<>();

  /** Guards {@link #mailboxClosed} against concurrent posts. */
  private final Object mailboxLock = new Object();

  /** Whether the mailbox stopped accepting events. */
  private boolean mailboxClosed;

  /** Pulls batches off the feed thread. */
  private final Fetcher fetcher;

  /** Fires backoff retries and idle timeouts into the mailbox. */
  private final ScheduledExecutorService timers;

  /** Completed once init returned. */
  private final CompletableFuture<Void> started = new CompletableFuture<>();

  /** Released once the feed reached {@link Phase#STOPPED}. */
  private final CountDownLatch terminated = new CountDownLatch(1);

  /** The termination listeners, guarded by itself. */
  private final List<TerminationListener> listeners = new ArrayList<>();

  /** Callers blocked in {@link #call}, failed if the feed stops. */
  private final Set<ReplyTo> waitingCallers = ConcurrentHashMap.newKeySet();

  /** The current phase, written by the feed thread only. */
  private volatile Phase phase = Phase.CONNECTING;

  /** The exit reason, set once when stopping. */
  private volatile ExitReason exitReason;

  /** The feed thread. */
  private volatile Thread feedThread;

  // The fields below are owned by the feed thread.

  /** The subscription query from init. */
  private Object query;

  /** The connection handle from init. */
  private Object connection;

  /** The opaque application state. */
  private S state;

  /** The open cursor, only present while streaming. */
  private FeedCursor cursor;

  /** The fetch in flight, if any. */
  private PendingFetch pendingFetch;

  /** The backoff state: the delay of the next failed attempt. */
  private Duration currentDelay;

  /** The number of events processed so far. */
  private long processed;

  /**
   * Creates a new state machine. Nothing runs until {@link #start}.
   *
   * @param theName          the feed name, never null
   * @param handler          the application handler, never null
   * @param theArgs          the start arguments, may be null
   * @param feedClient       the data source client, never null
   * @param theBackoffPolicy the backoff policy, never null
   * @param theMetrics       the metrics reporter, never null
   */
  @SuppressWarnings("unchecked")
  SubscriptionStateMachine(final String theName,
      final ChangefeedHandler<A, S> handler, final A theArgs,
      final FeedClient<?, ?> feedClient,
      final BackoffPolicy theBackoffPolicy,
      final ChangefeedMetrics theMetrics) {
    name = Objects.requireNonNull(theName, "name must not be null");
    args = theArgs;
    dispatcher = new CallbackDispatcher<>(theName, handler);
    client = (FeedClient<Object, Object>) Objects.requireNonNull(feedClient,
        "feedClient must not be null");
    backoffPolicy = Objects.requireNonNull(theBackoffPolicy,
        "backoffPolicy must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    fetcher = new Fetcher(theName, this::post);
    timers = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread thread = new Thread(r, "changefeed-" + theName + "-timer");
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Starts the feed thread and blocks until the handler's init returned.
   *
   * @param startTimeout the maximum time to wait for init, never null
   *
   * @throws ChangefeedStartException if init refused to start, failed, or
   *                                  did not return in time
   */
  void start(final Duration startTimeout) {
    final Thread thread = new Thread(this, "changefeed-" + name);
    thread.setDaemon(true);
    feedThread = thread;
    thread.start();

    try {
      started.get(startTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final TimeoutException e) {
      final ExitReason reason = ExitReason.error(new TimeoutException(
          "init did not return within " + startTimeout.toMillis() + " ms"));
      final ChangefeedStartException failure =
          new ChangefeedStartException(name, reason);
      if (started.completeExceptionally(failure)) {
        throw failure;
      }
      // init returned right at the deadline.
      awaitStarted();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      final ExitReason reason = ExitReason.error(e);
      started.completeExceptionally(
          new ChangefeedStartException(name, reason));
      throw new ChangefeedStartException(name, reason);
    } catch (final ExecutionException e) {
      throw (ChangefeedStartException) e.getCause();
    }
  }

  /** Runs the feed: init, first connect, then the event loop. */
  @Override
  public void run() {
    if (!initialize()) {
      return;
    }
    try {
      connect();
      while (phase != Phase.STOPPED) {
        handle(mailbox.take());
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      terminate(ExitReason.shutdown());
    } catch (final RuntimeException | Error e) {
      log.error("Changefeed '{}' crashed", name, e);
      terminate(ExitReason.error(e));
    }
  }

  /**
   * Sends a synchronous request and waits for its reply.
   *
   * @param request the request, may be null
   * @param timeout the maximum time to wait, never null
   *
   * @return the reply, may be null
   */
  Object call(final Object request, final Duration timeout) {
    requireOffFeedThread("call");
    final ReplyTo from = new ReplyTo();
    waitingCallers.add(from);
    try {
      if (!post(new FeedEvent.Call(request, from))) {
        throw new ChangefeedStoppedException(name, exitReason);
      }
      return from.await(name, timeout);
    } finally {
      waitingCallers.remove(from);
    }
  }

  /**
   * Sends a fire-and-forget message. Dropped if the feed stopped.
   *
   * @param message the message, may be null
   */
  void cast(final Object message) {
    post(new FeedEvent.Cast(message));
  }

  /**
   * Sends an out-of-band message. Dropped if the feed stopped.
   *
   * @param message the message, may be null
   */
  void send(final Object message) {
    post(new FeedEvent.Info(message));
  }

  /**
   * Asks the handler to migrate its state and waits for the outcome.
   *
   * @param fromVersion the previous version, may be null
   * @param extra       extra migration data, may be null
   * @param timeout     the maximum time to wait, never null
   */
  void migrate(final Object fromVersion, final Object extra,
      final Duration timeout) {
    requireOffFeedThread("migrate");
    final CompletableFuture<Void> result = new CompletableFuture<>();
    if (!post(new FeedEvent.Migrate(fromVersion, extra, result))) {
      throw new ChangefeedStoppedException(name, exitReason);
    }
    try {
      result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final TimeoutException e) {
      throw new CallTimeoutException(name, timeout);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChangefeedException(
          "Interrupted while migrating changefeed '" + name + "'", e);
    } catch (final ExecutionException e) {
      if (e.getCause() instanceof RuntimeException failure) {
        throw failure;
      }
      throw new ChangefeedException("Changefeed '" + name
          + "' crashed while migrating", e.getCause());
    }
  }

  /**
   * Asks the feed to stop and waits until it did. Does nothing if the feed
   * already stopped.
   *
   * @param reason the exit reason, never null
   */
  void stop(final ExitReason reason) {
    requireOffFeedThread("stop");
    post(new FeedEvent.Stop(reason));
    try {
      terminated.await();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChangefeedException(
          "Interrupted while stopping changefeed '" + name + "'", e);
    }
  }

  /**
   * Waits for the feed to terminate.
   *
   * @param timeout the maximum time to wait, never null
   *
   * @return true if the feed terminated in time
   */
  boolean awaitTermination(final Duration timeout) {
    try {
      return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Registers a termination listener. If the feed already terminated, the
   * listener is invoked right away.
   *
   * @param listener the listener, never null
   */
  void addTerminationListener(final TerminationListener listener) {
    final ExitReason reason;
    synchronized (listeners) {
      if (exitReason == null) {
        listeners.add(listener);
        return;
      }
      reason = exitReason;
    }
    notifyListener(listener, reason);
  }

  String name() {
    return name;
  }

  Phase phase() {
    return phase;
  }

  Optional<ExitReason> exitReason() {
    return Optional.ofNullable(exitReason);
  }

  /**
   * Enqueues an event unless the feed stopped.
   *
   * @param event the event, never null
   *
   * @return true if the event was enqueued
   */
  boolean post(final FeedEvent event) {
    synchronized (mailboxLock) {
      if (mailboxClosed) {
        return false;
      }
      return mailbox.offer(event);
    }
  }

  private boolean initialize() {
    final InitResult<S> result;
    try {
      result = dispatcher.initialize(args);
    } catch (final RuntimeException | Error e) {
      log.error("Changefeed '{}': init failed", name, e);
      refuseStart(ExitReason.error(e));
      return false;
    }
    if (result.isStop()) {
      refuseStart(result.reason());
      return false;
    }

    query = result.query();
    connection = result.connection();
    state = result.state();
    currentDelay = backoffPolicy.initialDelay();

    if (!started.complete(null)) {
      log.warn("Changefeed '{}': start gave up waiting for init", name);
      terminate(ExitReason.shutdown());
      return false;
    }
    log.info("Changefeed '{}' initialized", name);
    return true;
  }

  private void refuseStart(final ExitReason reason) {
    log.warn("Changefeed '{}' refused to start: {}", name, reason);
    started.completeExceptionally(new ChangefeedStartException(name, reason));
    finish(reason);
  }

  private void handle(final FeedEvent event) {
    final long sequence = ++processed;

    if (event instanceof FeedEvent.FetchSucceeded fetched) {
      onBatch(fetched);
    } else if (event instanceof FeedEvent.FetchFailed failed) {
      onFetchFailed(failed);
    } else if (event instanceof FeedEvent.Retry) {
      if (phase == Phase.BACKING_OFF) {
        connect();
      }
    } else if (event instanceof FeedEvent.Call call) {
      onCall(call);
    } else if (event instanceof FeedEvent.Cast cast) {
      apply(dispatcher.dispatchCast(cast.message(), state));
    } else if (event instanceof FeedEvent.Info info) {
      apply(dispatcher.dispatchInfo(info.message(), state));
    } else if (event instanceof FeedEvent.IdleTimeout idle) {
      // Any event processed after the timeout was armed cancels it.
      if (idle.sequence() == sequence - 1) {
        apply(dispatcher.dispatchInfo(FeedSignal.IDLE_TIMEOUT, state));
      }
    } else if (event instanceof FeedEvent.Migrate migrate) {
      onMigrate(migrate);
    } else if (event instanceof FeedEvent.Stop stop) {
      terminate(stop.reason());
    }
  }

  private void connect() {
    phase = Phase.CONNECTING;
    final FeedCursor opened;
    try {
      opened = client.open(query, connection);
    } catch (final ConnectionClosedException e) {
      log.warn("Changefeed '{}': connection closed while subscribing", name);
      terminate(ExitReason.CONNECTION_CLOSED);
      return;
    } catch (final FatalQueryException e) {
      log.error("Changefeed '{}': the source rejected the query", name, e);
      terminate(ExitReason.error(e));
      return;
    } catch (final FeedException e) {
      backOff(e);
      return;
    }
    if (opened == null) {
      backOff(new TransientFeedException("The feed client opened no cursor"));
      return;
    }

    cursor = opened;
    phase = Phase.STREAMING;
    currentDelay = backoffPolicy.initialDelay();
    log.info("Changefeed '{}' subscribed", name);

    final ChangeBatch first = opened.firstBatch();
    if (first == null) {
      lostConnection(new TransientFeedException(
          "The subscription returned no first batch"));
      return;
    }
    dispatchBatch(first);
  }

  private void dispatchBatch(final ChangeBatch batch) {
    metrics.batchReceived(name, batch.size());
    log.debug("Changefeed '{}': dispatching batch of {} record(s)", name,
        batch.size());

    final Directive<S> directive = dispatcher.dispatchUpdate(batch, state);
    state = directive.state();
    if (directive.isStop()) {
      terminate(directive.reason());
      return;
    }
    pendingFetch = fetcher.begin(cursor);
  }

  private void onBatch(final FeedEvent.FetchSucceeded fetched) {
    if (!isPending(fetched.token())) {
      log.debug("Changefeed '{}': dropping stale batch of fetch #{}", name,
          fetched.token());
      return;
    }
    pendingFetch = null;
    if (fetched.batch() == null) {
      lostConnection(new TransientFeedException(
          "Fetch #" + fetched.token() + " completed without a batch"));
      return;
    }
    currentDelay = backoffPolicy.initialDelay();
    dispatchBatch(fetched.batch());
  }

  private void onFetchFailed(final FeedEvent.FetchFailed failed) {
    if (!isPending(failed.token())) {
      log.debug("Changefeed '{}': dropping stale failure of fetch #{}",
          name, failed.token());
      return;
    }
    pendingFetch = null;

    final Throwable error = failed.error();
    if (error instanceof ConnectionClosedException) {
      log.warn("Changefeed '{}': connection closed while fetching", name);
      terminate(ExitReason.CONNECTION_CLOSED);
    } else if (error instanceof FatalQueryException) {
      log.error("Changefeed '{}': the source rejected the query", name,
          error);
      terminate(ExitReason.error(error));
    } else if (error instanceof Error) {
      log.error("Changefeed '{}': the cursor crashed", name, error);
      terminate(ExitReason.error(error));
    } else {
      lostConnection(error);
    }
  }

  private void onCall(final FeedEvent.Call call) {
    final Directive<S> directive =
        dispatcher.dispatchCall(call.request(), call.from(), state);
    if (directive.hasReply()) {
      call.from().reply(directive.reply());
    }
    apply(directive);
  }

  private void onMigrate(final FeedEvent.Migrate migrate) {
    final MigrateResult<S> result;
    try {
      result = dispatcher.dispatchMigrate(migrate.fromVersion(), state,
          migrate.extra());
    } catch (final RuntimeException | Error e) {
      migrate.result().completeExceptionally(e);
      throw e;
    }
    if (result.isOk()) {
      state = result.state();
      log.info("Changefeed '{}': state migrated from version {}", name,
          migrate.fromVersion());
      migrate.result().complete(null);
    } else {
      log.warn("Changefeed '{}': migration from version {} rejected: {}",
          name, migrate.fromVersion(), result.error());
      migrate.result().completeExceptionally(
          new MigrationException(name, result.error()));
    }
  }

  private void apply(final Directive<S> directive) {
    state = directive.state();
    if (directive.isStop()) {
      terminate(directive.reason());
      return;
    }
    if (directive.timeout() != null) {
      schedule(new FeedEvent.IdleTimeout(processed), directive.timeout());
    }
  }

  private void lostConnection(final Throwable cause) {
    closeCursor();
    backOff(cause);
  }

  private void backOff(final Throwable cause) {
    final Duration delay = backoffPolicy.delayFor(currentDelay);
    currentDelay = backoffPolicy.next(currentDelay);
    phase = Phase.BACKING_OFF;

    metrics.connectFailed(name, cause);
    metrics.reconnectScheduled(name, delay);
    log.warn("Changefeed '{}': {}; reconnecting in {} ms", name,
        cause.getMessage(), delay.toMillis());

    schedule(new FeedEvent.Retry(), delay);
  }

  private void schedule(final FeedEvent event, final Duration delay) {
    timers.schedule(() -> post(event), delay.toMillis(),
        TimeUnit.MILLISECONDS);
  }

  private boolean isPending(final long token) {
    return pendingFetch != null && pendingFetch.token() == token;
  }

  private void closeCursor() {
    if (cursor == null) {
      return;
    }
    try {
      cursor.close();
    } catch (final RuntimeException e) {
      log.warn("Changefeed '{}': failed to close cursor", name, e);
    }
    cursor = null;
  }

  /**
   * Releases the subscription, runs the handler's terminate and stops.
   *
   * @param reason the exit reason, never null
   */
  private void terminate(final ExitReason reason) {
    if (phase == Phase.STOPPED) {
      return;
    }
    if (pendingFetch != null) {
      pendingFetch.cancel();
      pendingFetch = null;
    }
    try {
      closeCursor();
      dispatcher.dispatchTerminate(reason, state);
    } finally {
      finish(reason);
    }
  }

  /**
   * Moves to {@link Phase#STOPPED}: closes the mailbox, fails whoever is
   * still waiting, releases the threads and notifies the listeners.
   *
   * @param reason the exit reason, never null
   */
  private void finish(final ExitReason reason) {
    final List<TerminationListener> toNotify;
    synchronized (listeners) {
      exitReason = reason;
      toNotify = new ArrayList<>(listeners);
    }
    phase = Phase.STOPPED;

    final List<FeedEvent> undelivered = new ArrayList<>();
    synchronized (mailboxLock) {
      mailboxClosed = true;
      mailbox.drainTo(undelivered);
    }
    for (final FeedEvent event : undelivered) {
      if (event instanceof FeedEvent.Migrate migrate) {
        migrate.result().completeExceptionally(
            new ChangefeedStoppedException(name, reason));
      }
    }
    for (final ReplyTo caller : waitingCallers) {
      caller.fail(new ChangefeedStoppedException(name, reason));
    }

    fetcher.shutdown();
    timers.shutdownNow();

    if (reason.isError()) {
      log.error("Changefeed '{}' terminated: {}", name, reason);
    } else {
      log.info("Changefeed '{}' stopped: {}", name, reason);
    }
    try {
      metrics.feedTerminated(name, reason);
    } catch (final RuntimeException e) {
      log.warn("Changefeed '{}': metrics failed on termination", name, e);
    } finally {
      terminated.countDown();
    }
    for (final TerminationListener listener : toNotify) {
      notifyListener(listener, reason);
    }
  }

  private void notifyListener(final TerminationListener listener,
      final ExitReason reason) {
    try {
      listener.onTermination(name, reason);
    } catch (final RuntimeException e) {
      log.error("Termination listener threw exception for changefeed '{}'",
          name, e);
    }
  }

  private void awaitStarted() {
    try {
      started.get();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChangefeedStartException(name, ExitReason.error(e));
    } catch (final ExecutionException e) {
      throw (ChangefeedStartException) e.getCause();
    }
  }

  private void requireOffFeedThread(final String operation) {
    if (Thread.currentThread() == feedThread) {
      throw new IllegalStateException("Changefeed '" + name + "': " + operation
          + " cannot be used from the feed's own callbacks");
    }
  }
}
