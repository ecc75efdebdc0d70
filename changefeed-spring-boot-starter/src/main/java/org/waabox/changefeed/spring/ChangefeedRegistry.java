package org.waabox.changefeed.spring;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.changefeed.BackoffPolicy;
import org.waabox.changefeed.Changefeed;
import org.waabox.changefeed.ChangefeedHandler;
import org.waabox.changefeed.ChangefeedOptions;
import org.waabox.changefeed.ChangefeedStartException;
import org.waabox.changefeed.ExitReason;
import org.waabox.changefeed.metrics.ChangefeedMetrics;
import org.waabox.changefeed.source.FeedClient;

/**
 * The feeds of a Spring application.
 *
 * <p>Feeds are registered by name, usually from {@link FeedRegistrar}
 * beans, and started together when the application context starts. Feeds
 * registered afterwards start right away. On shutdown every running feed
 * is stopped with {@link ExitReason#shutdown()}, in reverse registration
 * order.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChangefeedRegistry {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ChangefeedRegistry.class);

  /** The backoff policy of feeds registered without options. */
  private final BackoffPolicy backoffPolicy;

  /** The call timeout of feeds registered without options. */
  private final Duration callTimeout;

  /** The start timeout of feeds registered without options. */
  private final Duration startTimeout;

  /** The metrics reporter of feeds registered without options. */
  private final ChangefeedMetrics metrics;

  /** The registered feeds by name, in registration order. */
  private final Map<String, Registration<?, ?>> registrations =
      new LinkedHashMap<>();

  /** The started feeds by name, in start order. */
  private final Map<String, Changefeed> feeds = new LinkedHashMap<>();

  /** Whether the registry was started. */
  private boolean started;

  /**
   * Creates a new registry.
   *
   * @param theBackoffPolicy the default backoff policy, never null
   * @param theCallTimeout   the default call timeout, never null
   * @param theStartTimeout  the default start timeout, never null
   * @param theMetrics       the default metrics reporter, never null
   */
  public ChangefeedRegistry(final BackoffPolicy theBackoffPolicy,
      final Duration theCallTimeout, final Duration theStartTimeout,
      final ChangefeedMetrics theMetrics) {
    backoffPolicy = Objects.requireNonNull(theBackoffPolicy,
        "backoffPolicy must not be null");
    callTimeout = Objects.requireNonNull(theCallTimeout,
        "callTimeout must not be null");
    startTimeout = Objects.requireNonNull(theStartTimeout,
        "startTimeout must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Registers a feed with the registry defaults.
   *
   * @param name    the feed name, never null or blank
   * @param handler the feed handler, never null
   * @param args    the arguments handed to init, may be null
   * @param client  the data source client, never null
   * @param <A>     the start argument type
   * @param <S>     the application state type
   *
   * @throws IllegalArgumentException if a feed with that name exists
   */
  public <A, S> void register(final String name,
      final ChangefeedHandler<A, S> handler, final A args,
      final FeedClient<?, ?> client) {
    register(handler, args, ChangefeedOptions.builder(client)
        .name(name)
        .backoffPolicy(backoffPolicy)
        .callTimeout(callTimeout)
        .startTimeout(startTimeout)
        .metrics(metrics)
        .build());
  }

  /**
   * Registers a feed with its own options.
   *
   * @param handler the feed handler, never null
   * @param args    the arguments handed to init, may be null
   * @param options the feed options, never null
   * @param <A>     the start argument type
   * @param <S>     the application state type
   *
   * @throws IllegalArgumentException if a feed with that name exists
   */
  public <A, S> void register(final ChangefeedHandler<A, S> handler,
      final A args, final ChangefeedOptions options) {
    Objects.requireNonNull(handler, "handler must not be null");
    Objects.requireNonNull(options, "options must not be null");

    final Registration<A, S> registration =
        new Registration<>(handler, args, options);
    final boolean startNow;
    synchronized (this) {
      if (registrations.containsKey(options.name())) {
        throw new IllegalArgumentException(
            "A changefeed named '" + options.name() + "' is already"
                + " registered");
      }
      registrations.put(options.name(), registration);
      startNow = started;
    }
    log.debug("Registered changefeed '{}'", options.name());

    if (startNow) {
      launch(registration);
    }
  }

  /**
   * Starts every registered feed. If a feed fails to start, the feeds
   * already started are stopped and the failure is rethrown.
   *
   * @throws ChangefeedStartException if a feed refused to start
   */
  public void start() {
    final List<Registration<?, ?>> toStart;
    synchronized (this) {
      if (started) {
        return;
      }
      started = true;
      toStart = new ArrayList<>(registrations.values());
    }
    try {
      for (final Registration<?, ?> registration : toStart) {
        launch(registration);
      }
    } catch (final ChangefeedStartException e) {
      log.error("A changefeed failed to start, stopping the others", e);
      stop();
      throw e;
    }
    log.info("Started {} changefeed(s)", toStart.size());
  }

  /** Stops every running feed, in reverse start order. */
  public void stop() {
    final List<Changefeed> toStop;
    synchronized (this) {
      started = false;
      toStop = new ArrayList<>(feeds.values());
      feeds.clear();
    }
    Collections.reverse(toStop);
    for (final Changefeed feed : toStop) {
      feed.stop(ExitReason.shutdown());
    }
    log.info("Stopped {} changefeed(s)", toStop.size());
  }

  /**
   * Returns a started feed.
   *
   * @param name the feed name, never null
   *
   * @return the feed, empty if no feed with that name was started
   */
  public synchronized Optional<Changefeed> feed(final String name) {
    return Optional.ofNullable(feeds.get(name));
  }

  /**
   * Returns the names of the registered feeds.
   *
   * @return the names in registration order, never null
   */
  public synchronized List<String> names() {
    return List.copyOf(registrations.keySet());
  }

  /**
   * Whether the registry was started and not stopped since.
   *
   * @return true while started
   */
  public synchronized boolean isStarted() {
    return started;
  }

  /** Starts a feed, and stops it again if the registry stopped meanwhile. */
  private void launch(final Registration<?, ?> registration) {
    final Changefeed feed = registration.start();
    synchronized (this) {
      if (started) {
        feeds.put(feed.name(), feed);
        log.info("Started changefeed '{}'", feed.name());
        return;
      }
    }
    log.info("Registry stopped while changefeed '{}' was starting, stopping"
        + " it", feed.name());
    feed.stop(ExitReason.shutdown());
  }

  /** A feed waiting to be started. */
  private record Registration<A, S>(ChangefeedHandler<A, S> handler, A args,
      ChangefeedOptions options) {

    Changefeed start() {
      return Changefeed.start(handler, args, options);
    }
  }
}
