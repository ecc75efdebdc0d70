package org.waabox.changefeed;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

import org.waabox.changefeed.metrics.ChangefeedMetrics;
import org.waabox.changefeed.metrics.NoopChangefeedMetrics;
import org.waabox.changefeed.source.FeedClient;

/**
 * The settings a {@link Changefeed} is started with.
 *
 * <p>Instances are created through the fluent {@link Builder} starting
 * with {@link #builder(FeedClient)}:
 * <pre>{@code
 * ChangefeedOptions options = ChangefeedOptions.builder(jdbcFeedClient)
 *     .name("people-feed")
 *     .backoffPolicy(BackoffPolicy.of(Duration.ofMillis(500),
 *         Duration.ofSeconds(30)))
 *     .callTimeout(Duration.ofSeconds(2))
 *     .build();
 * }</pre>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChangefeedOptions {

  /** The default timeout of synchronous calls. */
  private static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(5);

  /** The default time start waits for the handler's init. */
  private static final Duration DEFAULT_START_TIMEOUT = Duration.ofSeconds(5);

  /** The feed name, used in logs, thread names and metrics. */
  private final String name;

  /** The data source client. */
  private final FeedClient<?, ?> feedClient;

  /** The reconnect backoff policy. */
  private final BackoffPolicy backoffPolicy;

  /** The default timeout of synchronous calls. */
  private final Duration callTimeout;

  /** The maximum time start waits for init. */
  private final Duration startTimeout;

  /** The metrics reporter. */
  private final ChangefeedMetrics metrics;

  private ChangefeedOptions(final String theName,
      final FeedClient<?, ?> theFeedClient,
      final BackoffPolicy theBackoffPolicy, final Duration theCallTimeout,
      final Duration theStartTimeout, final ChangefeedMetrics theMetrics) {
    name = theName;
    feedClient = theFeedClient;
    backoffPolicy = theBackoffPolicy;
    callTimeout = theCallTimeout;
    startTimeout = theStartTimeout;
    metrics = theMetrics;
  }

  /**
   * Creates a new builder for the given data source client.
   *
   * @param feedClient the client the feed subscribes through, never null
   *
   * @return a new builder, never null
   */
  public static Builder builder(final FeedClient<?, ?> feedClient) {
    return new Builder(feedClient);
  }

  /**
   * Returns the feed name.
   *
   * @return the name, never null
   */
  public String name() {
    return name;
  }

  /**
   * Returns the data source client.
   *
   * @return the client, never null
   */
  public FeedClient<?, ?> feedClient() {
    return feedClient;
  }

  /**
   * Returns the reconnect backoff policy.
   *
   * @return the policy, never null
   */
  public BackoffPolicy backoffPolicy() {
    return backoffPolicy;
  }

  /**
   * Returns the timeout used by {@link Changefeed#call(Object)}.
   *
   * @return the timeout, never null
   */
  public Duration callTimeout() {
    return callTimeout;
  }

  /**
   * Returns the maximum time {@link Changefeed#start} waits for init.
   *
   * @return the timeout, never null
   */
  public Duration startTimeout() {
    return startTimeout;
  }

  /**
   * Returns the metrics reporter.
   *
   * @return the metrics, never null
   */
  public ChangefeedMetrics metrics() {
    return metrics;
  }

  /**
   * A fluent builder for {@link ChangefeedOptions}.
   *
   * <p>Defaults:
   * <ul>
   *   <li>name: {@code changefeed-} followed by a random UUID</li>
   *   <li>backoffPolicy: {@link BackoffPolicy#defaultPolicy()}</li>
   *   <li>callTimeout: 5 seconds</li>
   *   <li>startTimeout: 5 seconds</li>
   *   <li>metrics: {@link NoopChangefeedMetrics}</li>
   * </ul>
   */
  public static final class Builder {

    /** The data source client. */
    private final FeedClient<?, ?> feedClient;

    /** The optional feed name. */
    private String name;

    /** The optional backoff policy. */
    private BackoffPolicy backoffPolicy;

    /** The optional call timeout. */
    private Duration callTimeout;

    /** The optional start timeout. */
    private Duration startTimeout;

    /** The optional metrics reporter. */
    private ChangefeedMetrics metrics;

    private Builder(final FeedClient<?, ?> theFeedClient) {
      feedClient = Objects.requireNonNull(theFeedClient,
          "feedClient must not be null");
    }

    /**
     * Sets the feed name.
     *
     * @param theName the name, never null or blank
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if theName is blank
     */
    public Builder name(final String theName) {
      Objects.requireNonNull(theName, "name must not be null");
      if (theName.isBlank()) {
        throw new IllegalArgumentException("name must not be blank");
      }
      name = theName;
      return this;
    }

    /**
     * Sets the reconnect backoff policy.
     *
     * @param theBackoffPolicy the policy, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder backoffPolicy(final BackoffPolicy theBackoffPolicy) {
      backoffPolicy = Objects.requireNonNull(theBackoffPolicy,
          "backoffPolicy must not be null");
      return this;
    }

    /**
     * Sets the timeout of {@link Changefeed#call(Object)}.
     *
     * @param theCallTimeout the timeout, must be positive, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder callTimeout(final Duration theCallTimeout) {
      callTimeout = requirePositive(theCallTimeout, "callTimeout");
      return this;
    }

    /**
     * Sets the maximum time {@link Changefeed#start} waits for init.
     *
     * @param theStartTimeout the timeout, must be positive, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder startTimeout(final Duration theStartTimeout) {
      startTimeout = requirePositive(theStartTimeout, "startTimeout");
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder metrics(final ChangefeedMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Builds the options, resolving unset values to their defaults.
     *
     * @return the options, never null
     */
    public ChangefeedOptions build() {
      return new ChangefeedOptions(
          name != null ? name : "changefeed-" + UUID.randomUUID(),
          feedClient,
          backoffPolicy != null
              ? backoffPolicy : BackoffPolicy.defaultPolicy(),
          callTimeout != null ? callTimeout : DEFAULT_CALL_TIMEOUT,
          startTimeout != null ? startTimeout : DEFAULT_START_TIMEOUT,
          metrics != null ? metrics : new NoopChangefeedMetrics());
    }

    private static Duration requirePositive(final Duration value,
        final String field) {
      Objects.requireNonNull(value, field + " must not be null");
      if (value.isZero() || value.isNegative()) {
        throw new IllegalArgumentException(
            field + " must be positive, got: " + value);
      }
      return value;
    }
  }
}
