package org.waabox.changefeed.spring;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for changefeeds, mapped from the
 * {@code changefeed.*} prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code changefeed.backoff-initial} - the delay before the first
 *       reconnect attempt, 1 second by default.</li>
 *   <li>{@code changefeed.backoff-max} - the reconnect delay cap, 64
 *       seconds by default.</li>
 *   <li>{@code changefeed.call-timeout} - the default timeout of
 *       synchronous calls, 5 seconds by default.</li>
 *   <li>{@code changefeed.start-timeout} - how long starting a feed waits
 *       for its handler's init, 5 seconds by default.</li>
 *   <li>{@code changefeed.jdbc.table-name} and
 *       {@code changefeed.jdbc.poll-interval} - the JDBC source settings,
 *       used when a {@code DataSource} is available.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "changefeed")
public class ChangefeedProperties {

  /** The delay before the first reconnect attempt. */
  private Duration backoffInitial = Duration.ofSeconds(1);

  /** The reconnect delay cap. */
  private Duration backoffMax = Duration.ofSeconds(64);

  /** The default timeout of synchronous calls. */
  private Duration callTimeout = Duration.ofSeconds(5);

  /** How long starting a feed waits for init. */
  private Duration startTimeout = Duration.ofSeconds(5);

  /** The JDBC source settings. */
  private final Jdbc jdbc = new Jdbc();

  public Duration getBackoffInitial() {
    return backoffInitial;
  }

  public void setBackoffInitial(final Duration backoffInitial) {
    this.backoffInitial = backoffInitial;
  }

  public Duration getBackoffMax() {
    return backoffMax;
  }

  public void setBackoffMax(final Duration backoffMax) {
    this.backoffMax = backoffMax;
  }

  public Duration getCallTimeout() {
    return callTimeout;
  }

  public void setCallTimeout(final Duration callTimeout) {
    this.callTimeout = callTimeout;
  }

  public Duration getStartTimeout() {
    return startTimeout;
  }

  public void setStartTimeout(final Duration startTimeout) {
    this.startTimeout = startTimeout;
  }

  public Jdbc getJdbc() {
    return jdbc;
  }

  /** The {@code changefeed.jdbc.*} properties. */
  public static class Jdbc {

    /** The change-log table name. */
    private String tableName = "changefeed_log";

    /** How often an idle cursor polls the change log. */
    private Duration pollInterval = Duration.ofMillis(200);

    /** How long a cursor waits for a change committed out of order. */
    private Duration gapTimeout = Duration.ofSeconds(5);

    public String getTableName() {
      return tableName;
    }

    public void setTableName(final String tableName) {
      this.tableName = tableName;
    }

    public Duration getPollInterval() {
      return pollInterval;
    }

    public void setPollInterval(final Duration pollInterval) {
      this.pollInterval = pollInterval;
    }

    public Duration getGapTimeout() {
      return gapTimeout;
    }

    public void setGapTimeout(final Duration gapTimeout) {
      this.gapTimeout = gapTimeout;
    }
  }
}
