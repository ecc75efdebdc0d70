package org.waabox.changefeed.spring;

import java.util.List;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.changefeed.BackoffPolicy;
import org.waabox.changefeed.metrics.ChangefeedMetrics;
import org.waabox.changefeed.metrics.NoopChangefeedMetrics;
import org.waabox.changefeed.source.jdbc.JdbcFeedClient;
import org.waabox.changefeed.source.jdbc.JdbcFeedConfig;

/**
 * Spring Boot auto-configuration for changefeeds.
 *
 * <p>This configuration creates a {@link ChangefeedRegistry} holding the
 * feeds declared by every {@link FeedRegistrar} bean, configured from
 * {@link ChangefeedProperties} and an optional {@link ChangefeedMetrics}
 * bean. When the JDBC source is on the classpath and a {@link DataSource}
 * bean exists, a {@link JdbcFeedClient} bean is exposed as well.
 *
 * <p>The feeds' lifecycle (start/stop) is managed through Spring's
 * {@link SmartLifecycle}, ensuring proper ordering with other lifecycle
 * beans.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration(afterName =
    "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration")
@EnableConfigurationProperties(ChangefeedProperties.class)
public class ChangefeedAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ChangefeedAutoConfiguration.class);

  /**
   * Creates the reconnect {@link BackoffPolicy} from the
   * {@code changefeed.backoff-*} properties, unless the application
   * defines its own.
   *
   * @param properties the configuration properties, never null
   *
   * @return the backoff policy, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public BackoffPolicy changefeedBackoffPolicy(
      final ChangefeedProperties properties) {
    return BackoffPolicy.of(properties.getBackoffInitial(),
        properties.getBackoffMax());
  }

  /**
   * Creates the singleton {@link ChangefeedRegistry} bean.
   *
   * <p>All discovered {@link FeedRegistrar} beans are invoked to register
   * their feeds.
   *
   * @param properties       the configuration properties, never null
   * @param backoffPolicy    the default backoff policy, never null
   * @param metricsProvider  provider for an optional ChangefeedMetrics bean
   * @param feedRegistrars   the list of feed registrars, may be empty
   *
   * @return the registry, never null
   */
  @Bean
  public ChangefeedRegistry changefeedRegistry(
      final ChangefeedProperties properties,
      final BackoffPolicy backoffPolicy,
      final ObjectProvider<ChangefeedMetrics> metricsProvider,
      final List<FeedRegistrar> feedRegistrars) {

    final ChangefeedMetrics metrics =
        metricsProvider.getIfAvailable(NoopChangefeedMetrics::new);

    final ChangefeedRegistry registry = new ChangefeedRegistry(backoffPolicy,
        properties.getCallTimeout(), properties.getStartTimeout(), metrics);

    for (final FeedRegistrar registrar : feedRegistrars) {
      registrar.register(registry);
      log.debug("Invoked FeedRegistrar: {}",
          registrar.getClass().getSimpleName());
    }

    log.info("Changefeed registry created with {} feed(s), backoff {} to {}",
        registry.names().size(), backoffPolicy.initialDelay(),
        backoffPolicy.maxDelay());

    return registry;
  }

  /**
   * Creates a {@link SmartLifecycle} bean that starts the registered feeds
   * with the context and stops them when it closes.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1})
   * to ensure all other beans are initialized first, and stops early
   * for the same reason.
   *
   * @param registry the registry to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle changefeedLifecycle(final ChangefeedRegistry registry) {
    return new SmartLifecycle() {

      @Override
      public void start() {
        log.info("Starting changefeeds...");
        registry.start();
      }

      @Override
      public void stop() {
        log.info("Stopping changefeeds...");
        registry.stop();
      }

      @Override
      public boolean isRunning() {
        return registry.isStarted();
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  /** Exposes the JDBC source when it is on the classpath. */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(JdbcFeedClient.class)
  @ConditionalOnBean(DataSource.class)
  static class JdbcSourceConfiguration {

    /**
     * Creates a {@link JdbcFeedClient} over the application's
     * {@link DataSource}.
     *
     * @param properties the configuration properties, never null
     * @param dataSource the data source, never null
     *
     * @return the JDBC feed client, never null
     */
    @Bean
    @ConditionalOnMissingBean
    public JdbcFeedClient jdbcFeedClient(final ChangefeedProperties properties,
        final DataSource dataSource) {
      final ChangefeedProperties.Jdbc jdbc = properties.getJdbc();
      log.info("Changefeed JDBC source on table '{}', polling every {}",
          jdbc.getTableName(), jdbc.getPollInterval());
      return JdbcFeedClient.create(JdbcFeedConfig.create(dataSource,
          jdbc.getTableName(), jdbc.getPollInterval(),
          jdbc.getGapTimeout()));
    }
  }
}
