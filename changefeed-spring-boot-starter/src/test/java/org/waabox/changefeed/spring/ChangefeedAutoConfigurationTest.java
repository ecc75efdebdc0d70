package org.waabox.changefeed.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import javax.sql.DataSource;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.changefeed.BackoffPolicy;
import org.waabox.changefeed.CallResult;
import org.waabox.changefeed.Changefeed;
import org.waabox.changefeed.ChangefeedHandler;
import org.waabox.changefeed.ExitReason;
import org.waabox.changefeed.InitResult;
import org.waabox.changefeed.MigrateResult;
import org.waabox.changefeed.NoReplyResult;
import org.waabox.changefeed.ReplyTo;
import org.waabox.changefeed.UpdateResult;
import org.waabox.changefeed.record.ChangeBatch;
import org.waabox.changefeed.source.FeedClient;
import org.waabox.changefeed.source.TransientFeedException;
import org.waabox.changefeed.source.jdbc.JdbcFeedClient;

/**
 * Tests for {@link ChangefeedAutoConfiguration}.
 *
 * <p>Uses {@link ApplicationContextRunner} for fast, isolated testing
 * of the auto-configuration without bootstrapping a full Spring Boot
 * application.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ChangefeedAutoConfigurationTest {

  /** The application context runner configured with the auto-configuration. */
  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(
          AutoConfigurations.of(ChangefeedAutoConfiguration.class));

  @Test
  void whenContextLoads_givenNoProperties_shouldUseDefaultBackoff() {
    runner.run(context -> {
      final BackoffPolicy policy = context.getBean(BackoffPolicy.class);

      assertEquals(Duration.ofSeconds(1), policy.initialDelay());
      assertEquals(Duration.ofSeconds(64), policy.maxDelay());
      assertNotNull(context.getBean(ChangefeedRegistry.class));
      assertFalse(context.containsBean("jdbcFeedClient"));
    });
  }

  @Test
  void whenContextLoads_givenBackoffProperties_shouldBindThem() {
    runner.withPropertyValues("changefeed.backoff-initial=250ms",
            "changefeed.backoff-max=8s")
        .run(context -> {
          final BackoffPolicy policy = context.getBean(BackoffPolicy.class);

          assertEquals(Duration.ofMillis(250), policy.initialDelay());
          assertEquals(Duration.ofSeconds(8), policy.maxDelay());
        });
  }

  @Test
  void whenContextLoads_givenFeedRegistrar_shouldStartAndStopItsFeed() {
    final BlockingQueue<ExitReason> terminated = new LinkedBlockingQueue<>();

    runner.withUserConfiguration(TestFeedConfig.class)
        .withBean(Terminations.class, () -> new Terminations(terminated))
        .withPropertyValues("changefeed.call-timeout=2s")
        .run(context -> {
          final ChangefeedRegistry registry =
              context.getBean(ChangefeedRegistry.class);

          assertTrue(registry.isStarted());
          assertEquals(List.of("greeting-feed"), registry.names());

          final Changefeed feed = registry.feed("greeting-feed")
              .orElseThrow();
          assertTrue(feed.isRunning());
          assertEquals("hello", feed.call("greet"));
        });

    assertEquals(ExitReason.shutdown(), terminated.poll());
  }

  @Test
  void whenContextLoads_givenDataSource_shouldExposeJdbcFeedClient() {
    runner.withUserConfiguration(TestDataSourceConfig.class)
        .withPropertyValues("changefeed.jdbc.table-name=people_log",
            "changefeed.jdbc.poll-interval=100ms",
            "changefeed.jdbc.gap-timeout=2s")
        .run(context -> {
          assertNotNull(context.getBean(JdbcFeedClient.class));
          assertEquals(Duration.ofSeconds(2), context.getBean(
              ChangefeedProperties.class).getJdbc().getGapTimeout());
        });
  }

  /** Collects the reasons the test feeds terminated with. */
  record Terminations(BlockingQueue<ExitReason> reasons) {}

  /** Registers a feed over an unavailable source. */
  @Configuration(proxyBeanMethods = false)
  static class TestFeedConfig {

    @Bean
    FeedRegistrar greetingFeedRegistrar(final Terminations terminations) {
      final FeedClient<String, String> unavailable = (query, connection) -> {
        throw new TransientFeedException("Not reachable from tests");
      };
      return registry -> registry.register("greeting-feed",
          new GreetingFeed(terminations.reasons()), "hello", unavailable);
    }
  }

  /** Provides an H2 data source. */
  @Configuration(proxyBeanMethods = false)
  static class TestDataSourceConfig {

    @Bean
    DataSource dataSource() {
      final JdbcDataSource ds = new JdbcDataSource();
      ds.setURL("jdbc:h2:mem:testdb_" + System.nanoTime()
          + ";DB_CLOSE_DELAY=-1");
      ds.setUser("sa");
      ds.setPassword("");
      return ds;
    }
  }

  /** Answers every call with its greeting, whatever the feed does. */
  static class GreetingFeed implements ChangefeedHandler<String, String> {

    /** Where terminate reports to. */
    private final BlockingQueue<ExitReason> terminations;

    GreetingFeed(final BlockingQueue<ExitReason> theTerminations) {
      terminations = theTerminations;
    }

    @Override
    public InitResult<String> init(final String greeting) {
      return InitResult.subscribe("greetings", "nowhere", greeting);
    }

    @Override
    public UpdateResult<String> handleUpdate(final ChangeBatch batch,
        final String greeting) {
      return UpdateResult.next(greeting);
    }

    @Override
    public CallResult<String> handleCall(final Object request,
        final ReplyTo from, final String greeting) {
      return CallResult.reply(greeting, greeting);
    }

    @Override
    public NoReplyResult<String> handleCast(final Object message,
        final String greeting) {
      return NoReplyResult.noReply(greeting);
    }

    @Override
    public NoReplyResult<String> handleInfo(final Object message,
        final String greeting) {
      return NoReplyResult.noReply(greeting);
    }

    @Override
    public MigrateResult<String> codeChange(final Object fromVersion,
        final String greeting, final Object extra) {
      return MigrateResult.ok(greeting);
    }

    @Override
    public void terminate(final ExitReason reason, final String greeting) {
      terminations.add(reason);
    }
  }
}
