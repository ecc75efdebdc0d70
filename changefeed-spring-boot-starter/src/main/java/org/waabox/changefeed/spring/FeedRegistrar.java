package org.waabox.changefeed.spring;

/**
 * A callback interface for declaring changefeeds in a Spring Boot
 * application.
 *
 * <p>Implement this interface as a Spring bean to register one or more
 * feeds. All discovered {@code FeedRegistrar} beans are invoked when the
 * {@link ChangefeedRegistry} bean is created; the registered feeds start
 * with the application context and stop when it closes.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Bean
 * FeedRegistrar peopleFeedRegistrar(JdbcFeedClient jdbcFeedClient) {
 *     return registry -> registry.register("people-feed",
 *         new PersonFeed(), "42", jdbcFeedClient);
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface FeedRegistrar {

  /**
   * Registers one or more feeds with the given registry.
   *
   * @param registry the registry to register feeds with, never null
   */
  void register(ChangefeedRegistry registry);
}
