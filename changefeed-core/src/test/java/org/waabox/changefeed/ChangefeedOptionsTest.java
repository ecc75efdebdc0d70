package org.waabox.changefeed;

import static org.easymock.EasyMock.createMock;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.waabox.changefeed.metrics.ChangefeedMetrics;
import org.waabox.changefeed.metrics.NoopChangefeedMetrics;
import org.waabox.changefeed.source.FeedClient;

/**
 * Tests for {@link ChangefeedOptions}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ChangefeedOptionsTest {

  @Test
  void whenBuilding_givenOnlyFeedClient_shouldApplyDefaults() {
    final FeedClient<?, ?> client = createMock(FeedClient.class);

    final ChangefeedOptions options = ChangefeedOptions.builder(client)
        .build();

    assertSame(client, options.feedClient());
    assertTrue(options.name().startsWith("changefeed-"));
    assertEquals(BackoffPolicy.defaultPolicy().initialDelay(),
        options.backoffPolicy().initialDelay());
    assertEquals(Duration.ofSeconds(5), options.callTimeout());
    assertEquals(Duration.ofSeconds(5), options.startTimeout());
    assertInstanceOf(NoopChangefeedMetrics.class, options.metrics());
  }

  @Test
  void whenBuilding_givenCustomValues_shouldUseThem() {
    final FeedClient<?, ?> client = createMock(FeedClient.class);
    final ChangefeedMetrics metrics = createMock(ChangefeedMetrics.class);
    final BackoffPolicy policy = BackoffPolicy.of(Duration.ofMillis(10),
        Duration.ofMillis(80));

    final ChangefeedOptions options = ChangefeedOptions.builder(client)
        .name("people-feed")
        .backoffPolicy(policy)
        .callTimeout(Duration.ofSeconds(1))
        .startTimeout(Duration.ofSeconds(2))
        .metrics(metrics)
        .build();

    assertEquals("people-feed", options.name());
    assertSame(policy, options.backoffPolicy());
    assertEquals(Duration.ofSeconds(1), options.callTimeout());
    assertEquals(Duration.ofSeconds(2), options.startTimeout());
    assertSame(metrics, options.metrics());
  }

  @Test
  void whenBuilding_givenNullFeedClient_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        ChangefeedOptions.builder(null)
    );
  }

  @Test
  void whenBuilding_givenBlankName_shouldThrow() {
    final FeedClient<?, ?> client = createMock(FeedClient.class);

    assertThrows(IllegalArgumentException.class, () ->
        ChangefeedOptions.builder(client).name("  ")
    );
  }

  @Test
  void whenBuilding_givenZeroCallTimeout_shouldThrow() {
    final FeedClient<?, ?> client = createMock(FeedClient.class);

    assertThrows(IllegalArgumentException.class, () ->
        ChangefeedOptions.builder(client).callTimeout(Duration.ZERO)
    );
  }
}
