package org.waabox.changefeed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link BackoffPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class BackoffPolicyTest {

  @Test
  void whenCreating_givenValidParams_shouldRetainValues() {
    final BackoffPolicy policy = BackoffPolicy.of(Duration.ofMillis(500),
        Duration.ofSeconds(30));

    assertEquals(Duration.ofMillis(500), policy.initialDelay());
    assertEquals(Duration.ofSeconds(30), policy.maxDelay());
  }

  @Test
  void whenUsingDefault_shouldStartAtOneSecondCappedAtSixtyFour() {
    final BackoffPolicy policy = BackoffPolicy.defaultPolicy();

    assertEquals(Duration.ofMillis(1000), policy.initialDelay());
    assertEquals(Duration.ofMillis(64000), policy.maxDelay());
  }

  @Test
  void whenFailingRepeatedly_givenDefaultPolicy_shouldDoubleUpToTheCap() {
    final BackoffPolicy policy = BackoffPolicy.defaultPolicy();

    final List<Long> delays = new ArrayList<>();
    Duration current = policy.initialDelay();
    for (int i = 0; i < 9; i++) {
      delays.add(policy.delayFor(current).toMillis());
      current = policy.next(current);
    }

    assertEquals(List.of(1000L, 2000L, 4000L, 8000L, 16000L, 32000L,
        64000L, 64000L, 64000L), delays);
  }

  @Test
  void whenComputingNext_givenDelayAboveCap_shouldDoubleTheCap() {
    final BackoffPolicy policy = BackoffPolicy.defaultPolicy();

    assertEquals(Duration.ofMillis(128000),
        policy.next(Duration.ofMillis(128000)));
    assertEquals(Duration.ofMillis(64000),
        policy.delayFor(Duration.ofMillis(128000)));
  }

  @Test
  void whenCreating_givenZeroInitialDelay_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        BackoffPolicy.of(Duration.ZERO, Duration.ofSeconds(1))
    );
  }

  @Test
  void whenCreating_givenNegativeInitialDelay_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        BackoffPolicy.of(Duration.ofSeconds(-1), Duration.ofSeconds(1))
    );
  }

  @Test
  void whenCreating_givenMaxShorterThanInitial_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        BackoffPolicy.of(Duration.ofSeconds(2), Duration.ofSeconds(1))
    );
  }

  @Test
  void whenCreating_givenNullDelay_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        BackoffPolicy.of(null, Duration.ofSeconds(1))
    );
  }
}
