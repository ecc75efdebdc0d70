package org.waabox.changefeed.source.jdbc;

import static org.easymock.EasyMock.createMock;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import javax.sql.DataSource;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link JdbcFeedConfig}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JdbcFeedConfigTest {

  private final DataSource dataSource = createMock(DataSource.class);

  @Test
  void whenCreating_givenOnlyDataSource_shouldUseDefaults() {
    final JdbcFeedConfig config = JdbcFeedConfig.create(dataSource);

    assertSame(dataSource, config.dataSource());
    assertEquals("changefeed_log", config.tableName());
    assertEquals(Duration.ofMillis(200), config.pollInterval());
    assertEquals(Duration.ofSeconds(5), config.gapTimeout());
  }

  @Test
  void whenCreating_givenNegativeGapTimeout_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        JdbcFeedConfig.create(dataSource, "log", Duration.ofSeconds(1),
            Duration.ofMillis(-1))
    );
  }

  @Test
  void whenCreating_givenBlankTable_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        JdbcFeedConfig.create(dataSource, " ", Duration.ofSeconds(1))
    );
  }

  @Test
  void whenCreating_givenZeroPollInterval_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        JdbcFeedConfig.create(dataSource, "log", Duration.ZERO)
    );
  }

  @Test
  void whenCreating_givenNullDataSource_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        JdbcFeedConfig.create(null)
    );
  }
}
