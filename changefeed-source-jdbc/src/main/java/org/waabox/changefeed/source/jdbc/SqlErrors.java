package org.waabox.changefeed.source.jdbc;

import java.sql.SQLException;

import org.waabox.changefeed.source.FatalQueryException;
import org.waabox.changefeed.source.FeedException;
import org.waabox.changefeed.source.TransientFeedException;

/**
 * Maps {@link SQLException}s to the feed's failure classes by SQL state.
 *
 * <p>Connection exceptions (class {@code 08}) are transient. Syntax errors
 * and access rule violations (class {@code 42}) mean the query can never
 * succeed. Anything else is retried.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class SqlErrors {

  private SqlErrors() {
    throw new UnsupportedOperationException("Utility class");
  }

  static FeedException translate(final String action, final SQLException e) {
    final String state = e.getSQLState();
    final String message = action + " failed [" + state + "]: "
        + e.getMessage();
    if (state != null && state.startsWith("42")) {
      return new FatalQueryException(message, e);
    }
    return new TransientFeedException(message, e);
  }
}
