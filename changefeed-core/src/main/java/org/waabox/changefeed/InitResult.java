package org.waabox.changefeed;

import java.util.Objects;

/**
 * The answer of {@link ChangefeedHandler#init}: either subscribe to a
 * query or refuse to start.
 *
 * @param <S> the application state type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InitResult<S> {

  /** The subscription query, null when stopping. */
  private final Object query;

  /** The connection handle, may be null. */
  private final Object connection;

  /** The initial application state, may be null. */
  private final S state;

  /** The stop reason, null when subscribing. */
  private final ExitReason reason;

  private InitResult(final Object theQuery, final Object theConnection,
      final S theState, final ExitReason theReason) {
    query = theQuery;
    connection = theConnection;
    state = theState;
    reason = theReason;
  }

  /**
   * Subscribes to the given query. {@link Changefeed#start} returns as soon
   * as this result is produced; the connection is established afterwards,
   * retrying with backoff if needed.
   *
   * @param query      the subscription query, never null
   * @param connection the connection handle, may be null
   * @param state      the initial application state, may be null
   * @param <S>        the application state type
   *
   * @return the result, never null
   */
  public static <S> InitResult<S> subscribe(final Object query,
      final Object connection, final S state) {
    Objects.requireNonNull(query, "query must not be null");
    return new InitResult<>(query, connection, state, null);
  }

  /**
   * Refuses to start; {@link Changefeed#start} throws a
   * {@link ChangefeedStartException} carrying the reason.
   *
   * @param reason the reason, never null
   * @param <S>    the application state type
   *
   * @return the result, never null
   */
  public static <S> InitResult<S> stop(final ExitReason reason) {
    Objects.requireNonNull(reason, "reason must not be null");
    return new InitResult<>(null, null, null, reason);
  }

  /**
   * Whether this result refuses to start.
   *
   * @return true if created by {@link #stop(ExitReason)}
   */
  public boolean isStop() {
    return reason != null;
  }

  /**
   * Returns the subscription query.
   *
   * @return the query, null for a stop result
   */
  public Object query() {
    return query;
  }

  /**
   * Returns the connection handle.
   *
   * @return the connection, may be null
   */
  public Object connection() {
    return connection;
  }

  /**
   * Returns the initial application state.
   *
   * @return the state, may be null
   */
  public S state() {
    return state;
  }

  /**
   * Returns the stop reason.
   *
   * @return the reason, null for a subscribe result
   */
  public ExitReason reason() {
    return reason;
  }
}
