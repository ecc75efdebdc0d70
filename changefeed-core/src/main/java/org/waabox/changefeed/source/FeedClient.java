package org.waabox.changefeed.source;

/**
 * The data source client a changefeed subscribes through.
 *
 * <p>The engine never inspects the query or the connection: both are
 * produced by the handler's {@code init} and handed back here on every
 * (re)connect attempt.
 *
 * @param <Q> the query description type
 * @param <C> the connection handle type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface FeedClient<Q, C> {

  /**
   * Runs the subscription query and opens a streaming cursor.
   *
   * <p>Implementations report failures through the {@link FeedException}
   * hierarchy so the engine can tell transient errors apart from fatal
   * ones.
   *
   * @param query      the subscription query, never null
   * @param connection the connection to run the query on, may be null if
   *                   the client does not need one
   *
   * @return the open cursor, never null
   *
   * @throws TransientFeedException     if the source is temporarily
   *                                    unavailable
   * @throws FatalQueryException        if the query can never succeed
   * @throws ConnectionClosedException  if the connection was closed
   */
  FeedCursor open(Q query, C connection);
}
