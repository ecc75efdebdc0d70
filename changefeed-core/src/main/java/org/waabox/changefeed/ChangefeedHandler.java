package org.waabox.changefeed;

import org.waabox.changefeed.record.ChangeBatch;

/**
 * The application logic of a changefeed.
 *
 * <p>A handler decides what to subscribe to and how to react to every
 * batch of changes, while {@link Changefeed} owns the connection, the
 * reconnect backoff and the fetch loop. The handler's state is opaque to
 * the engine: each callback receives the current state and returns the
 * next one inside its result. Callbacks are never invoked concurrently
 * for a given feed.
 *
 * <p>A handler that keeps a local copy of a single record and serves it
 * to callers:
 * <pre>{@code
 * class PersonFeed implements ChangefeedHandler<String, JsonNode> {
 *
 *   public InitResult<JsonNode> init(final String id) {
 *     return InitResult.subscribe(ChangeQuery.record("people", id), db, null);
 *   }
 *
 *   public UpdateResult<JsonNode> handleUpdate(final ChangeBatch batch,
 *       final JsonNode person) {
 *     return UpdateResult.next(batch.first().newValue());
 *   }
 *
 *   public CallResult<JsonNode> handleCall(final Object request,
 *       final ReplyTo from, final JsonNode person) {
 *     return CallResult.reply(person, person);
 *   }
 *   ...
 * }
 * }</pre>
 *
 * <p>Exceptions thrown by any callback other than {@link #terminate}
 * crash the feed: it terminates with {@link ExitReason#error(Throwable)}.
 *
 * @param <A> the start argument type
 * @param <S> the application state type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangefeedHandler<A, S> {

  /**
   * Called when the feed starts. {@link Changefeed#start} blocks until
   * this method returns, so it must not block.
   *
   * @param args the start arguments, may be null
   *
   * @return {@link InitResult#subscribe} with the query, the connection
   *         and the initial state, or {@link InitResult#stop} to refuse to
   *         start, never null
   */
  InitResult<S> init(A args);

  /**
   * Called once per batch received from the feed, in the order the source
   * produced them, including the first batch of every (re)connect.
   *
   * @param batch the batch of changes, never null, may be empty
   * @param state the current state, may be null
   *
   * @return {@link UpdateResult#next} to fetch the next batch, or
   *         {@link UpdateResult#stop} to stop the feed, never null
   */
  UpdateResult<S> handleUpdate(ChangeBatch batch, S state);

  /**
   * Called for a synchronous {@link Changefeed#call}, in any phase.
   *
   * @param request the request, may be null
   * @param from    the caller, usable for a deferred reply, never null
   * @param state   the current state, may be null
   *
   * @return the call result, never null
   */
  CallResult<S> handleCall(Object request, ReplyTo from, S state);

  /**
   * Called for a fire-and-forget {@link Changefeed#cast}, in any phase.
   *
   * @param message the message, may be null
   * @param state   the current state, may be null
   *
   * @return the result, never null
   */
  NoReplyResult<S> handleCast(Object message, S state);

  /**
   * Called for an out-of-band {@link Changefeed#send} message, and for
   * {@link FeedSignal#IDLE_TIMEOUT} when a requested idle timeout elapses.
   *
   * @param message the message, may be null
   * @param state   the current state, may be null
   *
   * @return the result, never null
   */
  NoReplyResult<S> handleInfo(Object message, S state);

  /**
   * Called by {@link Changefeed#migrate} to upgrade the state in place.
   *
   * @param fromVersion the version the state was produced by, may be null
   * @param state       the current state, may be null
   * @param extra       extra migration data, may be null
   *
   * @return {@link MigrateResult#ok} with the migrated state, or
   *         {@link MigrateResult#error} to keep the current one, never null
   */
  MigrateResult<S> codeChange(Object fromVersion, S state, Object extra);

  /**
   * Called once when the feed stops, after the cursor was released.
   * Exceptions thrown here are logged and discarded.
   *
   * @param reason the exit reason, never null
   * @param state  the last state, may be null
   */
  void terminate(ExitReason reason, S state);
}
