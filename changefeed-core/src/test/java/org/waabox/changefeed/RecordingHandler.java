package org.waabox.changefeed;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Function;

import org.waabox.changefeed.record.ChangeBatch;
import org.waabox.changefeed.record.ChangeRecord;

/**
 * A handler that counts the batches it received and records every
 * callback, answering a small vocabulary of calls and casts.
 *
 * <p>Its state is the number of batches seen.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class RecordingHandler implements ChangefeedHandler<String, Integer> {

  /** The batches received, in order. */
  final BlockingQueue<ChangeBatch> updates = new LinkedBlockingQueue<>();

  /** The casts received. */
  final BlockingQueue<Object> casts = new LinkedBlockingQueue<>();

  /** The info messages received. */
  final BlockingQueue<Object> infos = new LinkedBlockingQueue<>();

  /** The terminate reasons received. */
  final BlockingQueue<ExitReason> terminations = new LinkedBlockingQueue<>();

  /** Released once a "later" call is parked. */
  final CountDownLatch parked = new CountDownLatch(1);

  /** The journal shared with the feed client. */
  private final ScriptedFeedClient client;

  /** How init answers. */
  private final Function<String, InitResult<Integer>> init;

  /** The caller of a parked "later" call. */
  private ReplyTo parkedCaller;

  RecordingHandler(final ScriptedFeedClient theClient) {
    this(theClient, connection -> InitResult.subscribe("people", connection,
        0));
  }

  RecordingHandler(final ScriptedFeedClient theClient,
      final Function<String, InitResult<Integer>> theInit) {
    client = theClient;
    init = theInit;
  }

  @Override
  public InitResult<Integer> init(final String args) {
    return init.apply(args);
  }

  @Override
  public UpdateResult<Integer> handleUpdate(final ChangeBatch batch,
      final Integer state) {
    updates.add(batch);
    for (final ChangeRecord record : batch.records()) {
      if (record.newValue() != null
          && "stop".equals(record.newValue().asText())) {
        return UpdateResult.stop(ExitReason.of("stop requested"), state + 1);
      }
    }
    return UpdateResult.next(state + 1);
  }

  @Override
  public CallResult<Integer> handleCall(final Object request,
      final ReplyTo from, final Integer state) {
    switch (String.valueOf(request)) {
      case "count":
        return CallResult.reply(state, state);
      case "later":
        parkedCaller = from;
        parked.countDown();
        return CallResult.noReply(state);
      case "answer":
        parkedCaller.reply("deferred");
        return CallResult.reply("ok", state);
      case "idle":
        return CallResult.reply("armed", state, Duration.ofMillis(100));
      case "slow-idle":
        return CallResult.reply("armed", state, Duration.ofMillis(500));
      case "bye":
        return CallResult.stop(ExitReason.normal(), "ciao", state);
      case "fail":
        throw new IllegalStateException("cannot handle " + request);
      default:
        return CallResult.noReply(state);
    }
  }

  @Override
  public NoReplyResult<Integer> handleCast(final Object message,
      final Integer state) {
    if ("quit".equals(message)) {
      return NoReplyResult.stop(ExitReason.of("quit"), state);
    }
    if ("break".equals(message)) {
      throw new AssertionError("broken invariant");
    }
    casts.add(message);
    return NoReplyResult.noReply(state);
  }

  @Override
  public NoReplyResult<Integer> handleInfo(final Object message,
      final Integer state) {
    infos.add(message);
    return NoReplyResult.noReply(state);
  }

  @Override
  public MigrateResult<Integer> codeChange(final Object fromVersion,
      final Integer state, final Object extra) {
    if ("v1".equals(fromVersion)) {
      return MigrateResult.ok(state + (Integer) extra);
    }
    return MigrateResult.error("unknown version " + fromVersion);
  }

  @Override
  public void terminate(final ExitReason reason, final Integer state) {
    client.record("terminate:" + reason);
    terminations.add(reason);
  }
}
