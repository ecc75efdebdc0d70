package org.waabox.changefeed;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.changefeed.record.ChangeBatch;

/**
 * Tests for {@link CallbackDispatcher}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CallbackDispatcherTest {

  private ChangefeedHandler<String, Integer> handler;

  private CallbackDispatcher<String, Integer> dispatcher;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    handler = createMock(ChangefeedHandler.class);
    dispatcher = new CallbackDispatcher<>("test-feed", handler);
  }

  @Test
  void whenDispatchingUpdate_givenNext_shouldProceedWithNewState() {
    final ChangeBatch batch = ChangeBatch.empty();
    expect(handler.handleUpdate(batch, 1)).andReturn(UpdateResult.next(2));
    replay(handler);

    final Directive<Integer> directive = dispatcher.dispatchUpdate(batch, 1);

    assertFalse(directive.isStop());
    assertFalse(directive.hasReply());
    assertEquals(2, directive.state());
    assertNull(directive.timeout());
    verify(handler);
  }

  @Test
  void whenDispatchingUpdate_givenStop_shouldStopWithReason() {
    final ChangeBatch batch = ChangeBatch.empty();
    expect(handler.handleUpdate(batch, 1)).andReturn(
        UpdateResult.stop(ExitReason.of("enough"), 3));
    replay(handler);

    final Directive<Integer> directive = dispatcher.dispatchUpdate(batch, 1);

    assertTrue(directive.isStop());
    assertEquals(ExitReason.of("enough"), directive.reason());
    assertEquals(3, directive.state());
    verify(handler);
  }

  @Test
  void whenDispatchingCall_givenReplyWithTimeout_shouldCarryBoth() {
    final ReplyTo from = new ReplyTo();
    expect(handler.handleCall("get", from, 1)).andReturn(
        CallResult.reply("one", 1, Duration.ofSeconds(1)));
    replay(handler);

    final Directive<Integer> directive =
        dispatcher.dispatchCall("get", from, 1);

    assertTrue(directive.hasReply());
    assertEquals("one", directive.reply());
    assertEquals(Duration.ofSeconds(1), directive.timeout());
    assertFalse(directive.isStop());
    verify(handler);
  }

  @Test
  void whenDispatchingCall_givenStopWithReply_shouldReplyAndStop() {
    final ReplyTo from = new ReplyTo();
    expect(handler.handleCall("bye", from, 1)).andReturn(
        CallResult.stop(ExitReason.normal(), "ciao", 1));
    replay(handler);

    final Directive<Integer> directive =
        dispatcher.dispatchCall("bye", from, 1);

    assertTrue(directive.hasReply());
    assertTrue(directive.isStop());
    assertEquals("ciao", directive.reply());
    assertEquals(ExitReason.normal(), directive.reason());
    verify(handler);
  }

  @Test
  void whenDispatchingCall_givenNoReply_shouldNotReply() {
    final ReplyTo from = new ReplyTo();
    expect(handler.handleCall("later", from, 1)).andReturn(
        CallResult.noReply(5));
    replay(handler);

    final Directive<Integer> directive =
        dispatcher.dispatchCall("later", from, 1);

    assertFalse(directive.hasReply());
    assertEquals(5, directive.state());
    verify(handler);
  }

  @Test
  void whenDispatchingCast_givenStop_shouldStop() {
    expect(handler.handleCast("quit", 1)).andReturn(
        NoReplyResult.stop(ExitReason.shutdown(), 1));
    replay(handler);

    final Directive<Integer> directive = dispatcher.dispatchCast("quit", 1);

    assertTrue(directive.isStop());
    assertEquals(ExitReason.shutdown(), directive.reason());
    verify(handler);
  }

  @Test
  void whenDispatchingInfo_givenNull_shouldFailFast() {
    expect(handler.handleInfo("ping", 1)).andReturn(null);
    replay(handler);

    assertThrows(IllegalStateException.class, () ->
        dispatcher.dispatchInfo("ping", 1)
    );
    verify(handler);
  }

  @Test
  void whenDispatchingInfo_givenHandlerException_shouldPropagate() {
    expect(handler.handleInfo("ping", 1)).andThrow(
        new IllegalArgumentException("bad"));
    replay(handler);

    assertThrows(IllegalArgumentException.class, () ->
        dispatcher.dispatchInfo("ping", 1)
    );
    verify(handler);
  }

  @Test
  void whenDispatchingTerminate_givenHandlerException_shouldSwallowIt() {
    handler.terminate(ExitReason.normal(), 1);
    expectLastCall().andThrow(new IllegalStateException("boom"));
    replay(handler);

    dispatcher.dispatchTerminate(ExitReason.normal(), 1);

    verify(handler);
  }

  @Test
  void whenDispatchingMigrate_givenError_shouldReturnIt() {
    expect(handler.codeChange("v1", 1, null)).andReturn(
        MigrateResult.error("unsupported"));
    replay(handler);

    final MigrateResult<Integer> result =
        dispatcher.dispatchMigrate("v1", 1, null);

    assertFalse(result.isOk());
    assertEquals("unsupported", result.error());
    verify(handler);
  }
}
