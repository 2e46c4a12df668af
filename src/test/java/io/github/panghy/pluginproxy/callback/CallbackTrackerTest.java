package io.github.panghy.pluginproxy.callback;

import io.github.panghy.pluginproxy.core.ResultFuture;
import io.github.panghy.pluginproxy.resource.WireResourceId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for CallbackTracker.
 */
public class CallbackTrackerTest {

  private static final WireResourceId LOADER = new WireResourceId(1, 10);
  private static final WireResourceId OTHER_LOADER = new WireResourceId(1, 11);
  private static final WireResourceId OTHER_INSTANCE = new WireResourceId(2, 10);

  private final CallbackTracker tracker = new CallbackTracker();

  @Test
  public void testReplyFiresExactlyOnce() {
    CallbackKey key = CallbackKey.single(LOADER, 5);
    List<Integer> results = new ArrayList<>();
    tracker.register(key).whenComplete(results::add);

    assertTrue(tracker.complete(key, 12));
    assertFalse(tracker.complete(key, 13));
    assertEquals(0, tracker.abortAll());

    assertThat(results).containsExactly(12);
    assertFalse(tracker.isPending(key));
  }

  @Test
  public void testStaleReplyIsDropped() {
    assertFalse(tracker.complete(CallbackKey.single(LOADER, 5), 0));
    assertEquals(0, tracker.pendingCount());
  }

  @Test
  public void testDuplicateRegistrationIsRejected() {
    CallbackKey key = CallbackKey.single(LOADER, 5);
    tracker.register(key);
    assertThrows(IllegalStateException.class, () -> tracker.register(key));
  }

  @Test
  public void testCallbackMayReissueSameKey() {
    CallbackKey key = CallbackKey.single(LOADER, 5);
    List<Integer> results = new ArrayList<>();
    tracker.register(key).whenComplete(result -> {
      results.add(result);
      if (results.size() == 1) {
        tracker.register(key).whenComplete(results::add);
      }
    });

    tracker.complete(key, 1);
    assertTrue(tracker.isPending(key));
    tracker.complete(key, 2);

    assertThat(results).containsExactly(1, 2);
    assertEquals(0, tracker.pendingCount());
  }

  @Test
  public void testSequencedKeysAreIndependent() {
    CallbackKey first = new CallbackKey(LOADER, 2, tracker.nextSequence());
    CallbackKey second = new CallbackKey(LOADER, 2, tracker.nextSequence());
    ResultFuture<Integer> firstFuture = tracker.register(first);
    ResultFuture<Integer> secondFuture = tracker.register(second);

    tracker.complete(second, 0);

    assertFalse(firstFuture.isDone());
    assertEquals(0, secondFuture.getNow());
    assertTrue(first.sequence() != 0 && first.sequence() != second.sequence());
  }

  @Test
  public void testSettlerRunsBeforeCaller() {
    CallbackKey key = CallbackKey.single(LOADER, 5);
    List<String> events = new ArrayList<>();
    tracker.register(key, result -> {
      events.add("settle " + result);
      return result + 1;
    }).whenComplete(result -> events.add("caller " + result));

    tracker.complete(key, 4);

    assertThat(events).containsExactly("settle 4", "caller 5");
  }

  @Test
  public void testFailingSettlerDeliversFailure() {
    CallbackKey key = CallbackKey.single(LOADER, 5);
    ResultFuture<Integer> future = tracker.register(key, result -> {
      throw new IllegalStateException("destination went away");
    });

    assertTrue(tracker.complete(key, 4));

    assertEquals(ResultCode.FAILED.getCode(), future.getNow());
    assertFalse(tracker.isPending(key));
    assertEquals(0, tracker.pendingCount());
  }

  @Test
  public void testAbortsByResourceAndInstance() {
    ResultFuture<Integer> a = tracker.register(CallbackKey.single(LOADER, 1));
    ResultFuture<Integer> b = tracker.register(CallbackKey.single(LOADER, 2));
    ResultFuture<Integer> c = tracker.register(CallbackKey.single(OTHER_LOADER, 1));
    ResultFuture<Integer> d = tracker.register(CallbackKey.single(OTHER_INSTANCE, 1));

    assertEquals(2, tracker.abortForResource(LOADER));
    assertEquals(ResultCode.ABORTED.getCode(), a.getNow());
    assertEquals(ResultCode.ABORTED.getCode(), b.getNow());
    assertFalse(c.isDone());

    assertEquals(1, tracker.abortForInstance(1));
    assertEquals(ResultCode.ABORTED.getCode(), c.getNow());
    assertFalse(d.isDone());

    assertEquals(1, tracker.abortAll());
    assertEquals(ResultCode.ABORTED.getCode(), d.getNow());
    assertEquals(0, tracker.pendingCount());
  }

  @Test
  public void testLateReplyAfterAbortIsStale() {
    CallbackKey key = CallbackKey.single(LOADER, 1);
    List<Integer> results = new ArrayList<>();
    tracker.register(key).whenComplete(results::add);

    tracker.abortForResource(LOADER);

    assertFalse(tracker.complete(key, 0));
    assertThat(results).containsExactly(ResultCode.ABORTED.getCode());
  }
}
