package io.github.panghy.pluginproxy.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ResultFuture and ResultPromise.
 */
public class ResultFutureTest {

  @Test
  public void testFirstCompletionWins() {
    ResultFuture<Integer> future = new ResultFuture<>();
    ResultPromise<Integer> promise = future.getPromise();
    assertSame(future, promise.getFuture());
    assertFalse(future.isDone());
    assertThrows(IllegalStateException.class, future::getNow);

    assertTrue(promise.complete(1));
    assertFalse(promise.complete(2));
    assertTrue(promise.isCompleted());
    assertEquals(1, future.getNow());
  }

  @Test
  public void testListenersRunInline() {
    ResultFuture<String> future = new ResultFuture<>();
    List<String> seen = new ArrayList<>();
    future.whenComplete(seen::add);
    assertTrue(seen.isEmpty());

    future.getPromise().complete("done");
    assertEquals(List.of("done"), seen);

    future.whenComplete(value -> seen.add("late " + value));
    assertEquals(List.of("done", "late done"), seen);
  }

  @Test
  public void testFailingListenerDoesNotAffectOthers() {
    ResultFuture<Integer> future = new ResultFuture<>();
    List<Integer> seen = new ArrayList<>();
    future.whenComplete(value -> {
      throw new IllegalStateException("boom");
    });
    future.whenComplete(seen::add);

    assertTrue(future.getPromise().complete(3));
    assertEquals(List.of(3), seen);
  }

  @Test
  public void testMapAndCompleted() {
    ResultFuture<Integer> future = ResultFuture.completed(20);
    assertTrue(future.isDone());
    assertEquals("20!", future.map(value -> value + "!").getNow());

    ResultFuture<Integer> pending = new ResultFuture<>();
    ResultFuture<Integer> doubled = pending.map(value -> value * 2);
    assertFalse(doubled.isDone());
    pending.getPromise().complete(4);
    assertEquals(8, doubled.getNow());
  }
}
