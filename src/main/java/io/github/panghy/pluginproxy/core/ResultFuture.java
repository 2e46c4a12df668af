package io.github.panghy.pluginproxy.core;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.warn;

/**
 * The result of an asynchronous capability operation.
 *
 * <p>A ResultFuture is always paired with exactly one {@link ResultPromise}, which is the
 * only way to complete it. The pair is a one-shot continuation: the first completion
 * wins and every later attempt is reported as a no-op by the promise. Listeners run
 * inline on the thread that completes the promise, which for this library is always
 * the channel thread delivering the reply.</p>
 *
 * <p>Results of capability operations are plain values (usually an {@code Integer}
 * result code), so there is no exceptional completion path: failures are encoded in
 * the value.</p>
 *
 * @param <T> The type of value this future holds
 */
public class ResultFuture<T> {

  private static final Logger LOGGER = Logger.getLogger(ResultFuture.class.getName());

  private final CompletableFuture<T> delegate = new CompletableFuture<>();
  private final ResultPromise<T> promise;

  /**
   * Creates a new, incomplete future together with its promise.
   */
  public ResultFuture() {
    this.promise = new ResultPromise<>(this);
  }

  /**
   * Creates a future that is already complete.
   *
   * @param value The value
   * @param <U>   The value type
   * @return A completed future
   */
  public static <U> ResultFuture<U> completed(U value) {
    ResultFuture<U> future = new ResultFuture<>();
    future.promise.complete(value);
    return future;
  }

  boolean complete(T value) {
    return delegate.complete(value);
  }

  /**
   * Returns the promise that completes this future.
   *
   * @return The promise
   */
  public ResultPromise<T> getPromise() {
    return promise;
  }

  /**
   * Checks whether a value has been delivered.
   *
   * @return true if completed
   */
  public boolean isDone() {
    return delegate.isDone();
  }

  /**
   * Returns the value of a completed future.
   *
   * @return The value
   * @throws IllegalStateException if the future has not completed yet
   */
  public T getNow() {
    if (!delegate.isDone()) {
      throw new IllegalStateException("Result is not available yet");
    }
    return delegate.join();
  }

  /**
   * Registers a listener that receives the value once it is delivered. If the future is
   * already complete the listener runs immediately on the calling thread.
   *
   * <p>A listener that throws does not affect other listeners or the code completing the
   * promise; the exception is logged.</p>
   *
   * @param listener The listener
   * @return This future
   */
  public ResultFuture<T> whenComplete(Consumer<? super T> listener) {
    delegate.thenAccept(value -> {
      try {
        listener.accept(value);
      } catch (RuntimeException e) {
        warn(LOGGER, "Completion listener failed", e);
      }
    });
    return this;
  }

  /**
   * Returns a future that completes with the mapped value of this one.
   *
   * @param mapper The mapping function
   * @param <U>    The new value type
   * @return The mapped future
   */
  public <U> ResultFuture<U> map(Function<? super T, ? extends U> mapper) {
    ResultFuture<U> result = new ResultFuture<>();
    whenComplete(value -> result.promise.complete(mapper.apply(value)));
    return result;
  }

  @Override
  public String toString() {
    return delegate.isDone() ? "ResultFuture[" + delegate.join() + "]" : "ResultFuture[pending]";
  }
}
