package io.github.panghy.pluginproxy.core;

/**
 * The completion handle for a {@link ResultFuture}.
 *
 * @param <T> The type of value this promise delivers
 */
public class ResultPromise<T> {

  private final ResultFuture<T> future;

  ResultPromise(ResultFuture<T> future) {
    this.future = future;
  }

  /**
   * Delivers the value to the future and its listeners.
   *
   * @param value The value
   * @return true if this call completed the future, false if it was already complete
   */
  public boolean complete(T value) {
    return future.complete(value);
  }

  /**
   * Returns the future this promise completes.
   *
   * @return The future
   */
  public ResultFuture<T> getFuture() {
    return future;
  }

  public boolean isCompleted() {
    return future.isDone();
  }
}
