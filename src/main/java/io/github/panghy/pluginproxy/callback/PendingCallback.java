package io.github.panghy.pluginproxy.callback;

import io.github.panghy.pluginproxy.core.ResultPromise;

import java.util.function.IntUnaryOperator;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.warn;

/**
 * Bookkeeping for one asynchronous operation that is waiting for its reply.
 *
 * <p>A record is fired exactly once, either with the peer's result or with a result
 * synthesized locally (a failed send, an abort). Before the caller's promise is
 * completed the settler runs: it lets the issuing proxy finish local work that must be
 * visible to the caller, such as copying buffered data, and may adjust the value that is
 * delivered. If the settler throws, the caller receives {@link ResultCode#FAILED}.</p>
 */
public final class PendingCallback {

  private static final Logger LOGGER = Logger.getLogger(PendingCallback.class.getName());

  private final CallbackKey key;
  private final ResultPromise<Integer> promise;
  private final IntUnaryOperator settler;
  private boolean fired;

  PendingCallback(CallbackKey key, ResultPromise<Integer> promise, IntUnaryOperator settler) {
    this.key = key;
    this.promise = promise;
    this.settler = settler;
  }

  public CallbackKey getKey() {
    return key;
  }

  /**
   * Completes the caller's promise.
   *
   * @param result The result from the peer or a local failure code
   * @return true if this call fired the record
   */
  boolean fire(int result) {
    if (fired) {
      warn(LOGGER, "Callback " + key + " fired twice, ignoring result " + result);
      return false;
    }
    fired = true;
    int delivered = result;
    if (settler != null) {
      try {
        delivered = settler.applyAsInt(result);
      } catch (RuntimeException e) {
        warn(LOGGER, "Settling " + key + " with result " + result + " failed", e);
        delivered = ResultCode.FAILED.getCode();
      }
    }
    return promise.complete(delivered);
  }

  public boolean isFired() {
    return fired;
  }

  @Override
  public String toString() {
    return "PendingCallback[" + key + (fired ? ", fired" : "") + "]";
  }
}
