package io.github.panghy.pluginproxy.callback;

import io.github.panghy.pluginproxy.core.ResultFuture;
import io.github.panghy.pluginproxy.resource.WireResourceId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntUnaryOperator;
import java.util.function.Predicate;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.debug;

/**
 * Matches replies from the peer with the asynchronous operations waiting for them.
 *
 * <p>A proxy registers a {@link PendingCallback} before it sends the call, so a reply
 * can never arrive for an operation the tracker does not know. When the reply arrives
 * the record is removed first and fired second: the caller's callback may issue a new
 * operation on the same resource with the same key, and that new record must not be
 * confused with the one being completed.</p>
 *
 * <p>Replies that match nothing are stale (the operation was already aborted or the
 * peer is confused) and are dropped. When the channel fails, {@link #abortAll()} fires
 * every remaining record with {@link ResultCode#ABORTED}.</p>
 *
 * <p>One tracker serves one dispatcher and is only touched from its channel thread.</p>
 */
public class CallbackTracker {

  private static final Logger LOGGER = Logger.getLogger(CallbackTracker.class.getName());

  private final Map<CallbackKey, PendingCallback> pending = new LinkedHashMap<>();
  private long lastSequence;

  /**
   * Allocates a sequence number for an operation that may have several requests in
   * flight on one resource.
   *
   * @return A sequence number, never 0
   */
  public long nextSequence() {
    return ++lastSequence;
  }

  /**
   * Registers an operation that is about to be sent.
   *
   * @param key The correlation key
   * @return The future the caller waits on
   * @throws IllegalStateException if an operation with the same key is already pending
   */
  public ResultFuture<Integer> register(CallbackKey key) {
    return register(key, null);
  }

  /**
   * Registers an operation that is about to be sent, with local work to run before the
   * caller sees the result.
   *
   * @param key     The correlation key
   * @param settler Runs with the result before the caller's future completes and returns
   *                the value to deliver; may be null
   * @return The future the caller waits on
   * @throws IllegalStateException if an operation with the same key is already pending
   */
  public ResultFuture<Integer> register(CallbackKey key, IntUnaryOperator settler) {
    if (pending.containsKey(key)) {
      throw new IllegalStateException("Operation already pending for " + key);
    }
    ResultFuture<Integer> future = new ResultFuture<>();
    pending.put(key, new PendingCallback(key, future.getPromise(), settler));
    return future;
  }

  /**
   * Fires the record for a key.
   *
   * @param key    The correlation key carried by the reply
   * @param result The result to deliver
   * @return true if a record was waiting, false for a stale reply
   */
  public boolean complete(CallbackKey key, int result) {
    PendingCallback callback = pending.remove(key);
    if (callback == null) {
      debug(LOGGER, "Dropping reply for " + key + ", nothing is waiting for it");
      return false;
    }
    return callback.fire(result);
  }

  /**
   * Checks whether an operation is waiting.
   *
   * @param key The correlation key
   * @return true if pending
   */
  public boolean isPending(CallbackKey key) {
    return pending.containsKey(key);
  }

  /**
   * Aborts every operation pending on a resource.
   *
   * @param resource The resource that went away
   * @return The number of operations aborted
   */
  public int abortForResource(WireResourceId resource) {
    return abortMatching(key -> key.resource().equals(resource));
  }

  /**
   * Aborts every operation pending on resources of an instance.
   *
   * @param instance The instance id
   * @return The number of operations aborted
   */
  public int abortForInstance(int instance) {
    return abortMatching(key -> key.resource().instance() == instance);
  }

  /**
   * Aborts everything still pending.
   *
   * @return The number of operations aborted
   */
  public int abortAll() {
    return abortMatching(key -> true);
  }

  private int abortMatching(Predicate<CallbackKey> filter) {
    List<PendingCallback> aborted = new ArrayList<>();
    pending.values().removeIf(callback -> {
      if (filter.test(callback.getKey())) {
        aborted.add(callback);
        return true;
      }
      return false;
    });
    for (PendingCallback callback : aborted) {
      callback.fire(ResultCode.ABORTED.getCode());
    }
    if (!aborted.isEmpty()) {
      debug(LOGGER, "Aborted " + aborted.size() + " pending operation(s)");
    }
    return aborted.size();
  }

  public int pendingCount() {
    return pending.size();
  }
}
