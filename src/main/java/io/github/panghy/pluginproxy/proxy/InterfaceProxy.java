package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.callback.CallbackKey;
import io.github.panghy.pluginproxy.callback.CallbackTracker;
import io.github.panghy.pluginproxy.callback.ResultCode;
import io.github.panghy.pluginproxy.core.ResultFuture;
import io.github.panghy.pluginproxy.dispatch.Dispatcher;
import io.github.panghy.pluginproxy.dispatch.PluginDispatcher;
import io.github.panghy.pluginproxy.error.ProtocolViolationException;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.message.ParamReader;
import io.github.panghy.pluginproxy.message.ParamWriter;
import io.github.panghy.pluginproxy.message.WireMessage;
import io.github.panghy.pluginproxy.resource.PluginResource;
import io.github.panghy.pluginproxy.resource.ResourceTracker;
import io.github.panghy.pluginproxy.resource.WireResourceId;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.debug;
import static io.github.panghy.pluginproxy.util.LoggingUtil.warn;

/**
 * Base class of the per-capability proxies.
 *
 * <p>One proxy class serves one {@link ApiGroup} on both sides of the channel; an
 * instance of it lives in each process, owned by that process's {@link Dispatcher}. On
 * the calling side a proxy turns local calls into messages. On the receiving side it
 * decodes the messages, calls the local backend and, for asynchronous operations, sends
 * the result back when the backend completes.</p>
 *
 * <p>Proxies keep no per-resource state of their own. What needs to be remembered about
 * a resource lives in the resource object in the tracker, or in the backend.</p>
 */
public abstract class InterfaceProxy {

  private static final Logger LOGGER = Logger.getLogger(InterfaceProxy.class.getName());

  protected final Dispatcher dispatcher;

  protected InterfaceProxy(Dispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  /**
   * Gets the API group this proxy serves.
   *
   * @return The group
   */
  public abstract ApiGroup getApiGroup();

  /**
   * Handles a message routed to this proxy.
   *
   * @param message The message
   * @param reply   Where to write the reply of a synchronous call; null for a one-way
   *                message
   * @return true if the message kind was recognised
   * @throws io.github.panghy.pluginproxy.error.ProtocolViolationException if the
   *     parameters do not decode
   */
  public abstract boolean onMessageReceived(WireMessage message, ParamWriter reply);

  public Dispatcher getDispatcher() {
    return dispatcher;
  }

  /**
   * Sends a one-way message of this proxy's group.
   *
   * @param kind   The message kind
   * @param params The parameters
   * @return true if sent
   */
  protected boolean send(int kind, ParamWriter params) {
    return dispatcher.send(WireMessage.routed(getApiGroup(), kind, params));
  }

  protected Optional<ParamReader> sendSync(int kind, ParamWriter params) {
    return dispatcher.sendSync(getApiGroup(), kind, params);
  }

  /**
   * Sends a synchronous call and decodes its reply. A failed call and a reply that does
   * not decode both yield {@code onFailure}.
   *
   * @param kind      The message kind
   * @param params    The parameters
   * @param decoder   Reads the result out of the reply
   * @param onFailure The value to return when no usable reply arrives
   * @param <T>       The result type
   * @return The decoded result, or {@code onFailure}
   */
  protected <T> T callSync(int kind, ParamWriter params, Function<ParamReader, T> decoder, T onFailure) {
    Optional<ParamReader> reply = sendSync(kind, params);
    if (reply.isEmpty()) {
      return onFailure;
    }
    try {
      return decoder.apply(reply.get());
    } catch (ProtocolViolationException e) {
      warn(LOGGER, getApiGroup() + ": undecodable reply to message kind " + kind, e);
      return onFailure;
    }
  }

  /**
   * Issues an asynchronous operation: registers the pending callback, then sends the
   * call. If the send fails the callback fires at once with {@link ResultCode#FAILED}
   * and nothing is left pending.
   *
   * @param key     The key the reply will carry
   * @param kind    The message kind of the call
   * @param params  The call parameters
   * @param settler Local work to run with the result before the caller sees it; may be
   *                null
   * @return The caller's future
   */
  protected ResultFuture<Integer> sendAsync(CallbackKey key, int kind, ParamWriter params,
                                            IntUnaryOperator settler) {
    CallbackTracker callbacks = dispatcher.getCallbackTracker();
    ResultFuture<Integer> future = callbacks.register(key, settler);
    if (!send(kind, params)) {
      debug(LOGGER, getApiGroup() + ": send failed for " + key);
      callbacks.complete(key, ResultCode.FAILED.getCode());
    }
    return future;
  }

  /**
   * Runs a backend operation that completes either immediately or through a callback,
   * and hands its final result to {@code onResult} exactly once.
   *
   * @param operation Starts the operation, returning a result code or
   *                  OK_COMPLETIONPENDING
   * @param onResult  Receives the final result
   */
  protected static void runBackend(BackendCall operation, IntConsumer onResult) {
    int result = operation.start(onResult);
    if (result != ResultCode.OK_COMPLETIONPENDING.getCode()) {
      onResult.accept(result);
    }
  }

  /**
   * A backend operation with the completion-pending convention.
   */
  @FunctionalInterface
  protected interface BackendCall {
    int start(IntConsumer callback);
  }

  /**
   * Gets the tracker of peer-owned resources. Only the plugin side has one.
   *
   * @return The tracker
   * @throws IllegalStateException on the host side
   */
  protected ResourceTracker tracker() {
    if (!(dispatcher instanceof PluginDispatcher)) {
      throw new IllegalStateException(getApiGroup() + ": no resource tracker on the host side");
    }
    return ((PluginDispatcher) dispatcher).getResourceTracker();
  }

  /**
   * Starts tracking a resource the host just handed over together with one reference.
   * The plugin holds a single host reference per tracked resource, so when the identity
   * is already tracked the local handle gains a reference and the surplus host reference
   * is returned at once.
   *
   * @param id      The identity from the host, degenerate if the host failed
   * @param factory Creates the local object for an identity not tracked yet
   * @return The local handle the caller now owns a reference to, 0 for a degenerate
   *     identity
   */
  protected int adoptResource(WireResourceId id, Function<WireResourceId, PluginResource> factory) {
    if (id == null || id.isNull()) {
      return 0;
    }
    ResourceTracker tracker = tracker();
    boolean known = tracker.lookupByIdentity(id) != 0;
    int handle = tracker.addOrReuse(id, factory);
    if (known) {
      dispatcher.getProxy(ApiGroup.CORE, CoreProxy.class).releaseResource(id);
    }
    return handle;
  }

  /**
   * Checks that the plugin side serves an instance, so resources can be created for it.
   *
   * @param instance The instance id
   * @return true if served
   */
  protected boolean servesInstance(int instance) {
    return dispatcher instanceof PluginDispatcher && ((PluginDispatcher) dispatcher).servesInstance(instance);
  }

  /**
   * Gets the local backend of a capability.
   *
   * @param type The backend interface
   * @param <T>  The interface type
   * @return The backend, or null if the embedder registered none
   */
  protected <T> T backend(Class<T> type) {
    return dispatcher.getLocalInterface(type);
  }
}
