package io.github.panghy.pluginproxy.dispatch;

import io.github.panghy.pluginproxy.callback.CallbackTracker;
import io.github.panghy.pluginproxy.channel.Channel;
import io.github.panghy.pluginproxy.channel.ChannelListener;
import io.github.panghy.pluginproxy.error.ProtocolViolationException;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.message.MessageHeader;
import io.github.panghy.pluginproxy.message.ParamReader;
import io.github.panghy.pluginproxy.message.ParamWriter;
import io.github.panghy.pluginproxy.message.WireMessage;
import io.github.panghy.pluginproxy.proxy.InterfaceProxy;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.debug;
import static io.github.panghy.pluginproxy.util.LoggingUtil.error;
import static io.github.panghy.pluginproxy.util.LoggingUtil.warn;

/**
 * Owns one end of a channel and routes everything that arrives on it.
 *
 * <p>Every inbound message names an {@link ApiGroup} and a message kind. The dispatcher
 * looks up the {@link InterfaceProxy} for the group, constructing it from its factory
 * table on first use, and lets the proxy decode and handle the message. Proxies live
 * as long as the dispatcher. Constructing a proxy can have side effects (some register
 * callbacks with their local backend), so the set of proxies that exist depends on the
 * traffic seen so far.</p>
 *
 * <p>The dispatcher also implements the two outbound primitives proxies build on:</p>
 * <ul>
 *   <li>{@link #send(WireMessage)} for one-way messages, which reports failure instead of
 *   throwing</li>
 *   <li>{@link #sendSync} for synchronous calls, which block the calling thread in a
 *   nested message loop until the peer replies, handling whatever the peer sends in the
 *   meantime (including synchronous calls back into this process)</li>
 * </ul>
 *
 * <p>When the channel fails every operation still waiting on this dispatcher is aborted,
 * and subclasses drop the resources that belonged to the peer.</p>
 *
 * <p>A dispatcher is confined to its channel thread.</p>
 */
public abstract class Dispatcher implements ChannelListener {

  private static final Logger LOGGER = Logger.getLogger(Dispatcher.class.getName());

  private final Channel channel;
  private final DispatcherConfiguration configuration;
  private final Map<ApiGroup, Function<Dispatcher, InterfaceProxy>> factories;
  private final Map<ApiGroup, InterfaceProxy> proxies = new EnumMap<>(ApiGroup.class);
  private final Map<Class<?>, Object> localInterfaces = new HashMap<>();
  private final CallbackTracker callbackTracker = new CallbackTracker();

  // Sync calls this dispatcher is blocked on, and replies that arrived for them
  private final Set<UUID> awaitingReplies = new HashSet<>();
  private final Map<UUID, WireMessage> syncReplies = new HashMap<>();
  private int syncDepth;

  private boolean alive = true;

  /**
   * Creates a dispatcher and makes it the listener of the channel.
   *
   * @param channel       The connected channel
   * @param configuration The configuration
   * @param factories     How to construct the proxy of each API group; groups without a
   *                      factory are valid but have no handler on this side
   */
  protected Dispatcher(Channel channel, DispatcherConfiguration configuration,
                       Map<ApiGroup, Function<Dispatcher, InterfaceProxy>> factories) {
    this.channel = channel;
    this.configuration = configuration;
    this.factories = new EnumMap<>(ApiGroup.class);
    this.factories.putAll(factories);
    channel.setListener(this);
  }

  /**
   * Checks which side of the channel this dispatcher serves.
   *
   * @return true for the process owning the resources
   */
  public abstract boolean isHost();

  /**
   * Called once when the channel fails, before pending operations are aborted.
   */
  protected abstract void channelFailed();

  public Channel getChannel() {
    return channel;
  }

  public DispatcherConfiguration getConfiguration() {
    return configuration;
  }

  /**
   * Gets the tracker of asynchronous operations issued through this dispatcher.
   *
   * @return The callback tracker
   */
  public CallbackTracker getCallbackTracker() {
    return callbackTracker;
  }

  /**
   * Checks whether the channel is still usable.
   *
   * @return false once the channel has failed
   */
  public boolean isAlive() {
    return alive;
  }

  /**
   * Registers the local implementation of a capability, used by proxies handling calls
   * from the peer.
   *
   * @param type           The capability interface
   * @param implementation The implementation
   * @param <T>            The interface type
   */
  public <T> void addLocalInterface(Class<T> type, T implementation) {
    localInterfaces.put(type, implementation);
  }

  /**
   * Gets the local implementation of a capability.
   *
   * @param type The capability interface
   * @param <T>  The interface type
   * @return The implementation, or null if none is registered
   */
  public <T> T getLocalInterface(Class<T> type) {
    return type.cast(localInterfaces.get(type));
  }

  /**
   * Gets the proxy for an API group, constructing it on first use.
   *
   * @param group The API group
   * @return The proxy, or null if this side has no factory for the group
   */
  public InterfaceProxy getProxy(ApiGroup group) {
    InterfaceProxy proxy = proxies.get(group);
    if (proxy == null) {
      Function<Dispatcher, InterfaceProxy> factory = factories.get(group);
      if (factory == null) {
        return null;
      }
      proxy = factory.apply(this);
      proxies.put(group, proxy);
      debug(LOGGER, channel.getName() + ": constructed proxy for " + group);
    }
    return proxy;
  }

  /**
   * Gets the proxy for an API group as its concrete type.
   *
   * @param group The API group
   * @param type  The proxy class
   * @param <T>   The proxy type
   * @return The proxy
   * @throws IllegalStateException if the group has no proxy of that type on this side
   */
  public <T extends InterfaceProxy> T getProxy(ApiGroup group, Class<T> type) {
    InterfaceProxy proxy = getProxy(group);
    if (!type.isInstance(proxy)) {
      throw new IllegalStateException("No " + type.getSimpleName() + " registered for " + group);
    }
    return type.cast(proxy);
  }

  /**
   * Checks whether the proxy for a group has been constructed yet.
   *
   * @param group The API group
   * @return true if constructed
   */
  public boolean hasProxy(ApiGroup group) {
    return proxies.containsKey(group);
  }

  /**
   * Sends a one-way message.
   *
   * @param message The message
   * @return true if the channel accepted it; false if the channel failed or rejected it
   */
  public boolean send(WireMessage message) {
    if (!alive) {
      debug(LOGGER, channel.getName() + ": not sending on dead dispatcher: " + message);
      return false;
    }
    return channel.send(message);
  }

  /**
   * Makes a synchronous call and waits for the reply, processing other inbound traffic
   * (including reentrant calls from the peer) while waiting.
   *
   * @param group  The target API group
   * @param kind   The message kind
   * @param params The call parameters
   * @return A reader over the reply, or empty if the call could not be sent, the peer
   *     reported a failure, or the channel failed while waiting
   */
  public Optional<ParamReader> sendSync(ApiGroup group, int kind, ParamWriter params) {
    if (!alive) {
      return Optional.empty();
    }
    if (syncDepth >= configuration.getMaxNestedSyncDepth()) {
      warn(LOGGER, channel.getName() + ": sync call to " + group + "/" + kind
          + " exceeds nesting depth " + syncDepth);
      return Optional.empty();
    }
    WireMessage call = WireMessage.syncCall(group, kind, params);
    UUID messageId = call.getHeader().getMessageId();
    awaitingReplies.add(messageId);
    try {
      if (!channel.send(call)) {
        return Optional.empty();
      }
      syncDepth++;
      try {
        channel.pumpUntil(() -> syncReplies.containsKey(messageId) || !alive);
      } finally {
        syncDepth--;
      }
    } finally {
      awaitingReplies.remove(messageId);
    }
    WireMessage reply = syncReplies.remove(messageId);
    if (reply == null) {
      debug(LOGGER, channel.getName() + ": no reply for sync call " + group + "/" + kind);
      return Optional.empty();
    }
    if (reply.getHeader().getType() == MessageHeader.MessageType.SYNC_REPLY_FAILED) {
      debug(LOGGER, channel.getName() + ": peer failed sync call " + group + "/" + kind);
      return Optional.empty();
    }
    return Optional.of(reply.reader());
  }

  @Override
  public void onMessageReceived(WireMessage message) {
    MessageHeader header = message.getHeader();
    switch (header.getType()) {
      case SYNC_REPLY:
      case SYNC_REPLY_FAILED:
        if (awaitingReplies.contains(header.getMessageId())) {
          syncReplies.put(header.getMessageId(), message);
        } else {
          debug(LOGGER, channel.getName() + ": dropping reply nobody waits for: " + header);
        }
        break;
      case ROUTED:
      case SYNC_CALL:
        route(message);
        break;
      default:
        warn(LOGGER, channel.getName() + ": unknown message type " + header.getType());
    }
  }

  /**
   * Hands an inbound call to the proxy of its API group. A synchronous call always gets
   * exactly one reply, a failure reply when it could not be handled.
   *
   * @param message The message
   * @return How the message was handled
   */
  public RouteResult route(WireMessage message) {
    MessageHeader header = message.getHeader();
    boolean sync = header.getType() == MessageHeader.MessageType.SYNC_CALL;
    ApiGroup group = ApiGroup.forId(header.getApiGroupId());
    if (group == null) {
      if (sync) {
        channel.send(WireMessage.syncReplyFailed(message));
      }
      badMessage("unknown API group " + header.getApiGroupId() + " in " + header);
      return RouteResult.INVALID;
    }
    InterfaceProxy proxy = getProxy(group);
    if (proxy == null) {
      warn(LOGGER, channel.getName() + ": no proxy for " + group + " on this side, dropping " + header);
      if (sync) {
        channel.send(WireMessage.syncReplyFailed(message));
      }
      return RouteResult.UNHANDLED;
    }
    ParamWriter reply = sync ? new ParamWriter() : null;
    boolean handled;
    try {
      handled = proxy.onMessageReceived(message, reply);
    } catch (ProtocolViolationException e) {
      if (sync) {
        channel.send(WireMessage.syncReplyFailed(message));
      }
      badMessage("undecodable " + header + ": " + e.getMessage());
      return RouteResult.INVALID;
    } catch (RuntimeException e) {
      error(LOGGER, channel.getName() + ": handler for " + header + " failed", e);
      if (sync) {
        channel.send(WireMessage.syncReplyFailed(message));
      }
      return RouteResult.HANDLED;
    }
    if (sync) {
      channel.send(handled ? WireMessage.syncReply(message, reply) : WireMessage.syncReplyFailed(message));
    }
    if (!handled) {
      warn(LOGGER, channel.getName() + ": " + group + " does not handle message kind "
          + header.getMessageKind());
      return RouteResult.UNHANDLED;
    }
    return RouteResult.HANDLED;
  }

  @Override
  public void onMalformedMessage(ProtocolViolationException error) {
    badMessage("malformed frame: " + error.getMessage());
  }

  private void badMessage(String description) {
    error(LOGGER, channel.getName() + ": protocol violation, " + description);
    if (configuration.getBadMessagePolicy() == BadMessagePolicy.TERMINATE_CHANNEL) {
      channel.close();
    }
  }

  @Override
  public void onChannelError() {
    if (!alive) {
      return;
    }
    alive = false;
    warn(LOGGER, channel.getName() + ": channel failed, aborting "
        + callbackTracker.pendingCount() + " pending operation(s)");
    channelFailed();
    callbackTracker.abortAll();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + channel.getName() + (alive ? "" : ", dead") + "]";
  }
}
