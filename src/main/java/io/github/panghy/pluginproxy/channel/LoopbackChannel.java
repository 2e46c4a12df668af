package io.github.panghy.pluginproxy.channel;

import io.github.panghy.pluginproxy.error.ProtocolViolationException;
import io.github.panghy.pluginproxy.message.WireMessage;
import io.github.panghy.pluginproxy.transit.HandleExchange;

import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.debug;
import static io.github.panghy.pluginproxy.util.LoggingUtil.warn;

/**
 * An in-process implementation of {@link Channel}, used to host a plugin in the same
 * JVM and to test both sides of the protocol deterministically.
 *
 * <p>LoopbackChannel instances always come in pairs created by {@link #createPair},
 * with each instance representing one end. Every message is serialized on send and
 * decoded on delivery, so nothing but bytes and transit tokens crosses between the two
 * ends, exactly as with a real process boundary. Both ends share one FIFO queue, which
 * preserves the global send order, and one {@link HandleExchange}.</p>
 *
 * <p>Nothing is delivered until somebody pumps: either a dispatcher blocked in a
 * synchronous call (which pumps until its reply arrives) or the embedder calling
 * {@link #pumpAll()}. Failure injection is available for tests:
 * {@link #setRejectSends(boolean)} makes sends fail as if the peer were gone, and
 * {@link #close()} simulates a peer crash.</p>
 */
public final class LoopbackChannel implements Channel {

  private static final Logger LOGGER = Logger.getLogger(LoopbackChannel.class.getName());

  /**
   * The two ends of a loopback connection.
   *
   * @param host   The end used by the host dispatcher
   * @param plugin The end used by the plugin dispatcher
   */
  public record Pair(LoopbackChannel host, LoopbackChannel plugin) {
  }

  private record Delivery(LoopbackChannel destination, ByteBuffer bytes) {
  }

  /**
   * State shared by both ends.
   */
  private static final class Link {
    final Deque<Delivery> queue = new ArrayDeque<>();
    final HandleExchange handleExchange = new HandleExchange();
    boolean open = true;
  }

  private final String name;
  private final Link link;
  private LoopbackChannel peer;
  private ChannelListener listener;
  private boolean rejectSends;

  private LoopbackChannel(String name, Link link) {
    this.name = name;
    this.link = link;
  }

  /**
   * Creates a connected pair.
   *
   * @param name A base name used for diagnostics
   * @return Both ends
   */
  public static Pair createPair(String name) {
    Link link = new Link();
    LoopbackChannel host = new LoopbackChannel(name + "/host", link);
    LoopbackChannel plugin = new LoopbackChannel(name + "/plugin", link);
    host.peer = plugin;
    plugin.peer = host;
    return new Pair(host, plugin);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public void setListener(ChannelListener listener) {
    this.listener = listener;
  }

  @Override
  public boolean send(WireMessage message) {
    if (!link.open) {
      debug(LOGGER, name + ": dropping send on closed channel: " + message);
      return false;
    }
    if (rejectSends) {
      debug(LOGGER, name + ": rejecting send: " + message);
      return false;
    }
    link.queue.addLast(new Delivery(peer, message.serialize()));
    return true;
  }

  /**
   * Queues raw bytes for the peer, bypassing message encoding. Tests use this to feed
   * the peer frames that do not decode.
   *
   * @param bytes The bytes to deliver
   * @return true if queued
   */
  public boolean sendRaw(ByteBuffer bytes) {
    if (!link.open) {
      return false;
    }
    link.queue.addLast(new Delivery(peer, bytes.duplicate()));
    return true;
  }

  @Override
  public boolean pumpUntil(BooleanSupplier condition) {
    while (!condition.getAsBoolean()) {
      if (!link.open) {
        return condition.getAsBoolean();
      }
      Delivery delivery = link.queue.pollFirst();
      if (delivery == null) {
        return condition.getAsBoolean();
      }
      delivery.destination.deliver(delivery.bytes);
    }
    return true;
  }

  /**
   * Delivers everything queued, including messages sent while delivering.
   */
  public void pumpAll() {
    pumpUntil(() -> false);
  }

  /**
   * Gets the number of messages waiting for delivery to either end.
   *
   * @return The queue length
   */
  public int pendingMessageCount() {
    return link.queue.size();
  }

  private void deliver(ByteBuffer bytes) {
    if (listener == null) {
      warn(LOGGER, name + ": no listener, dropping inbound message");
      return;
    }
    WireMessage message;
    try {
      message = WireMessage.deserialize(bytes);
    } catch (ProtocolViolationException e) {
      listener.onMalformedMessage(e);
      return;
    }
    listener.onMessageReceived(message);
  }

  @Override
  public boolean isOpen() {
    return link.open;
  }

  /**
   * Makes every later send on this end fail, as if the peer had stopped accepting
   * messages, without closing the channel.
   *
   * @param rejectSends true to fail sends
   */
  public void setRejectSends(boolean rejectSends) {
    this.rejectSends = rejectSends;
  }

  @Override
  public void close() {
    if (!link.open) {
      return;
    }
    link.open = false;
    int dropped = link.queue.size();
    link.queue.clear();
    link.handleExchange.closeAll();
    debug(LOGGER, name + ": closed, dropped " + dropped + " undelivered message(s)");
    notifyError(this);
    notifyError(peer);
  }

  private static void notifyError(LoopbackChannel end) {
    if (end.listener != null) {
      end.listener.onChannelError();
    }
  }

  @Override
  public HandleExchange getHandleExchange() {
    return link.handleExchange;
  }

  @Override
  public String toString() {
    return "LoopbackChannel[" + name + (link.open ? "" : ", closed") + "]";
  }
}
