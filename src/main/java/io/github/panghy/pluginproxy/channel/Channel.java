package io.github.panghy.pluginproxy.channel;

import io.github.panghy.pluginproxy.message.WireMessage;
import io.github.panghy.pluginproxy.transit.HandleExchange;

import java.util.function.BooleanSupplier;

/**
 * One end of a connected, ordered, message-oriented channel between exactly two peers.
 *
 * <p>Establishing the connection is the embedder's job; the proxy layer is handed a
 * channel that is already connected. Messages are delivered to the peer's
 * {@link ChannelListener} in send order. A channel is single-threaded: sends, pumping
 * and listener callbacks all happen on the channel's own thread.</p>
 */
public interface Channel {

  /**
   * Gets a name for diagnostics.
   *
   * @return The channel name
   */
  String getName();

  /**
   * Sets the listener that receives inbound traffic for this end.
   *
   * @param listener The listener
   */
  void setListener(ChannelListener listener);

  /**
   * Hands a message to the channel.
   *
   * @param message The message
   * @return true if the channel accepted it, false if the channel is closed or
   *     rejected the message; never throws for a send failure
   */
  boolean send(WireMessage message);

  /**
   * Runs a nested message loop, delivering inbound messages to the listener until the
   * condition holds, nothing more can arrive, or the channel fails. Listener callbacks
   * run re-entrantly inside this call.
   *
   * @param condition Checked before each delivery
   * @return the final value of the condition
   */
  boolean pumpUntil(BooleanSupplier condition);

  /**
   * Checks whether the channel is still connected.
   *
   * @return true if open
   */
  boolean isOpen();

  /**
   * Closes the channel. Both ends are told through {@link ChannelListener#onChannelError()}.
   */
  void close();

  /**
   * Gets the exchange that holds OS handles travelling on this channel.
   *
   * @return The handle exchange
   */
  HandleExchange getHandleExchange();
}
