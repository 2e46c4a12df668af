package io.github.panghy.pluginproxy.channel;

import io.github.panghy.pluginproxy.error.ProtocolViolationException;
import io.github.panghy.pluginproxy.message.WireMessage;

/**
 * Receives what arrives on a {@link Channel}. All callbacks run on the channel thread,
 * one at a time, in the order the peer sent the messages.
 */
public interface ChannelListener {

  /**
   * Called for every decoded inbound message.
   *
   * @param message The message
   */
  void onMessageReceived(WireMessage message);

  /**
   * Called when inbound bytes could not be decoded into a message at all.
   *
   * @param error What was wrong with them
   */
  void onMalformedMessage(ProtocolViolationException error);

  /**
   * Called once when the channel fails or the peer goes away. No further messages are
   * delivered afterwards and sends fail.
   */
  void onChannelError();
}
