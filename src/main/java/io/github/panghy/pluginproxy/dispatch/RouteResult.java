package io.github.panghy.pluginproxy.dispatch;

/**
 * Outcome of routing one inbound message.
 */
public enum RouteResult {
  /**
   * A proxy recognised the message and processed it.
   */
  HANDLED,
  /**
   * The API group is known but its proxy does not recognise the message kind.
   */
  UNHANDLED,
  /**
   * The message violates the protocol: unknown API group or undecodable parameters.
   */
  INVALID
}
