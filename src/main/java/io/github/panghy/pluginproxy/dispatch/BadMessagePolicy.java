package io.github.panghy.pluginproxy.dispatch;

/**
 * What a dispatcher does when the peer sends a message that violates the protocol.
 */
public enum BadMessagePolicy {
  /**
   * Log the violation and close the channel. Everything pending on the channel is
   * aborted as if the peer had crashed.
   */
  TERMINATE_CHANNEL,
  /**
   * Log the violation and drop the message. Synchronous calls still get a failure reply.
   */
  LOG_AND_IGNORE
}
