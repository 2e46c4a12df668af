package io.github.panghy.pluginproxy.error;

/**
 * Thrown when an inbound message cannot be decoded: a truncated payload, an unknown
 * message type byte, or a field whose value is outside what the protocol allows.
 */
public class ProtocolViolationException extends ProxyException {

  public ProtocolViolationException(String message) {
    super(ErrorCode.PROTOCOL_VIOLATION, message);
  }

  public ProtocolViolationException(String message, Throwable cause) {
    super(ErrorCode.PROTOCOL_VIOLATION, message, cause);
  }
}
