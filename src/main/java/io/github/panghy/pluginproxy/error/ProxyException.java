package io.github.panghy.pluginproxy.error;

/**
 * Base exception for failures inside the proxy layer.
 *
 * <p>These exceptions are internal: they are raised by the codec, the channel and
 * the dispatcher and are caught at the capability proxy boundary, where they are
 * turned into {@link io.github.panghy.pluginproxy.callback.ResultCode result codes}.
 * Callers of the public capability APIs never see them.</p>
 */
public class ProxyException extends RuntimeException {

  /**
   * Categories of proxy failures.
   */
  public enum ErrorCode {
    /**
     * Unknown or unspecified error.
     */
    UNKNOWN(2000),

    /**
     * A message could not be decoded or names something outside the protocol.
     */
    PROTOCOL_VIOLATION(2001),

    /**
     * The channel to the peer is closed or was never connected.
     */
    CHANNEL_CLOSED(2002),

    /**
     * A handle could not be shared, received or closed.
     */
    HANDLE_TRANSIT(2003),

    /**
     * No backend implementation is registered for a capability.
     */
    NO_INTERFACE(2004);

    private final int code;

    ErrorCode(int code) {
      this.code = code;
    }

    public int getCode() {
      return code;
    }

    /**
     * Gets an ErrorCode from its numeric value.
     *
     * @param code The numeric error code
     * @return The matching ErrorCode, or UNKNOWN
     */
    public static ErrorCode fromCode(int code) {
      for (ErrorCode errorCode : values()) {
        if (errorCode.code == code) {
          return errorCode;
        }
      }
      return UNKNOWN;
    }
  }

  private final ErrorCode errorCode;

  public ProxyException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public ProxyException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  /**
   * Gets the error code for this exception.
   *
   * @return The error code
   */
  public ErrorCode getErrorCode() {
    return errorCode;
  }

  @Override
  public String toString() {
    return "ProxyException{" +
        "errorCode=" + errorCode +
        ", message='" + getMessage() + '\'' +
        '}';
  }
}
