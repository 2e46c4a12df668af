package io.github.panghy.pluginproxy.error;

/**
 * Thrown when an OS handle cannot be duplicated for transfer or when a transit
 * token does not name a handle waiting in the exchange.
 */
public class HandleTransitException extends ProxyException {

  public HandleTransitException(String message) {
    super(ErrorCode.HANDLE_TRANSIT, message);
  }

  public HandleTransitException(String message, Throwable cause) {
    super(ErrorCode.HANDLE_TRANSIT, message, cause);
  }
}
