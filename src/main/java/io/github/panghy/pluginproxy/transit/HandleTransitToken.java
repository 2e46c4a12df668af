package io.github.panghy.pluginproxy.transit;

/**
 * The wire representation of an OS handle in flight between the two processes.
 *
 * <p>A token does not own anything. The handle it names sits in the channel's
 * {@link HandleExchange} until the receiver claims it with {@link HandleTransit#receive}
 * or the sender withdraws it with {@link HandleTransit#revoke}. Tokens are values and
 * may be copied freely; only the first claim succeeds.</p>
 *
 * @param transitId The exchange slot holding the duplicated handle
 * @param kind      What sort of handle travels under this token
 * @param valid     false when sharing failed and no handle was parked
 */
public record HandleTransitToken(long transitId, HandleKind kind, boolean valid) {

  /**
   * Creates an invalid token of the given kind, used to report a failed share on the
   * wire.
   *
   * @param kind The handle kind that could not be shared
   * @return An invalid token
   */
  public static HandleTransitToken invalid(HandleKind kind) {
    return new HandleTransitToken(0, kind, false);
  }
}
