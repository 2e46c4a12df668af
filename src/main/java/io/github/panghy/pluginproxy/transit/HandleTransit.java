package io.github.panghy.pluginproxy.transit;

import io.github.panghy.pluginproxy.channel.Channel;
import io.github.panghy.pluginproxy.error.HandleTransitException;

import java.io.IOException;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.debug;
import static io.github.panghy.pluginproxy.util.LoggingUtil.warn;

/**
 * Moves OS handles across a channel with explicit ownership transfer.
 *
 * <p>The protocol for a handle travelling with a message:</p>
 * <ol>
 *   <li>The sender calls {@link #share} which duplicates the handle into the channel's
 *   exchange and returns a token to write into the message. The sender keeps its own
 *   descriptor.</li>
 *   <li>If the message then fails to send, the sender must call {@link #revoke} to close
 *   the duplicate itself; nothing else will.</li>
 *   <li>The receiver calls {@link #receive} while decoding and owns the result from then
 *   on. If the surrounding call fails on the receiving side (unknown resource, error
 *   result, handler failure) the receiver still owns the handle and must close it.</li>
 * </ol>
 */
public final class HandleTransit {

  private static final Logger LOGGER = Logger.getLogger(HandleTransit.class.getName());

  private HandleTransit() {
  }

  /**
   * Duplicates a handle for the process on the other end of the channel.
   *
   * @param handle The local handle, which stays owned by the caller
   * @param target The channel the token will travel on
   * @return A token for the duplicate, or an invalid token if sharing failed
   */
  public static HandleTransitToken share(TransitHandle handle, Channel target) {
    if (handle == null) {
      return HandleTransitToken.invalid(HandleKind.FILE);
    }
    if (!target.isOpen() || !handle.isOpen()) {
      debug(LOGGER, "Cannot share " + handle + " on " + target.getName());
      return HandleTransitToken.invalid(handle.kind());
    }
    TransitHandle duplicate;
    try {
      duplicate = handle.duplicate();
    } catch (IOException e) {
      warn(LOGGER, "Failed to duplicate " + handle + " for transit", e);
      return HandleTransitToken.invalid(handle.kind());
    }
    long transitId = target.getHandleExchange().park(duplicate);
    return new HandleTransitToken(transitId, handle.kind(), true);
  }

  /**
   * Claims the handle a token refers to. The caller owns the returned handle and must
   * close it, including when it ends up not being used.
   *
   * @param token  The token decoded from a message
   * @param source The channel the message arrived on
   * @return The handle, or null for an invalid token or a token that was already
   *     claimed
   */
  public static TransitHandle receive(HandleTransitToken token, Channel source) {
    if (token == null || !token.valid()) {
      return null;
    }
    TransitHandle handle = source.getHandleExchange().claim(token.transitId());
    if (handle == null) {
      warn(LOGGER, "No parked handle for transit id " + token.transitId());
      return null;
    }
    if (handle.kind() != token.kind()) {
      warn(LOGGER, "Transit id " + token.transitId() + " carries " + handle.kind()
          + " but the token says " + token.kind());
      closeQuietly(handle);
      return null;
    }
    return handle;
  }

  /**
   * Claims the handle a token refers to, failing if there is none of the expected kind.
   *
   * @param token  The token decoded from a message
   * @param source The channel the message arrived on
   * @param type   The expected handle class
   * @param <T>    The handle type
   * @return The handle, owned by the caller
   * @throws HandleTransitException if the token is invalid, was already claimed, or
   *     names a handle of another kind
   */
  public static <T extends TransitHandle> T claim(HandleTransitToken token, Channel source, Class<T> type) {
    TransitHandle handle = receive(token, source);
    if (handle == null) {
      throw new HandleTransitException("No handle for " + token);
    }
    if (!type.isInstance(handle)) {
      closeQuietly(handle);
      throw new HandleTransitException("Expected " + type.getSimpleName() + " for " + token + " but got " + handle);
    }
    return type.cast(handle);
  }

  /**
   * Withdraws a duplicate that was shared but will never be delivered, closing it.
   *
   * @param token  The token returned by {@link #share}
   * @param target The channel it was shared on
   */
  public static void revoke(HandleTransitToken token, Channel target) {
    if (token != null && token.valid()) {
      target.getHandleExchange().revoke(token.transitId());
    }
  }

  /**
   * Closes a handle on a failure path, logging rather than propagating a close error
   * because the caller is already reporting a failure of its own.
   *
   * @param handle The handle, may be null
   */
  public static void closeQuietly(TransitHandle handle) {
    if (handle == null) {
      return;
    }
    try {
      handle.close();
    } catch (IOException e) {
      warn(LOGGER, "Failed to close " + handle, e);
    }
  }
}
