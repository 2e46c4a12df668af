package io.github.panghy.pluginproxy.transit;

/**
 * The kinds of OS handle that can be handed across a channel.
 *
 * <p>The ordinal is written to the wire, so constants may only be appended.</p>
 */
public enum HandleKind {
  FILE,
  SOCKET,
  SHARED_MEMORY
}
