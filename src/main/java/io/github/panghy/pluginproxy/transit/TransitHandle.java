package io.github.panghy.pluginproxy.transit;

import java.io.Closeable;
import java.io.IOException;

/**
 * An OS-level handle that can be handed to the peer process.
 *
 * <p>Each TransitHandle instance is one descriptor: closing it releases this descriptor
 * only. {@link #duplicate()} produces another descriptor onto the same underlying
 * object, the way {@code dup(2)} does, and the underlying object is released once every
 * descriptor onto it has been closed.</p>
 */
public interface TransitHandle extends Closeable {

  /**
   * Gets the kind of handle.
   *
   * @return The handle kind
   */
  HandleKind kind();

  /**
   * Checks whether this descriptor is still open.
   *
   * @return true if open
   */
  boolean isOpen();

  /**
   * Creates another descriptor onto the same underlying object.
   *
   * @return The new descriptor, owned by the caller
   * @throws IOException if this descriptor is already closed
   */
  TransitHandle duplicate() throws IOException;

  /**
   * Closes this descriptor. Closing an already closed descriptor does nothing.
   *
   * @throws IOException if releasing the underlying object failed
   */
  @Override
  void close() throws IOException;
}
