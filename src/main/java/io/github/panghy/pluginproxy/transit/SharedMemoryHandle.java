package io.github.panghy.pluginproxy.transit;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * A shared memory region. Every duplicate maps the same bytes, so writes through one
 * descriptor are visible through all others.
 */
public final class SharedMemoryHandle extends AbstractTransitHandle<ByteBuffer> {

  private SharedMemoryHandle(Underlying<ByteBuffer> underlying) {
    super(underlying);
  }

  /**
   * Allocates a new zero-filled region.
   *
   * @param size The region size in bytes
   * @return The handle
   */
  public static SharedMemoryHandle allocate(int size) {
    if (size <= 0) {
      throw new IllegalArgumentException("Shared memory size must be positive, got: " + size);
    }
    return new SharedMemoryHandle(new Underlying<>(ByteBuffer.allocateDirect(size)));
  }

  @Override
  public HandleKind kind() {
    return HandleKind.SHARED_MEMORY;
  }

  /**
   * Gets the region size.
   *
   * @return The size in bytes
   */
  public int size() {
    return underlying.object.capacity();
  }

  /**
   * Maps the region. Each call returns an independent view with its own position.
   *
   * @return A view of the whole region
   * @throws IOException if this descriptor was closed
   */
  public ByteBuffer map() throws IOException {
    ensureOpen();
    ByteBuffer view = underlying.object.duplicate();
    view.clear();
    return view;
  }

  @Override
  TransitHandle newDescriptor(Underlying<ByteBuffer> underlying) {
    return new SharedMemoryHandle(underlying);
  }

  @Override
  void releaseUnderlying(ByteBuffer object) {
    // direct buffers are reclaimed by the collector once unreachable
  }

  @Override
  public String toString() {
    return "SharedMemoryHandle[" + size() + " bytes" + (isOpen() ? "" : ", closed") + "]";
  }
}
