package io.github.panghy.pluginproxy.transit;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Descriptor bookkeeping shared by the concrete handle types: a per-descriptor closed
 * flag plus a count of open descriptors onto the underlying object.
 *
 * @param <T> The underlying object type
 */
abstract class AbstractTransitHandle<T> implements TransitHandle {

  /**
   * The object all duplicates of a handle point at.
   */
  static final class Underlying<T> {
    final T object;
    final AtomicInteger openDescriptors = new AtomicInteger(1);

    Underlying(T object) {
      this.object = object;
    }
  }

  private final AtomicBoolean closed = new AtomicBoolean(false);
  final Underlying<T> underlying;

  AbstractTransitHandle(Underlying<T> underlying) {
    this.underlying = underlying;
  }

  @Override
  public boolean isOpen() {
    return !closed.get();
  }

  @Override
  public TransitHandle duplicate() throws IOException {
    if (closed.get()) {
      throw new IOException("Cannot duplicate a closed " + kind() + " handle");
    }
    underlying.openDescriptors.incrementAndGet();
    return newDescriptor(underlying);
  }

  @Override
  public void close() throws IOException {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (underlying.openDescriptors.decrementAndGet() == 0) {
      releaseUnderlying(underlying.object);
    }
  }

  /**
   * Checks that this descriptor may still be used.
   *
   * @throws IOException if it was closed
   */
  void ensureOpen() throws IOException {
    if (closed.get()) {
      throw new IOException(kind() + " handle is closed");
    }
  }

  /**
   * Gets the number of descriptors currently open onto the underlying object.
   *
   * @return The open descriptor count
   */
  public int openDescriptorCount() {
    return underlying.openDescriptors.get();
  }

  abstract TransitHandle newDescriptor(Underlying<T> underlying);

  abstract void releaseUnderlying(T object) throws IOException;
}
