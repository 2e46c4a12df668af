package io.github.panghy.pluginproxy.resource;

/**
 * A single counted reference to a tracked resource.
 *
 * <p>References are only handed out by {@link ResourceTracker#acquire} and
 * {@link ResourceTracker#adopt}. Closing one releases its reference exactly once, so it
 * can be used with try-with-resources around code that needs a resource to stay alive.</p>
 */
public final class ResourceRef implements AutoCloseable {

  private final ResourceTracker tracker;
  private final int handle;
  private boolean closed;

  ResourceRef(ResourceTracker tracker, int handle) {
    this.tracker = tracker;
    this.handle = handle;
  }

  public int handle() {
    return handle;
  }

  /**
   * Gets the resource object while this reference is open.
   *
   * @param type The expected resource class
   * @param <T>  The resource type
   * @return The resource, or null if it is of another type
   * @throws IllegalStateException if this reference was closed
   */
  public <T extends PluginResource> T get(Class<T> type) {
    if (closed) {
      throw new IllegalStateException("Reference to " + handle + " is closed");
    }
    return tracker.getAs(handle, type);
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    tracker.releaseResource(handle);
  }

  @Override
  public String toString() {
    return "ResourceRef[" + handle + (closed ? ", closed" : "") + "]";
  }
}
