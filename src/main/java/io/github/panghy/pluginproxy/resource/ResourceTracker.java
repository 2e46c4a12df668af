package io.github.panghy.pluginproxy.resource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.debug;
import static io.github.panghy.pluginproxy.util.LoggingUtil.error;
import static io.github.panghy.pluginproxy.util.LoggingUtil.warn;

/**
 * Process-local table of the resources this side references but the peer owns.
 *
 * <p>The tracker hands out opaque local handles for {@link PluginResource} objects and
 * keeps a reference count per handle. It maintains two mappings:</p>
 * <ul>
 *   <li>local handle to entry (reference count plus the resource object), exactly
 *   one-to-one</li>
 *   <li>{@link WireResourceId} to local handle, at most one-to-one, so the same peer
 *   resource seen twice resolves to the same handle</li>
 * </ul>
 *
 * <p>An entry exists only while its count is positive: it is removed from both maps in
 * the same step that takes the count to zero. When that happens the peer is told (once)
 * so it can free the authoritative resource, unless the release is local cleanup after
 * the channel went away. Handle {@code 0} is never allocated and stands for "no
 * resource".</p>
 *
 * <p>A tracker is not thread safe. It is only touched from the channel thread.</p>
 */
public class ResourceTracker {

  private static final Logger LOGGER = Logger.getLogger(ResourceTracker.class.getName());

  /**
   * Callbacks from the tracker into the dispatch layer.
   */
  public interface ReleaseNotifier {
    /**
     * Tells the owner of a resource that this side no longer references it.
     *
     * @param id The identity of the released resource
     * @return true if the notification was sent, false if the owning channel is gone
     */
    boolean notifyPeerRelease(WireResourceId id);

    /**
     * Called for every entry that leaves the tracker, before the resource object is
     * told, so operations still pending on the resource can be aborted.
     *
     * @param id The identity of the removed resource
     */
    void resourceRemoved(WireResourceId id);
  }

  /**
   * One live handle.
   */
  private static final class Entry {
    final PluginResource resource;
    int refCount = 1;

    Entry(PluginResource resource) {
      this.resource = resource;
    }
  }

  private final Map<Integer, Entry> liveResources = new HashMap<>();
  private final Map<WireResourceId, Integer> handlesByIdentity = new HashMap<>();
  private final int handleBase;
  private ReleaseNotifier releaseNotifier;
  private int lastHandle;

  /**
   * Creates a tracker whose handles count up from the given base.
   *
   * @param handleBase The value just below the first handle; must be non-negative
   */
  public ResourceTracker(int handleBase) {
    if (handleBase < 0) {
      throw new IllegalArgumentException("Handle base must be non-negative");
    }
    this.handleBase = handleBase;
    this.lastHandle = handleBase;
  }

  /**
   * Sets the callbacks used when entries leave the tracker.
   *
   * @param releaseNotifier The notifier, may be null for a tracker with no peer
   */
  public void setReleaseNotifier(ReleaseNotifier releaseNotifier) {
    this.releaseNotifier = releaseNotifier;
  }

  /**
   * Starts tracking a resource with a reference count of one.
   *
   * <p>A resource with a degenerate identity is refused: it would otherwise alias the
   * reserved handle {@code 0}. A resource whose identity is already tracked is not added
   * a second time; the existing handle gains a reference instead.</p>
   *
   * @param resource The resource object, owned by the tracker from now on
   * @return The new local handle, or 0 if the resource was refused
   */
  public int addResource(PluginResource resource) {
    if (resource == null || resource.getWireId() == null || resource.getWireId().isNull()) {
      error(LOGGER, "Refusing to track a resource without a valid identity: " + resource);
      return 0;
    }
    WireResourceId id = resource.getWireId();
    Integer existing = handlesByIdentity.get(id);
    if (existing != null) {
      warn(LOGGER, id + " is already tracked as " + existing + ", adding a reference instead");
      liveResources.get(existing).refCount++;
      return existing;
    }
    int handle = allocateHandle();
    liveResources.put(handle, new Entry(resource));
    handlesByIdentity.put(id, handle);
    debug(LOGGER, "Tracking " + id + " as " + handle);
    return handle;
  }

  /**
   * Finds the handle of an already tracked identity or creates and tracks a new resource.
   * Either way the caller ends up owning one reference to the returned handle.
   *
   * @param id      The identity
   * @param factory Creates the resource object when the identity is not tracked yet
   * @return The handle, or 0 if the identity is degenerate
   */
  public int addOrReuse(WireResourceId id, Function<WireResourceId, PluginResource> factory) {
    int existing = lookupByIdentity(id);
    if (existing != 0) {
      addRefResource(existing);
      return existing;
    }
    if (id == null || id.isNull()) {
      return 0;
    }
    return addResource(factory.apply(id));
  }

  private int allocateHandle() {
    do {
      lastHandle = lastHandle == Integer.MAX_VALUE ? handleBase + 1 : lastHandle + 1;
    } while (lastHandle == 0 || liveResources.containsKey(lastHandle));
    return lastHandle;
  }

  /**
   * Adds a reference to a live handle.
   *
   * @param handle The local handle
   * @return true if the handle was live
   */
  public boolean addRefResource(int handle) {
    Entry entry = liveResources.get(handle);
    if (entry == null) {
      warn(LOGGER, "AddRef of unknown resource handle " + handle);
      return false;
    }
    entry.refCount++;
    return true;
  }

  /**
   * Drops a reference, notifying the peer when the last one goes away.
   *
   * @param handle The local handle
   * @return true if the handle was live
   */
  public boolean releaseResource(int handle) {
    return releaseResource(handle, true);
  }

  /**
   * Drops a reference to a live handle. Releasing an unknown handle is a logged no-op,
   * so a count can never go below zero.
   *
   * @param handle     The local handle
   * @param notifyPeer Whether to tell the owner when the last reference goes away
   * @return true if the handle was live
   */
  public boolean releaseResource(int handle, boolean notifyPeer) {
    Entry entry = liveResources.get(handle);
    if (entry == null) {
      warn(LOGGER, "Release of unknown resource handle " + handle);
      return false;
    }
    if (--entry.refCount > 0) {
      return true;
    }
    removeEntry(handle, entry, notifyPeer);
    return true;
  }

  private void removeEntry(int handle, Entry entry, boolean notifyPeer) {
    PluginResource resource = entry.resource;
    WireResourceId id = resource.getWireId();
    liveResources.remove(handle);
    handlesByIdentity.remove(id);
    debug(LOGGER, "Released " + id + " (handle " + handle + ")");
    if (releaseNotifier != null) {
      if (notifyPeer && !releaseNotifier.notifyPeerRelease(id)) {
        debug(LOGGER, "Owner of " + id + " is gone, release is local only");
      }
      releaseNotifier.resourceRemoved(id);
    }
    resource.lastReferenceReleased(this);
  }

  /**
   * Drops every entry of an instance without telling the peer. Used when the channel
   * serving the instance has failed or the instance was destroyed.
   *
   * @param instance The instance id
   * @return The number of entries removed
   */
  public int invalidateInstance(int instance) {
    List<Integer> handles = new ArrayList<>();
    for (Map.Entry<Integer, Entry> e : liveResources.entrySet()) {
      if (e.getValue().resource.getInstance() == instance) {
        handles.add(e.getKey());
      }
    }
    int removed = 0;
    for (int handle : handles) {
      // an earlier teardown may already have released this one
      Entry entry = liveResources.get(handle);
      if (entry != null) {
        removeEntry(handle, entry, false);
        removed++;
      }
    }
    if (removed > 0) {
      debug(LOGGER, "Invalidated " + removed + " resource(s) of instance " + instance);
    }
    return removed;
  }

  /**
   * Finds the local handle for a peer resource.
   *
   * @param id The identity
   * @return The handle, or 0 if not tracked
   */
  public int lookupByIdentity(WireResourceId id) {
    if (id == null) {
      return 0;
    }
    Integer handle = handlesByIdentity.get(id);
    return handle == null ? 0 : handle;
  }

  /**
   * Gets the object behind a handle.
   *
   * @param handle The local handle
   * @return The resource, or null if the handle is not live
   */
  public PluginResource getResourceObject(int handle) {
    Entry entry = liveResources.get(handle);
    return entry == null ? null : entry.resource;
  }

  /**
   * Gets the object behind a handle if it is of the requested type.
   *
   * @param handle The local handle
   * @param type   The expected resource class
   * @param <T>    The resource type
   * @return The resource, or null if the handle is not live or of another type
   */
  public <T extends PluginResource> T getAs(int handle, Class<T> type) {
    PluginResource resource = getResourceObject(handle);
    return type.isInstance(resource) ? type.cast(resource) : null;
  }

  /**
   * Takes a scoped reference to a live handle.
   *
   * @param handle The local handle
   * @return The reference, or null if the handle is not live
   */
  public ResourceRef acquire(int handle) {
    if (!addRefResource(handle)) {
      return null;
    }
    return new ResourceRef(this, handle);
  }

  /**
   * Wraps a reference the caller already owns, such as the one returned by
   * {@link #addResource}, so that closing the wrapper releases it.
   *
   * @param handle The local handle
   * @return The reference, or null if the handle is not live
   */
  public ResourceRef adopt(int handle) {
    if (!liveResources.containsKey(handle)) {
      return null;
    }
    return new ResourceRef(this, handle);
  }

  public int getRefCount(int handle) {
    Entry entry = liveResources.get(handle);
    return entry == null ? 0 : entry.refCount;
  }

  public int size() {
    return liveResources.size();
  }

  /**
   * Counts the live entries of one instance.
   *
   * @param instance The instance id
   * @return The entry count
   */
  public int countForInstance(int instance) {
    int count = 0;
    for (Entry entry : liveResources.values()) {
      if (entry.resource.getInstance() == instance) {
        count++;
      }
    }
    return count;
  }
}
