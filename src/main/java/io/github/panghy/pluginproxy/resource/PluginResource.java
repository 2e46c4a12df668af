package io.github.panghy.pluginproxy.resource;

/**
 * Base class of the local objects that stand in for resources owned by the peer.
 *
 * <p>A PluginResource is created by a capability proxy when it first learns of a
 * {@link WireResourceId} and is handed to the {@link ResourceTracker}, which owns it
 * from then on and gives out an opaque local handle for it. Subclasses keep whatever
 * per-resource state their capability needs (buffers, cached values, child resources).</p>
 */
public abstract class PluginResource {

  private final WireResourceId wireId;

  protected PluginResource(WireResourceId wireId) {
    this.wireId = wireId;
  }

  /**
   * Gets the identity of the resource on the owning side.
   *
   * @return The wire identity
   */
  public WireResourceId getWireId() {
    return wireId;
  }

  public int getInstance() {
    return wireId.instance();
  }

  /**
   * Called exactly once, after the tracker has removed this object from its tables
   * because the last reference went away or the instance was torn down. Subclasses
   * release the resources they hold here; doing so may re-enter the tracker.
   *
   * @param tracker The tracker that owned this object
   */
  protected void lastReferenceReleased(ResourceTracker tracker) {
  }
}
