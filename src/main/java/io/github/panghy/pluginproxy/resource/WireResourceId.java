package io.github.panghy.pluginproxy.resource;

/**
 * Identifies a resource the way the process owning it knows it: the plugin instance it
 * belongs to plus the owner's resource id.
 *
 * <p>This is the value carried on the wire and the key under which the non-owning side
 * correlates its local state. It never owns anything. An identity whose resource id or
 * instance is {@code 0} is degenerate and stands for "no resource", which is also how
 * the owner reports a failed create.</p>
 *
 * @param instance     The plugin instance the resource belongs to
 * @param hostResource The owner's id for the resource
 */
public record WireResourceId(int instance, int hostResource) {

  /**
   * The degenerate identity.
   */
  public static final WireResourceId NULL = new WireResourceId(0, 0);

  /**
   * Checks whether this identity names no resource.
   *
   * @return true if degenerate
   */
  public boolean isNull() {
    return instance == 0 || hostResource == 0;
  }

  @Override
  public String toString() {
    return "WireResourceId[" + instance + ":" + hostResource + "]";
  }
}
