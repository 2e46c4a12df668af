package io.github.panghy.pluginproxy.proxy.backend;

/**
 * The host's resource table, told when the plugin drops its reference to a resource.
 */
public interface ResourceBackend {

  /**
   * Drops the reference the plugin held.
   *
   * @param resource The host resource id
   */
  void releaseResource(int resource);
}
