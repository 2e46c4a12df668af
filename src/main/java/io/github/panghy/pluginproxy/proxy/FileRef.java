package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.resource.PluginResource;
import io.github.panghy.pluginproxy.resource.WireResourceId;

/**
 * A reference to a file the host granted the plugin access to.
 */
public final class FileRef extends PluginResource {

  private final String path;
  private final String name;

  FileRef(WireResourceId wireId, String path, String name) {
    super(wireId);
    this.path = path;
    this.name = name;
  }

  public String getPath() {
    return path;
  }

  public String getName() {
    return name;
  }
}
