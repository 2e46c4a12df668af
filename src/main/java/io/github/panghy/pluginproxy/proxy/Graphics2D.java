package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.resource.PluginResource;
import io.github.panghy.pluginproxy.resource.WireResourceId;

/**
 * Plugin-side state of a 2D surface.
 */
public final class Graphics2D extends PluginResource {

  private final int width;
  private final int height;
  private final boolean opaque;

  Graphics2D(WireResourceId wireId, int width, int height, boolean opaque) {
    super(wireId);
    this.width = width;
    this.height = height;
    this.opaque = opaque;
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public boolean isOpaque() {
    return opaque;
  }
}
