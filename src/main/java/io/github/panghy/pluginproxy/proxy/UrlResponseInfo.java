package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.resource.PluginResource;
import io.github.panghy.pluginproxy.resource.WireResourceId;

/**
 * Plugin-side stand-in for a URL response. Every property is fetched from the host.
 */
public final class UrlResponseInfo extends PluginResource {

  UrlResponseInfo(WireResourceId wireId) {
    super(wireId);
  }
}
