package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.dispatch.Dispatcher;
import io.github.panghy.pluginproxy.message.ApiGroup;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * The factory table dispatchers construct their proxies from.
 */
public final class ProxyFactories {

  private ProxyFactories() {
  }

  /**
   * Gets a factory for every API group.
   *
   * @return An unmodifiable table
   */
  public static Map<ApiGroup, Function<Dispatcher, InterfaceProxy>> standard() {
    Map<ApiGroup, Function<Dispatcher, InterfaceProxy>> factories = new EnumMap<>(ApiGroup.class);
    factories.put(ApiGroup.CORE, CoreProxy::new);
    factories.put(ApiGroup.INSTANCE, InstanceProxy::new);
    factories.put(ApiGroup.URL_LOADER, UrlLoaderProxy::new);
    factories.put(ApiGroup.URL_RESPONSE_INFO, UrlResponseInfoProxy::new);
    factories.put(ApiGroup.GRAPHICS_2D, Graphics2DProxy::new);
    factories.put(ApiGroup.FILE_CHOOSER, FileChooserProxy::new);
    factories.put(ApiGroup.AUDIO, AudioProxy::new);
    return Collections.unmodifiableMap(factories);
  }
}
