package io.github.panghy.pluginproxy.proxy.backend;

import java.util.List;

/**
 * Instance lifecycle entry points implemented by the plugin.
 */
public interface PluginInstance {

  /**
   * Called when the host creates an instance of the plugin.
   *
   * @param instance The instance id
   * @param argNames  Names of the embedding attributes
   * @param argValues Values of the embedding attributes, parallel to the names
   * @return true if the plugin accepted the instance
   */
  boolean didCreate(int instance, List<String> argNames, List<String> argValues);

  void didDestroy(int instance);

  void didChangeFocus(int instance, boolean hasFocus);
}
