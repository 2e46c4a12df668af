package io.github.panghy.pluginproxy.proxy.backend;

/**
 * The host's view of a URL response.
 */
public interface UrlResponseInfoBackend {

  /**
   * Gets a property of a response.
   *
   * @param responseInfo The response info resource id
   * @param property     The property
   * @return The value as a string, numbers in decimal; null if the resource is unknown
   */
  String getProperty(int responseInfo, ResponseProperty property);
}
