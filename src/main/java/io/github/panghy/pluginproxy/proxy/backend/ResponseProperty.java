package io.github.panghy.pluginproxy.proxy.backend;

/**
 * Properties of a URL response.
 */
public enum ResponseProperty {
  URL,
  REDIRECT_URL,
  REDIRECT_METHOD,
  STATUS_CODE,
  STATUS_LINE,
  HEADERS
}
