package io.github.panghy.pluginproxy.proxy.backend;

public enum FileChooserMode {
  OPEN,
  OPEN_MULTIPLE
}
