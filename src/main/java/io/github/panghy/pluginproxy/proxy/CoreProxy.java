package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.dispatch.Dispatcher;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.message.ParamReader;
import io.github.panghy.pluginproxy.message.ParamWriter;
import io.github.panghy.pluginproxy.message.WireMessage;
import io.github.panghy.pluginproxy.proxy.backend.ResourceBackend;
import io.github.panghy.pluginproxy.resource.WireResourceId;

import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.debug;
import static io.github.panghy.pluginproxy.util.LoggingUtil.warn;

/**
 * Resource lifetime messages. The plugin tells the host when it no longer references a
 * resource so the host can drop the reference it kept on the plugin's behalf.
 */
public class CoreProxy extends InterfaceProxy {

  private static final Logger LOGGER = Logger.getLogger(CoreProxy.class.getName());

  static final int RELEASE_RESOURCE = 1;

  public CoreProxy(Dispatcher dispatcher) {
    super(dispatcher);
  }

  @Override
  public ApiGroup getApiGroup() {
    return ApiGroup.CORE;
  }

  /**
   * Tells the host the plugin dropped its reference to a resource.
   *
   * @param id The resource
   * @return true if the message was sent
   */
  public boolean releaseResource(WireResourceId id) {
    return send(RELEASE_RESOURCE, new ParamWriter().writeResource(id));
  }

  @Override
  public boolean onMessageReceived(WireMessage message, ParamWriter reply) {
    if (!dispatcher.isHost()) {
      return false;
    }
    ParamReader params = message.reader();
    switch (message.getKind()) {
      case RELEASE_RESOURCE:
        WireResourceId id = params.readResource();
        ResourceBackend backend = backend(ResourceBackend.class);
        if (backend == null) {
          warn(LOGGER, "No resource backend to release " + id);
        } else {
          debug(LOGGER, "Plugin released " + id);
          backend.releaseResource(id.hostResource());
        }
        return true;
      default:
        return false;
    }
  }
}
