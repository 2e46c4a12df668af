package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.dispatch.Dispatcher;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.message.ParamReader;
import io.github.panghy.pluginproxy.message.ParamWriter;
import io.github.panghy.pluginproxy.message.WireMessage;
import io.github.panghy.pluginproxy.proxy.backend.ResponseProperty;
import io.github.panghy.pluginproxy.proxy.backend.UrlResponseInfoBackend;
import io.github.panghy.pluginproxy.resource.WireResourceId;

/**
 * Read access to URL responses. Response info resources are only ever created by
 * {@link UrlLoaderProxy#getResponseInfo(int)}.
 */
public class UrlResponseInfoProxy extends InterfaceProxy {

  static final int GET_PROPERTY = 1;

  public UrlResponseInfoProxy(Dispatcher dispatcher) {
    super(dispatcher);
  }

  @Override
  public ApiGroup getApiGroup() {
    return ApiGroup.URL_RESPONSE_INFO;
  }

  /**
   * Gets a property of a response.
   *
   * @param responseInfo The response info handle
   * @param property     The property
   * @return The value, null if the handle is bad or the host has no value
   */
  public String getProperty(int responseInfo, ResponseProperty property) {
    UrlResponseInfo object = tracker().getAs(responseInfo, UrlResponseInfo.class);
    if (object == null || property == null) {
      return null;
    }
    return callSync(GET_PROPERTY, new ParamWriter()
        .writeResource(object.getWireId())
        .writeInt(property.ordinal()),
        ParamReader::readString, null);
  }

  @Override
  public boolean onMessageReceived(WireMessage message, ParamWriter reply) {
    if (!dispatcher.isHost() || message.getKind() != GET_PROPERTY) {
      return false;
    }
    ParamReader params = message.reader();
    WireResourceId id = params.readResource();
    int ordinal = params.readInt();
    ResponseProperty[] properties = ResponseProperty.values();
    UrlResponseInfoBackend backend = backend(UrlResponseInfoBackend.class);
    String value = null;
    if (backend != null && ordinal >= 0 && ordinal < properties.length) {
      value = backend.getProperty(id.hostResource(), properties[ordinal]);
    }
    if (reply != null) {
      reply.writeString(value);
    }
    return true;
  }
}
