package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.dispatch.Dispatcher;
import io.github.panghy.pluginproxy.dispatch.PluginDispatcher;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.message.ParamReader;
import io.github.panghy.pluginproxy.message.ParamWriter;
import io.github.panghy.pluginproxy.message.WireMessage;
import io.github.panghy.pluginproxy.proxy.backend.PluginInstance;

import java.util.List;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.warn;

/**
 * Instance lifecycle, called by the host into the plugin.
 *
 * <p>Creating an instance also makes the plugin dispatcher responsible for it: from
 * then on resources of the instance can be created, and when the instance is destroyed
 * they are dropped.</p>
 */
public class InstanceProxy extends InterfaceProxy {

  private static final Logger LOGGER = Logger.getLogger(InstanceProxy.class.getName());

  static final int DID_CREATE = 1;
  static final int DID_DESTROY = 2;
  static final int DID_CHANGE_FOCUS = 3;

  public InstanceProxy(Dispatcher dispatcher) {
    super(dispatcher);
  }

  @Override
  public ApiGroup getApiGroup() {
    return ApiGroup.INSTANCE;
  }

  /**
   * Creates an instance in the plugin and waits for the plugin to accept it.
   *
   * @param instance  The instance id
   * @param argNames  Names of the embedding attributes
   * @param argValues Their values
   * @return true if the plugin accepted the instance
   */
  public boolean didCreate(int instance, List<String> argNames, List<String> argValues) {
    if (argNames == null || argValues == null || argNames.size() != argValues.size()) {
      warn(LOGGER, "Instance " + instance + " created with mismatched argument lists");
      return false;
    }
    return callSync(DID_CREATE, new ParamWriter()
        .writeInt(instance)
        .writeStringList(argNames)
        .writeStringList(argValues),
        ParamReader::readBoolean, false);
  }

  public boolean didDestroy(int instance) {
    return send(DID_DESTROY, new ParamWriter().writeInt(instance));
  }

  public boolean didChangeFocus(int instance, boolean hasFocus) {
    return send(DID_CHANGE_FOCUS, new ParamWriter().writeInt(instance).writeBoolean(hasFocus));
  }

  @Override
  public boolean onMessageReceived(WireMessage message, ParamWriter reply) {
    if (dispatcher.isHost()) {
      return false;
    }
    PluginDispatcher plugin = (PluginDispatcher) dispatcher;
    PluginInstance backend = backend(PluginInstance.class);
    ParamReader params = message.reader();
    int instance;
    switch (message.getKind()) {
      case DID_CREATE:
        instance = params.readInt();
        List<String> argNames = params.readStringList();
        List<String> argValues = params.readStringList();
        plugin.didCreateInstance(instance);
        boolean accepted = backend != null && backend.didCreate(instance, argNames, argValues);
        if (!accepted) {
          warn(LOGGER, "Plugin refused instance " + instance);
          plugin.didDestroyInstance(instance);
        }
        if (reply != null) {
          reply.writeBoolean(accepted);
        }
        return true;
      case DID_DESTROY:
        instance = params.readInt();
        if (backend != null) {
          backend.didDestroy(instance);
        }
        plugin.didDestroyInstance(instance);
        return true;
      case DID_CHANGE_FOCUS:
        instance = params.readInt();
        boolean hasFocus = params.readBoolean();
        if (backend != null) {
          backend.didChangeFocus(instance, hasFocus);
        }
        return true;
      default:
        return false;
    }
  }
}
