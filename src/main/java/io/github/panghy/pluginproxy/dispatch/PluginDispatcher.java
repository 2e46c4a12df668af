package io.github.panghy.pluginproxy.dispatch;

import io.github.panghy.pluginproxy.channel.Channel;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.proxy.InterfaceProxy;
import io.github.panghy.pluginproxy.proxy.ProxyFactories;
import io.github.panghy.pluginproxy.resource.ResourceTracker;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.debug;

/**
 * The dispatcher of the plugin process. It serves the instances the host created on
 * its channel and references their resources through the context's
 * {@link ResourceTracker}.
 */
public class PluginDispatcher extends Dispatcher {

  private static final Logger LOGGER = Logger.getLogger(PluginDispatcher.class.getName());

  private final ProxyContext context;
  private final Set<Integer> instances = new LinkedHashSet<>();

  public PluginDispatcher(Channel channel, ProxyContext context) {
    this(channel, context, ProxyFactories.standard());
  }

  public PluginDispatcher(Channel channel, ProxyContext context,
                          Map<ApiGroup, Function<Dispatcher, InterfaceProxy>> factories) {
    super(channel, context.getConfiguration(), factories);
    this.context = context;
  }

  @Override
  public boolean isHost() {
    return false;
  }

  public ProxyContext getContext() {
    return context;
  }

  public ResourceTracker getResourceTracker() {
    return context.getResourceTracker();
  }

  /**
   * Starts serving an instance the host created.
   *
   * @param instance The instance id
   */
  public void didCreateInstance(int instance) {
    instances.add(instance);
    context.registerInstance(instance, this);
    debug(LOGGER, this + ": serving instance " + instance);
  }

  /**
   * Stops serving an instance. Its resources are dropped without notifying the host,
   * which has destroyed them along with the instance.
   *
   * @param instance The instance id
   */
  public void didDestroyInstance(int instance) {
    if (!instances.remove(instance)) {
      return;
    }
    getResourceTracker().invalidateInstance(instance);
    getCallbackTracker().abortForInstance(instance);
    context.unregisterInstance(instance);
  }

  /**
   * Checks whether this dispatcher serves an instance.
   *
   * @param instance The instance id
   * @return true if served
   */
  public boolean servesInstance(int instance) {
    return instances.contains(instance);
  }

  @Override
  protected void channelFailed() {
    ResourceTracker tracker = getResourceTracker();
    for (int instance : instances) {
      tracker.invalidateInstance(instance);
    }
    for (int instance : instances) {
      context.unregisterInstance(instance);
    }
    instances.clear();
  }
}
