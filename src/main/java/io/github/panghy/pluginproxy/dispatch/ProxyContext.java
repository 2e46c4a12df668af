package io.github.panghy.pluginproxy.dispatch;

import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.proxy.CoreProxy;
import io.github.panghy.pluginproxy.resource.ResourceTracker;
import io.github.panghy.pluginproxy.resource.WireResourceId;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.debug;
import static io.github.panghy.pluginproxy.util.LoggingUtil.warn;

/**
 * The plugin-side state shared by all dispatchers of one process: the
 * {@link ResourceTracker} and the mapping from instance ids to the dispatcher serving
 * each instance.
 *
 * <p>A process creates one context and passes it to every {@link PluginDispatcher}.
 * Tests create as many independent contexts as they like.</p>
 */
public class ProxyContext implements ResourceTracker.ReleaseNotifier {

  private static final Logger LOGGER = Logger.getLogger(ProxyContext.class.getName());

  private final DispatcherConfiguration configuration;
  private final ResourceTracker resourceTracker;
  private final Map<Integer, PluginDispatcher> dispatchersByInstance = new HashMap<>();

  public ProxyContext() {
    this(DispatcherConfiguration.defaultConfig());
  }

  /**
   * Creates a context.
   *
   * @param configuration The configuration for the tracker and the dispatchers
   */
  public ProxyContext(DispatcherConfiguration configuration) {
    this.configuration = configuration;
    this.resourceTracker = new ResourceTracker(configuration.getResourceHandleBase());
    this.resourceTracker.setReleaseNotifier(this);
  }

  public DispatcherConfiguration getConfiguration() {
    return configuration;
  }

  public ResourceTracker getResourceTracker() {
    return resourceTracker;
  }

  /**
   * Records which dispatcher serves an instance.
   *
   * @param instance   The instance id
   * @param dispatcher The dispatcher
   */
  void registerInstance(int instance, PluginDispatcher dispatcher) {
    PluginDispatcher previous = dispatchersByInstance.put(instance, dispatcher);
    if (previous != null && previous != dispatcher) {
      warn(LOGGER, "Instance " + instance + " moved from " + previous + " to " + dispatcher);
    }
  }

  void unregisterInstance(int instance) {
    dispatchersByInstance.remove(instance);
  }

  /**
   * Gets the dispatcher serving an instance.
   *
   * @param instance The instance id
   * @return The dispatcher, or null if the instance is unknown
   */
  public PluginDispatcher getDispatcherForInstance(int instance) {
    return dispatchersByInstance.get(instance);
  }

  @Override
  public boolean notifyPeerRelease(WireResourceId id) {
    PluginDispatcher dispatcher = dispatchersByInstance.get(id.instance());
    if (dispatcher == null || !dispatcher.isAlive()) {
      return false;
    }
    return dispatcher.getProxy(ApiGroup.CORE, CoreProxy.class).releaseResource(id);
  }

  @Override
  public void resourceRemoved(WireResourceId id) {
    PluginDispatcher dispatcher = dispatchersByInstance.get(id.instance());
    if (dispatcher == null) {
      debug(LOGGER, "No dispatcher for instance of " + id);
      return;
    }
    dispatcher.getCallbackTracker().abortForResource(id);
  }
}
