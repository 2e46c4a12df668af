package io.github.panghy.pluginproxy.dispatch;

import io.github.panghy.pluginproxy.channel.Channel;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.proxy.InterfaceProxy;
import io.github.panghy.pluginproxy.proxy.ProxyFactories;

import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.info;

/**
 * The dispatcher of the host process, which owns the resources and calls into the
 * real capability backends on behalf of the plugin.
 */
public class HostDispatcher extends Dispatcher {

  private static final Logger LOGGER = Logger.getLogger(HostDispatcher.class.getName());

  public HostDispatcher(Channel channel, DispatcherConfiguration configuration) {
    this(channel, configuration, ProxyFactories.standard());
  }

  public HostDispatcher(Channel channel, DispatcherConfiguration configuration,
                        Map<ApiGroup, Function<Dispatcher, InterfaceProxy>> factories) {
    super(channel, configuration, factories);
  }

  @Override
  public boolean isHost() {
    return true;
  }

  @Override
  protected void channelFailed() {
    info(LOGGER, this + ": plugin side of the channel is gone");
  }
}
