package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.proxy.backend.UrlLoaderBackend;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static io.github.panghy.pluginproxy.proxy.ProxyTestHarness.INSTANCE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for InstanceProxy and the instance bookkeeping of the plugin dispatcher.
 */
public class InstanceProxyTest {

  @Test
  void didCreatePassesArgumentsAndRegistersTheInstance() {
    ProxyTestHarness harness = new ProxyTestHarness();
    InstanceProxy proxy = harness.hostProxy(ApiGroup.INSTANCE, InstanceProxy.class);

    assertTrue(proxy.didCreate(INSTANCE, List.of("src", "width"), List.of("movie.swf", "300")));

    verify(harness.pluginInstance).didCreate(INSTANCE, List.of("src", "width"), List.of("movie.swf", "300"));
    assertTrue(harness.plugin.servesInstance(INSTANCE));
    assertSame(harness.plugin, harness.context.getDispatcherForInstance(INSTANCE));
  }

  @Test
  void refusedInstanceIsNotServed() {
    ProxyTestHarness harness = new ProxyTestHarness();
    when(harness.pluginInstance.didCreate(9, Collections.emptyList(), Collections.emptyList())).thenReturn(false);

    boolean created = harness.hostProxy(ApiGroup.INSTANCE, InstanceProxy.class)
        .didCreate(9, Collections.emptyList(), Collections.emptyList());

    assertFalse(created);
    assertFalse(harness.plugin.servesInstance(9));
    assertNull(harness.context.getDispatcherForInstance(9));
  }

  @Test
  void mismatchedArgumentListsAreRejected() {
    ProxyTestHarness harness = new ProxyTestHarness();
    InstanceProxy proxy = harness.hostProxy(ApiGroup.INSTANCE, InstanceProxy.class);

    assertFalse(proxy.didCreate(INSTANCE, List.of("a"), Collections.emptyList()));
    assertFalse(proxy.didCreate(INSTANCE, null, Collections.emptyList()));
    assertFalse(proxy.didCreate(INSTANCE, Collections.emptyList(), null));

    verify(harness.pluginInstance, never()).didCreate(anyInt(), anyList(), anyList());
    assertFalse(harness.plugin.servesInstance(INSTANCE));
  }

  @Test
  void didDestroyDropsResourcesWithoutReleasingThemOnTheHost() {
    ProxyTestHarness harness = new ProxyTestHarness();
    harness.host.addLocalInterface(UrlLoaderBackend.class, new FakeUrlLoaderBackend());
    harness.withInstance();
    UrlLoaderProxy loaders = harness.pluginProxy(ApiGroup.URL_LOADER, UrlLoaderProxy.class);
    loaders.create(INSTANCE);
    loaders.create(INSTANCE);
    assertEquals(2, harness.tracker().countForInstance(INSTANCE));

    harness.hostProxy(ApiGroup.INSTANCE, InstanceProxy.class).didDestroy(INSTANCE);
    harness.pump();

    verify(harness.pluginInstance).didDestroy(INSTANCE);
    assertEquals(0, harness.tracker().size());
    assertFalse(harness.plugin.servesInstance(INSTANCE));
    verify(harness.resourceBackend, never()).releaseResource(anyInt());
  }

  @Test
  void focusChangesReachThePlugin() {
    ProxyTestHarness harness = new ProxyTestHarness().withInstance();

    harness.hostProxy(ApiGroup.INSTANCE, InstanceProxy.class).didChangeFocus(INSTANCE, true);
    harness.pump();

    verify(harness.pluginInstance).didChangeFocus(INSTANCE, true);
  }
}
