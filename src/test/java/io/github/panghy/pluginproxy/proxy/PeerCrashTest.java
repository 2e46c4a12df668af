package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.callback.ResultCode;
import io.github.panghy.pluginproxy.core.ResultFuture;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.proxy.backend.UrlLoaderBackend;
import io.github.panghy.pluginproxy.proxy.backend.UrlRequest;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static io.github.panghy.pluginproxy.proxy.ProxyTestHarness.INSTANCE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Tests what the plugin side does when the channel to the host fails.
 */
public class PeerCrashTest {

  @Test
  void crashAbortsEveryPendingOperationAndDropsAllResources() {
    ProxyTestHarness harness = new ProxyTestHarness();
    FakeUrlLoaderBackend backend = new FakeUrlLoaderBackend();
    harness.host.addLocalInterface(UrlLoaderBackend.class, backend);
    harness.withInstance();
    UrlLoaderProxy proxy = harness.pluginProxy(ApiGroup.URL_LOADER, UrlLoaderProxy.class);

    int first = proxy.create(INSTANCE);
    int second = proxy.create(INSTANCE);
    ResultFuture<Integer> open = proxy.open(first, UrlRequest.get("http://example.com/1"));
    ResultFuture<Integer> read = proxy.readResponseBody(first, ByteBuffer.allocate(16), 16);
    ResultFuture<Integer> otherOpen = proxy.open(second, UrlRequest.get("http://example.com/2"));
    harness.pump();
    assertThat(harness.plugin.getCallbackTracker().pendingCount()).isEqualTo(3);

    harness.channels.host().close();

    assertThat(open.getNow()).isEqualTo(ResultCode.ABORTED.getCode());
    assertThat(read.getNow()).isEqualTo(ResultCode.ABORTED.getCode());
    assertThat(otherOpen.getNow()).isEqualTo(ResultCode.ABORTED.getCode());
    assertThat(harness.tracker().countForInstance(INSTANCE)).isZero();
    assertThat(harness.tracker().size()).isZero();
    assertThat(harness.plugin.isAlive()).isFalse();
    assertThat(harness.host.isAlive()).isFalse();
    verify(harness.resourceBackend, never()).releaseResource(anyInt());
  }

  @Test
  void operationsAfterTheCrashFailImmediately() {
    ProxyTestHarness harness = new ProxyTestHarness();
    harness.host.addLocalInterface(UrlLoaderBackend.class, new FakeUrlLoaderBackend());
    harness.withInstance();
    UrlLoaderProxy proxy = harness.pluginProxy(ApiGroup.URL_LOADER, UrlLoaderProxy.class);
    int loader = proxy.create(INSTANCE);

    harness.channels.plugin().close();

    assertThat(harness.tracker().getResourceObject(loader)).isNull();
    assertThat(proxy.create(INSTANCE)).isZero();
    assertThat(harness.context.getDispatcherForInstance(INSTANCE)).isNull();
  }

  @Test
  void hostFinishingWorkAfterTheCrashIsHarmless() {
    ProxyTestHarness harness = new ProxyTestHarness();
    FakeUrlLoaderBackend backend = new FakeUrlLoaderBackend();
    harness.host.addLocalInterface(UrlLoaderBackend.class, backend);
    harness.withInstance();
    UrlLoaderProxy proxy = harness.pluginProxy(ApiGroup.URL_LOADER, UrlLoaderProxy.class);
    int loader = proxy.create(INSTANCE);
    ResultFuture<Integer> open = proxy.open(loader, UrlRequest.get("http://example.com/"));
    harness.pump();

    harness.channels.host().close();
    backend.completeOpen(100, ResultCode.OK.getCode());

    assertThat(open.getNow()).isEqualTo(ResultCode.ABORTED.getCode());
    assertThat(harness.channels.host().pendingMessageCount()).isZero();
  }
}
