package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.callback.ResultCode;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.proxy.backend.ResponseProperty;
import io.github.panghy.pluginproxy.proxy.backend.UrlLoaderBackend;
import io.github.panghy.pluginproxy.proxy.backend.UrlRequest;
import io.github.panghy.pluginproxy.proxy.backend.UrlResponseInfoBackend;
import org.junit.jupiter.api.Test;

import static io.github.panghy.pluginproxy.proxy.ProxyTestHarness.INSTANCE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for UrlResponseInfoProxy.
 */
public class UrlResponseInfoProxyTest {

  @Test
  void propertiesAreFetchedFromTheHost() {
    ProxyTestHarness harness = new ProxyTestHarness();
    FakeUrlLoaderBackend loaderBackend = new FakeUrlLoaderBackend();
    UrlResponseInfoBackend infoBackend = mock(UrlResponseInfoBackend.class);
    when(infoBackend.getProperty(600, ResponseProperty.STATUS_CODE)).thenReturn("200");
    harness.host.addLocalInterface(UrlLoaderBackend.class, loaderBackend);
    harness.host.addLocalInterface(UrlResponseInfoBackend.class, infoBackend);
    harness.withInstance();
    UrlLoaderProxy loaders = harness.pluginProxy(ApiGroup.URL_LOADER, UrlLoaderProxy.class);
    UrlResponseInfoProxy infos = harness.pluginProxy(ApiGroup.URL_RESPONSE_INFO, UrlResponseInfoProxy.class);

    int loader = loaders.create(INSTANCE);
    loaders.open(loader, UrlRequest.get("http://example.com/"));
    harness.pump();
    loaderBackend.completeOpen(100, ResultCode.OK.getCode());
    harness.pump();
    int info = loaders.getResponseInfo(loader);

    assertThat(infos.getProperty(info, ResponseProperty.STATUS_CODE)).isEqualTo("200");
    assertThat(infos.getProperty(info, ResponseProperty.HEADERS)).isNull();
    assertThat(infos.getProperty(loader, ResponseProperty.URL)).isNull();
  }
}
