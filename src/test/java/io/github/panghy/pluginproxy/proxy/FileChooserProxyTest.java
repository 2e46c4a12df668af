package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.callback.ResultCode;
import io.github.panghy.pluginproxy.core.ResultFuture;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.proxy.backend.ChosenFile;
import io.github.panghy.pluginproxy.proxy.backend.FileChooserBackend;
import io.github.panghy.pluginproxy.proxy.backend.FileChooserMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static io.github.panghy.pluginproxy.proxy.ProxyTestHarness.INSTANCE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for FileChooserProxy and the file references it hands out.
 */
public class FileChooserProxyTest {

  private ProxyTestHarness harness;
  private FileChooserProxy proxy;
  private FileChooserBackend backend;
  private final AtomicReference<FileChooserBackend.ChooseCallback> chooseCallback = new AtomicReference<>();
  private int chooser;

  @BeforeEach
  void setUp() {
    harness = new ProxyTestHarness().withInstance();
    backend = mock(FileChooserBackend.class);
    when(backend.create(INSTANCE, FileChooserMode.OPEN_MULTIPLE, "image/*")).thenReturn(400);
    when(backend.show(eq(400), any())).thenAnswer(invocation -> {
      chooseCallback.set(invocation.getArgument(1));
      return ResultCode.OK_COMPLETIONPENDING.getCode();
    });
    harness.host.addLocalInterface(FileChooserBackend.class, backend);
    proxy = harness.pluginProxy(ApiGroup.FILE_CHOOSER, FileChooserProxy.class);
    chooser = proxy.create(INSTANCE, FileChooserMode.OPEN_MULTIPLE, "image/*");
  }

  private void choose(ChosenFile... files) {
    chooseCallback.get().onChosen(ResultCode.OK.getCode(), List.of(files));
    harness.pump();
  }

  @Test
  void chosenFilesAreHandedOutOneAtATime() {
    ResultFuture<Integer> show = proxy.show(chooser);
    harness.pump();
    assertThat(show.isDone()).isFalse();

    choose(new ChosenFile(401, "/tmp/a.png", "a.png"), new ChosenFile(402, "/tmp/b.png", "b.png"));

    assertThat(show.getNow()).isEqualTo(ResultCode.OK.getCode());
    int first = proxy.getNextChosenFile(chooser);
    int second = proxy.getNextChosenFile(chooser);
    assertThat(proxy.getNextChosenFile(chooser)).isZero();

    FileRef a = harness.tracker().getAs(first, FileRef.class);
    FileRef b = harness.tracker().getAs(second, FileRef.class);
    assertThat(a.getPath()).isEqualTo("/tmp/a.png");
    assertThat(b.getName()).isEqualTo("b.png");
    assertThat(harness.tracker().getRefCount(first)).isEqualTo(1);
  }

  @Test
  void showWhileShowingReportsInProgress() {
    proxy.show(chooser);

    assertThat(proxy.show(chooser).getNow()).isEqualTo(ResultCode.INPROGRESS.getCode());
  }

  @Test
  void pickerThatCannotBeShownFailsTheCall() {
    when(backend.show(eq(400), any())).thenReturn(ResultCode.NOACCESS.getCode());

    ResultFuture<Integer> show = proxy.show(chooser);
    harness.pump();

    assertThat(show.getNow()).isEqualTo(ResultCode.NOACCESS.getCode());
  }

  @Test
  void releasingTheChooserReleasesUncollectedFiles() {
    proxy.show(chooser);
    harness.pump();
    choose(new ChosenFile(401, "/tmp/a", "a"), new ChosenFile(402, "/tmp/b", "b"));
    int taken = proxy.getNextChosenFile(chooser);

    harness.tracker().releaseResource(chooser);
    harness.pump();

    verify(harness.resourceBackend).releaseResource(400);
    verify(harness.resourceBackend).releaseResource(402);
    verify(harness.resourceBackend, never()).releaseResource(401);
    assertThat(harness.tracker().getResourceObject(taken)).isInstanceOf(FileRef.class);
  }

  @Test
  void filesChosenForAGoneChooserAreReturnedToTheHost() {
    ResultFuture<Integer> show = proxy.show(chooser);
    harness.pump();

    harness.tracker().releaseResource(chooser);
    assertThat(show.getNow()).isEqualTo(ResultCode.ABORTED.getCode());

    choose(new ChosenFile(401, "/tmp/a", "a"));

    verify(harness.resourceBackend).releaseResource(400);
    verify(harness.resourceBackend).releaseResource(401);
    assertThat(harness.tracker().size()).isZero();
  }
}
