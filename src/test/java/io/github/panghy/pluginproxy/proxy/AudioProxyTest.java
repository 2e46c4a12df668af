package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.callback.ResultCode;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.message.ParamWriter;
import io.github.panghy.pluginproxy.message.WireMessage;
import io.github.panghy.pluginproxy.proxy.backend.AudioBackend;
import io.github.panghy.pluginproxy.resource.WireResourceId;
import io.github.panghy.pluginproxy.transit.HandleTransit;
import io.github.panghy.pluginproxy.transit.HandleTransitToken;
import io.github.panghy.pluginproxy.transit.ChannelHandle;
import io.github.panghy.pluginproxy.transit.SharedMemoryHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicReference;

import static io.github.panghy.pluginproxy.proxy.ProxyTestHarness.INSTANCE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for AudioProxy, in particular who closes the stream handles on each path.
 */
public class AudioProxyTest {

  @TempDir
  Path tempDir;

  private ProxyTestHarness harness;
  private AudioProxy proxy;
  private AudioBackend backend;
  private final AtomicReference<AudioBackend.StreamCallback> streamCallback = new AtomicReference<>();
  private ChannelHandle socket;
  private SharedMemoryHandle sharedMemory;

  @BeforeEach
  void setUp() throws IOException {
    harness = new ProxyTestHarness().withInstance();
    backend = mock(AudioBackend.class);
    when(backend.create(eq(INSTANCE), eq(44100), eq(512), any())).thenAnswer(invocation -> {
      streamCallback.set(invocation.getArgument(3));
      return 800;
    });
    harness.host.addLocalInterface(AudioBackend.class, backend);
    proxy = harness.pluginProxy(ApiGroup.AUDIO, AudioProxy.class);

    Path file = Files.createFile(tempDir.resolve("stream"));
    socket = ChannelHandle.openFile(file, StandardOpenOption.READ, StandardOpenOption.WRITE);
    sharedMemory = SharedMemoryHandle.allocate(2048);
  }

  @AfterEach
  void tearDown() throws IOException {
    socket.close();
    sharedMemory.close();
  }

  @Test
  void streamHandlesReachTheAudioResource() {
    int audio = proxy.create(INSTANCE, 44100, 512);
    assertNotEquals(0, audio);
    Audio object = harness.tracker().getAs(audio, Audio.class);
    assertFalse(object.getStreamReady().isDone());

    streamCallback.get().onStreamCreated(800, ResultCode.OK.getCode(), socket, sharedMemory);
    harness.pump();

    assertEquals(ResultCode.OK.getCode(), object.getStreamReady().getNow());
    assertEquals(2048, object.getSharedMemory().size());
    assertTrue(object.getSocket().isOpen());
    assertEquals(2, socket.openDescriptorCount());

    harness.tracker().releaseResource(audio);
    assertEquals(1, socket.openDescriptorCount());
    assertEquals(1, sharedMemory.openDescriptorCount());
  }

  @Test
  void pluginClosesHandlesForAnAudioResourceThatIsGone() {
    int audio = proxy.create(INSTANCE, 44100, 512);
    Audio object = harness.tracker().getAs(audio, Audio.class);
    harness.tracker().releaseResource(audio);
    assertEquals(ResultCode.ABORTED.getCode(), object.getStreamReady().getNow());

    streamCallback.get().onStreamCreated(800, ResultCode.OK.getCode(), socket, sharedMemory);
    harness.pump();

    assertEquals(1, socket.openDescriptorCount());
    assertEquals(1, sharedMemory.openDescriptorCount());
    assertEquals(0, harness.channels.host().getHandleExchange().parkedCount());
  }

  @Test
  void hostWithdrawsHandlesWhenTheNotificationCannotBeSent() {
    proxy.create(INSTANCE, 44100, 512);
    harness.channels.host().setRejectSends(true);

    streamCallback.get().onStreamCreated(800, ResultCode.OK.getCode(), socket, sharedMemory);

    assertEquals(1, socket.openDescriptorCount());
    assertEquals(1, sharedMemory.openDescriptorCount());
    assertEquals(0, harness.channels.host().getHandleExchange().parkedCount());
  }

  @Test
  void failedStreamIsReportedWithoutHandles() {
    int audio = proxy.create(INSTANCE, 44100, 512);

    streamCallback.get().onStreamCreated(800, ResultCode.FAILED.getCode(), null, null);
    harness.pump();

    Audio object = harness.tracker().getAs(audio, Audio.class);
    assertEquals(ResultCode.FAILED.getCode(), object.getStreamReady().getNow());
    assertNull(object.getSocket());
  }

  @Test
  void handlesSentWithAFailedStreamAreClosed() {
    int audio = proxy.create(INSTANCE, 44100, 512);
    HandleTransitToken socketToken = HandleTransit.share(socket, harness.channels.host());
    HandleTransitToken memoryToken = HandleTransit.share(sharedMemory, harness.channels.host());
    assertEquals(2, socket.openDescriptorCount());

    harness.channels.host().send(WireMessage.routed(ApiGroup.AUDIO, AudioProxy.NOTIFY_STREAM_CREATED,
        new ParamWriter()
            .writeResource(new WireResourceId(INSTANCE, 800))
            .writeInt(ResultCode.FAILED.getCode())
            .writeToken(socketToken)
            .writeToken(memoryToken)
            .writeInt(sharedMemory.size())));
    harness.pump();

    Audio object = harness.tracker().getAs(audio, Audio.class);
    assertEquals(ResultCode.FAILED.getCode(), object.getStreamReady().getNow());
    assertNull(object.getSocket());
    assertEquals(1, socket.openDescriptorCount());
    assertEquals(1, sharedMemory.openDescriptorCount());
    assertEquals(0, harness.channels.host().getHandleExchange().parkedCount());
  }

  @Test
  void startAndStopAreForwarded() {
    int audio = proxy.create(INSTANCE, 44100, 512);

    assertTrue(proxy.startPlayback(audio));
    assertTrue(harness.tracker().getAs(audio, Audio.class).isPlaying());
    assertTrue(proxy.stopPlayback(audio));
    harness.pump();

    verify(backend).startPlayback(800);
    verify(backend).stopPlayback(800);
    assertFalse(proxy.startPlayback(4711));
  }
}
