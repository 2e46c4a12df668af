package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.core.ResultFuture;
import io.github.panghy.pluginproxy.resource.PluginResource;
import io.github.panghy.pluginproxy.resource.ResourceTracker;
import io.github.panghy.pluginproxy.resource.WireResourceId;
import io.github.panghy.pluginproxy.transit.ChannelHandle;
import io.github.panghy.pluginproxy.transit.HandleTransit;
import io.github.panghy.pluginproxy.transit.SharedMemoryHandle;

/**
 * Plugin-side state of an audio output: the stream handles the host sent once the
 * stream was set up. The resource owns them and closes them when it goes away.
 */
public final class Audio extends PluginResource {

  private final int sampleRate;
  private final int sampleFrameCount;
  private ResultFuture<Integer> streamReady;
  private ChannelHandle socket;
  private SharedMemoryHandle sharedMemory;
  private boolean playing;

  Audio(WireResourceId wireId, int sampleRate, int sampleFrameCount) {
    super(wireId);
    this.sampleRate = sampleRate;
    this.sampleFrameCount = sampleFrameCount;
  }

  public int getSampleRate() {
    return sampleRate;
  }

  public int getSampleFrameCount() {
    return sampleFrameCount;
  }

  /**
   * Gets the future that completes when the host reports the stream, with OK or an
   * error code.
   *
   * @return The future, null before the resource was registered
   */
  public ResultFuture<Integer> getStreamReady() {
    return streamReady;
  }

  void setStreamReady(ResultFuture<Integer> streamReady) {
    this.streamReady = streamReady;
  }

  public ChannelHandle getSocket() {
    return socket;
  }

  public SharedMemoryHandle getSharedMemory() {
    return sharedMemory;
  }

  void setStream(ChannelHandle socket, SharedMemoryHandle sharedMemory) {
    HandleTransit.closeQuietly(this.socket);
    HandleTransit.closeQuietly(this.sharedMemory);
    this.socket = socket;
    this.sharedMemory = sharedMemory;
  }

  public boolean isPlaying() {
    return playing;
  }

  void setPlaying(boolean playing) {
    this.playing = playing;
  }

  @Override
  protected void lastReferenceReleased(ResourceTracker tracker) {
    setStream(null, null);
    playing = false;
  }
}
