package io.github.panghy.pluginproxy.proxy.backend;

import io.github.panghy.pluginproxy.transit.ChannelHandle;
import io.github.panghy.pluginproxy.transit.SharedMemoryHandle;

/**
 * The host's audio output.
 */
public interface AudioBackend {

  /**
   * Told when the stream behind an audio resource is ready.
   */
  interface StreamCallback {
    /**
     * @param audio        The audio resource
     * @param result       OK or an error code
     * @param socket       Sync socket the plugin writes to, still owned by the backend;
     *                     null on failure
     * @param sharedMemory The sample buffer, still owned by the backend; null on failure
     */
    void onStreamCreated(int audio, int result, ChannelHandle socket, SharedMemoryHandle sharedMemory);
  }

  /**
   * Creates an audio output. The stream is set up in the background and reported
   * through the callback.
   *
   * @param instance         The owning instance
   * @param sampleRate       Samples per second
   * @param sampleFrameCount Frames per buffer
   * @param callback         Told when the stream is ready; must not run before this
   *                         method has returned
   * @return The audio resource id, 0 on failure
   */
  int create(int instance, int sampleRate, int sampleFrameCount, StreamCallback callback);

  boolean startPlayback(int audio);

  boolean stopPlayback(int audio);
}
