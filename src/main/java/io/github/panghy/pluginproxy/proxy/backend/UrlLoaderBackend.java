package io.github.panghy.pluginproxy.proxy.backend;

import java.nio.ByteBuffer;
import java.util.function.IntConsumer;

/**
 * The host's URL loading implementation.
 *
 * <p>Asynchronous methods return a result code. {@code OK_COMPLETIONPENDING} (-1) means
 * the callback will be run later with the final result; any other value is the final
 * result and the callback is never run.</p>
 */
public interface UrlLoaderBackend {

  /**
   * Receives progress updates for every loader of this backend.
   */
  interface StatusCallback {
    void onProgress(int instance, int loader, long bytesSent, long totalBytesToBeSent,
                    long bytesReceived, long totalBytesToBeReceived);
  }

  /**
   * Sets the progress listener. Called once, when the proxy serving this backend is
   * constructed.
   *
   * @param callback The listener
   */
  void setStatusCallback(StatusCallback callback);

  /**
   * Creates a loader.
   *
   * @param instance The owning instance
   * @return The loader resource id, 0 on failure
   */
  int create(int instance);

  int open(int loader, UrlRequest request, IntConsumer callback);

  int followRedirect(int loader, IntConsumer callback);

  /**
   * Gets the response info of a loader whose response headers have arrived. The caller
   * receives a reference to it.
   *
   * @param loader The loader
   * @return The response info resource id, 0 if there is no response yet
   */
  int getResponseInfo(int loader);

  /**
   * Gets how many bytes of response body can be read without waiting.
   *
   * @param loader The loader
   * @return The byte count
   */
  int getAvailableBytes(int loader);

  /**
   * Reads response body into {@code dest}, up to its remaining space.
   *
   * @param loader   The loader
   * @param dest     Where to put the data
   * @param callback Receives the byte count (0 at end of stream) or an error code
   * @return The byte count, an error code, or OK_COMPLETIONPENDING
   */
  int readResponseBody(int loader, ByteBuffer dest, IntConsumer callback);

  int finishStreamingToFile(int loader, IntConsumer callback);

  void close(int loader);
}
