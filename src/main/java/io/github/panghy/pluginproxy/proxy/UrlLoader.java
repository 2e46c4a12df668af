package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.resource.PluginResource;
import io.github.panghy.pluginproxy.resource.ResourceTracker;
import io.github.panghy.pluginproxy.resource.WireResourceId;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Plugin-side state of a URL loader: response body the host pushed ahead of the
 * plugin's reads, the read waiting for more data, the cached response info and the
 * last progress the host reported.
 */
public final class UrlLoader extends PluginResource {

  private byte[] buffer = new byte[0];
  private int buffered;

  private ByteBuffer readDest;
  private int readSize;

  private int responseInfo;

  private TransferProgress uploadProgress = TransferProgress.UNKNOWN;
  private TransferProgress downloadProgress = TransferProgress.UNKNOWN;

  UrlLoader(WireResourceId wireId) {
    super(wireId);
  }

  /**
   * Gets how many response bytes are waiting to be read.
   *
   * @return The byte count
   */
  public int bufferedBytes() {
    return buffered;
  }

  void appendToBuffer(byte[] data) {
    if (data.length == 0) {
      return;
    }
    if (buffered + data.length > buffer.length) {
      buffer = Arrays.copyOf(buffer, Math.max(buffered + data.length, buffer.length * 2));
    }
    System.arraycopy(data, 0, buffer, buffered, data.length);
    buffered += data.length;
  }

  /**
   * Moves up to {@code max} bytes from the front of the buffer into {@code dest}.
   *
   * @return The number of bytes moved
   */
  int takeFromBuffer(ByteBuffer dest, int max) {
    int count = Math.min(Math.min(max, buffered), dest.remaining());
    dest.put(buffer, 0, count);
    System.arraycopy(buffer, count, buffer, 0, buffered - count);
    buffered -= count;
    return count;
  }

  boolean hasPendingRead() {
    return readDest != null;
  }

  void setPendingRead(ByteBuffer dest, int size) {
    this.readDest = dest;
    this.readSize = size;
  }

  /**
   * Finishes the pending read with the result the host reported.
   *
   * @param result Bytes read by the host, or an error code
   * @return What the plugin's read completes with
   */
  int finishPendingRead(int result) {
    ByteBuffer dest = readDest;
    int size = readSize;
    readDest = null;
    readSize = 0;
    if (result < 0 || dest == null) {
      return result;
    }
    return takeFromBuffer(dest, size);
  }

  int getResponseInfo() {
    return responseInfo;
  }

  void setResponseInfo(int responseInfo) {
    this.responseInfo = responseInfo;
  }

  public TransferProgress getUploadProgress() {
    return uploadProgress;
  }

  public TransferProgress getDownloadProgress() {
    return downloadProgress;
  }

  void setProgress(TransferProgress upload, TransferProgress download) {
    this.uploadProgress = upload;
    this.downloadProgress = download;
  }

  @Override
  protected void lastReferenceReleased(ResourceTracker tracker) {
    if (responseInfo != 0) {
      tracker.releaseResource(responseInfo);
      responseInfo = 0;
    }
    buffered = 0;
  }
}
