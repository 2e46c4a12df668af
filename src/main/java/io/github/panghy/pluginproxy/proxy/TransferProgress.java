package io.github.panghy.pluginproxy.proxy;

/**
 * Bytes transferred so far and the expected total.
 *
 * @param bytes The bytes transferred
 * @param total The expected total, -1 if unknown
 */
public record TransferProgress(long bytes, long total) {

  /**
   * Progress that was never reported.
   */
  public static final TransferProgress UNKNOWN = new TransferProgress(0, -1);

  public boolean isKnown() {
    return total >= 0;
  }
}
