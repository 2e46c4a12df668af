package io.github.panghy.pluginproxy.proxy.backend;

/**
 * What to load.
 *
 * @param url                 The URL
 * @param method              The HTTP method, null for GET
 * @param headers             Extra request headers, CRLF separated, may be null
 * @param followRedirects     Whether redirects are followed without asking the plugin
 * @param recordUploadProgress   Whether upload progress is reported
 * @param recordDownloadProgress Whether download progress is reported
 */
public record UrlRequest(String url, String method, String headers, boolean followRedirects,
                         boolean recordUploadProgress, boolean recordDownloadProgress) {

  /**
   * Creates a plain GET request that follows redirects and records download progress.
   *
   * @param url The URL
   * @return The request
   */
  public static UrlRequest get(String url) {
    return new UrlRequest(url, "GET", null, true, false, true);
  }
}
