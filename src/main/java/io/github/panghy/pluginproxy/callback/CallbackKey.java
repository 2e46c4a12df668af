package io.github.panghy.pluginproxy.callback;

import io.github.panghy.pluginproxy.resource.WireResourceId;

/**
 * Correlates a reply with the operation that is waiting for it.
 *
 * @param resource  The resource the operation targets
 * @param operation The operation kind, scoped to the capability
 * @param sequence  Distinguishes concurrent requests of the same kind on one resource;
 *                  0 for operations that allow a single request in flight
 */
public record CallbackKey(WireResourceId resource, int operation, long sequence) {

  /**
   * Creates the key of an operation that has at most one request in flight per resource.
   *
   * @param resource  The target resource
   * @param operation The operation kind
   * @return The key
   */
  public static CallbackKey single(WireResourceId resource, int operation) {
    return new CallbackKey(resource, operation, 0);
  }
}
