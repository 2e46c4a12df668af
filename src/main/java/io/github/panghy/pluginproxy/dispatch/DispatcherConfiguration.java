package io.github.panghy.pluginproxy.dispatch;

/**
 * Configuration shared by the dispatchers of one process.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * DispatcherConfiguration config = DispatcherConfiguration.builder()
 *     .badMessagePolicy(BadMessagePolicy.LOG_AND_IGNORE)
 *     .minimumReadRequestSize(32 * 1024)   // prefetch at least 32KB per read
 *     .build();
 *
 * ProxyContext context = new ProxyContext(config);
 * }</pre>
 */
public class DispatcherConfiguration {

  /**
   * Default value just below the first local resource handle. Chosen to be far away
   * from small integers so resource handles are easy to tell apart from other ids in
   * logs.
   */
  public static final int DEFAULT_RESOURCE_HANDLE_BASE = 0x00100000;

  /**
   * Default cap on how much response data the host reads ahead for one read (16MB).
   */
  public static final int DEFAULT_MAX_READ_BUFFER_SIZE = 16 * 1024 * 1024;

  /**
   * Default minimum size of a remote read request (0, read exactly what was asked).
   */
  public static final int DEFAULT_MINIMUM_READ_REQUEST_SIZE = 0;

  /**
   * Default limit on synchronous calls nested inside each other on one dispatcher.
   */
  public static final int DEFAULT_MAX_NESTED_SYNC_DEPTH = 32;

  private final BadMessagePolicy badMessagePolicy;
  private final int resourceHandleBase;
  private final int maxReadBufferSize;
  private final int minimumReadRequestSize;
  private final int maxNestedSyncDepth;

  private DispatcherConfiguration(Builder builder) {
    this.badMessagePolicy = builder.badMessagePolicy;
    this.resourceHandleBase = builder.resourceHandleBase;
    this.maxReadBufferSize = builder.maxReadBufferSize;
    this.minimumReadRequestSize = builder.minimumReadRequestSize;
    this.maxNestedSyncDepth = builder.maxNestedSyncDepth;
  }

  /**
   * Gets what happens when the peer violates the protocol.
   *
   * @return The policy
   */
  public BadMessagePolicy getBadMessagePolicy() {
    return badMessagePolicy;
  }

  /**
   * Gets the value just below the first local resource handle.
   *
   * @return The handle base
   */
  public int getResourceHandleBase() {
    return resourceHandleBase;
  }

  /**
   * Gets the most response data the host reads ahead for one read request.
   *
   * @return The limit in bytes
   */
  public int getMaxReadBufferSize() {
    return maxReadBufferSize;
  }

  /**
   * Gets the smallest read the plugin asks the host for when its buffer cannot satisfy
   * a read. Reads larger than this are requested as-is.
   *
   * @return The minimum request size in bytes
   */
  public int getMinimumReadRequestSize() {
    return minimumReadRequestSize;
  }

  public int getMaxNestedSyncDepth() {
    return maxNestedSyncDepth;
  }

  /**
   * Creates a new builder.
   *
   * @return A new builder instance
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a configuration with every setting at its default.
   *
   * @return A default configuration
   */
  public static DispatcherConfiguration defaultConfig() {
    return builder().build();
  }

  /**
   * Builder for DispatcherConfiguration.
   */
  public static class Builder {
    private BadMessagePolicy badMessagePolicy = BadMessagePolicy.TERMINATE_CHANNEL;
    private int resourceHandleBase = DEFAULT_RESOURCE_HANDLE_BASE;
    private int maxReadBufferSize = DEFAULT_MAX_READ_BUFFER_SIZE;
    private int minimumReadRequestSize = DEFAULT_MINIMUM_READ_REQUEST_SIZE;
    private int maxNestedSyncDepth = DEFAULT_MAX_NESTED_SYNC_DEPTH;

    private Builder() {
    }

    /**
     * Sets what happens when the peer violates the protocol.
     *
     * @param policy The policy
     * @return This builder for chaining
     * @throws IllegalArgumentException if policy is null
     */
    public Builder badMessagePolicy(BadMessagePolicy policy) {
      if (policy == null) {
        throw new IllegalArgumentException("Bad message policy must not be null");
      }
      this.badMessagePolicy = policy;
      return this;
    }

    /**
     * Sets the value just below the first local resource handle.
     *
     * @param base The handle base (must be non-negative)
     * @return This builder for chaining
     * @throws IllegalArgumentException if base is negative
     */
    public Builder resourceHandleBase(int base) {
      if (base < 0) {
        throw new IllegalArgumentException("Resource handle base must be non-negative, got: " + base);
      }
      this.resourceHandleBase = base;
      return this;
    }

    /**
     * Sets the most response data the host reads ahead for one read request.
     *
     * @param size The limit in bytes (must be positive)
     * @return This builder for chaining
     * @throws IllegalArgumentException if size is not positive
     */
    public Builder maxReadBufferSize(int size) {
      if (size <= 0) {
        throw new IllegalArgumentException("Max read buffer size must be positive, got: " + size);
      }
      this.maxReadBufferSize = size;
      return this;
    }

    /**
     * Sets the smallest remote read request.
     *
     * @param size The size in bytes (must be non-negative, 0 to read exactly what was asked)
     * @return This builder for chaining
     * @throws IllegalArgumentException if size is negative
     */
    public Builder minimumReadRequestSize(int size) {
      if (size < 0) {
        throw new IllegalArgumentException("Minimum read request size must be non-negative, got: " + size);
      }
      this.minimumReadRequestSize = size;
      return this;
    }

    /**
     * Sets how deeply synchronous calls may nest on one dispatcher.
     *
     * @param depth The depth (must be positive)
     * @return This builder for chaining
     * @throws IllegalArgumentException if depth is not positive
     */
    public Builder maxNestedSyncDepth(int depth) {
      if (depth <= 0) {
        throw new IllegalArgumentException("Max nested sync depth must be positive, got: " + depth);
      }
      this.maxNestedSyncDepth = depth;
      return this;
    }

    /**
     * Builds the configuration with the specified settings.
     *
     * @return A new DispatcherConfiguration instance
     */
    public DispatcherConfiguration build() {
      return new DispatcherConfiguration(this);
    }
  }
}
