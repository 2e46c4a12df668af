package io.github.panghy.pluginproxy.proxy.backend;

import java.nio.ByteBuffer;
import java.util.function.IntConsumer;

/**
 * The host's 2D drawing surfaces.
 */
public interface Graphics2DBackend {

  /**
   * Creates a surface.
   *
   * @param instance The owning instance
   * @param width    Width in pixels
   * @param height   Height in pixels
   * @param opaque   Whether the surface has no alpha
   * @return The surface resource id, 0 on failure
   */
  int create(int instance, int width, int height, boolean opaque);

  void scroll(int graphics, int dx, int dy);

  /**
   * Replaces the surface contents with an image.
   *
   * @param graphics The surface
   * @param pixels   The image bytes, borrowed for the duration of the call
   * @param width    Image width in pixels
   * @param height   Image height in pixels
   * @return true if the image was accepted
   */
  boolean replaceContents(int graphics, ByteBuffer pixels, int width, int height);

  /**
   * Paints pending changes to the screen.
   *
   * @param graphics The surface
   * @param callback Receives the result once painted
   * @return A result code or OK_COMPLETIONPENDING
   */
  int flush(int graphics, IntConsumer callback);
}
