package io.github.panghy.pluginproxy.transit;

import java.io.IOException;
import java.nio.channels.ByteChannel;
import java.nio.channels.FileChannel;
import java.nio.file.OpenOption;
import java.nio.file.Path;

/**
 * A file or socket descriptor backed by a {@link ByteChannel}.
 *
 * <p>The channel is closed when the last duplicate is closed.</p>
 */
public final class ChannelHandle extends AbstractTransitHandle<ByteChannel> {

  private final HandleKind kind;

  private ChannelHandle(HandleKind kind, Underlying<ByteChannel> underlying) {
    super(underlying);
    this.kind = kind;
  }

  /**
   * Wraps an open file.
   *
   * @param channel The file channel, ownership passes to the handle
   * @return The handle
   */
  public static ChannelHandle forFile(FileChannel channel) {
    return new ChannelHandle(HandleKind.FILE, new Underlying<>(channel));
  }

  /**
   * Opens a file and wraps it.
   *
   * @param path    The file path
   * @param options How to open it
   * @return The handle
   * @throws IOException if the file cannot be opened
   */
  public static ChannelHandle openFile(Path path, OpenOption... options) throws IOException {
    return forFile(FileChannel.open(path, options));
  }

  /**
   * Wraps one end of a socket-like connection.
   *
   * @param channel The connected channel, ownership passes to the handle
   * @return The handle
   */
  public static ChannelHandle forSocket(ByteChannel channel) {
    return new ChannelHandle(HandleKind.SOCKET, new Underlying<>(channel));
  }

  @Override
  public HandleKind kind() {
    return kind;
  }

  /**
   * Gets the channel for I/O through this descriptor.
   *
   * @return The underlying channel
   * @throws IOException if this descriptor was closed
   */
  public ByteChannel channel() throws IOException {
    ensureOpen();
    return underlying.object;
  }

  @Override
  TransitHandle newDescriptor(Underlying<ByteChannel> underlying) {
    return new ChannelHandle(kind, underlying);
  }

  @Override
  void releaseUnderlying(ByteChannel object) throws IOException {
    object.close();
  }

  @Override
  public String toString() {
    return "ChannelHandle[" + kind + (isOpen() ? "" : ", closed") + "]";
  }
}
