package io.github.panghy.pluginproxy.message;

import io.github.panghy.pluginproxy.resource.WireResourceId;
import io.github.panghy.pluginproxy.transit.HandleTransitToken;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Encodes message parameters into a payload.
 *
 * <p>Values are written big-endian in call order with no field tags; the matching
 * {@link ParamReader} must read them back in the same order. Strings and byte arrays
 * are length-prefixed, with a length of {@code -1} standing for null.</p>
 *
 * <pre>{@code
 * ParamWriter params = new ParamWriter()
 *     .writeResource(loader.getWireId())
 *     .writeInt(bytesToRead);
 * dispatcher.send(WireMessage.routed(ApiGroup.URL_LOADER, MSG_READ_RESPONSE_BODY, params));
 * }</pre>
 */
public class ParamWriter {

  private static final int INITIAL_CAPACITY = 64;

  private ByteBuffer buffer = ByteBuffer.allocate(INITIAL_CAPACITY);

  public ParamWriter writeInt(int value) {
    ensureCapacity(4);
    buffer.putInt(value);
    return this;
  }

  public ParamWriter writeLong(long value) {
    ensureCapacity(8);
    buffer.putLong(value);
    return this;
  }

  public ParamWriter writeBoolean(boolean value) {
    ensureCapacity(1);
    buffer.put(value ? (byte) 1 : (byte) 0);
    return this;
  }

  public ParamWriter writeString(String value) {
    if (value == null) {
      return writeInt(-1);
    }
    return writeBytes(value.getBytes(StandardCharsets.UTF_8));
  }

  public ParamWriter writeBytes(byte[] value) {
    if (value == null) {
      return writeInt(-1);
    }
    writeInt(value.length);
    ensureCapacity(value.length);
    buffer.put(value);
    return this;
  }

  /**
   * Writes the remaining bytes of a buffer without moving its position.
   *
   * @param value The bytes to write
   * @return This writer
   */
  public ParamWriter writeBytes(ByteBuffer value) {
    ByteBuffer view = value.duplicate();
    writeInt(view.remaining());
    ensureCapacity(view.remaining());
    buffer.put(view);
    return this;
  }

  public ParamWriter writeStringList(List<String> values) {
    writeInt(values.size());
    for (String value : values) {
      writeString(value);
    }
    return this;
  }

  public ParamWriter writeResource(WireResourceId id) {
    writeInt(id.instance());
    writeInt(id.hostResource());
    return this;
  }

  public ParamWriter writeToken(HandleTransitToken token) {
    writeLong(token.transitId());
    writeInt(token.kind().ordinal());
    writeBoolean(token.valid());
    return this;
  }

  /**
   * Returns the encoded bytes. The writer can keep being used afterwards; the returned
   * buffer is a snapshot.
   *
   * @return A flipped buffer with the encoded parameters
   */
  public ByteBuffer toByteBuffer() {
    ByteBuffer copy = ByteBuffer.allocate(buffer.position());
    ByteBuffer source = buffer.duplicate();
    source.flip();
    copy.put(source);
    copy.flip();
    return copy;
  }

  private void ensureCapacity(int extra) {
    if (buffer.remaining() >= extra) {
      return;
    }
    int needed = buffer.position() + extra;
    int capacity = buffer.capacity();
    while (capacity < needed) {
      capacity *= 2;
    }
    ByteBuffer grown = ByteBuffer.allocate(capacity);
    buffer.flip();
    grown.put(buffer);
    buffer = grown;
  }
}
