package io.github.panghy.pluginproxy.message;

import io.github.panghy.pluginproxy.error.ProtocolViolationException;
import io.github.panghy.pluginproxy.resource.WireResourceId;
import io.github.panghy.pluginproxy.transit.HandleKind;
import io.github.panghy.pluginproxy.transit.HandleTransitToken;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes parameters written by {@link ParamWriter}.
 *
 * <p>Every read validates what it consumes. A payload from the peer is untrusted, so a
 * truncated buffer, a negative length or an out-of-range enum ordinal raises
 * {@link ProtocolViolationException} instead of an unchecked buffer exception; the
 * dispatcher treats that as a malformed message.</p>
 */
public class ParamReader {

  private final ByteBuffer buffer;

  public ParamReader(ByteBuffer buffer) {
    this.buffer = buffer;
  }

  public int readInt() {
    try {
      return buffer.getInt();
    } catch (BufferUnderflowException e) {
      throw new ProtocolViolationException("Payload truncated reading int", e);
    }
  }

  public long readLong() {
    try {
      return buffer.getLong();
    } catch (BufferUnderflowException e) {
      throw new ProtocolViolationException("Payload truncated reading long", e);
    }
  }

  public boolean readBoolean() {
    try {
      byte value = buffer.get();
      if (value != 0 && value != 1) {
        throw new ProtocolViolationException("Invalid boolean byte: " + value);
      }
      return value == 1;
    } catch (BufferUnderflowException e) {
      throw new ProtocolViolationException("Payload truncated reading boolean", e);
    }
  }

  public String readString() {
    byte[] bytes = readBytes();
    return bytes != null ? new String(bytes, StandardCharsets.UTF_8) : null;
  }

  public byte[] readBytes() {
    int length = readInt();
    if (length == -1) {
      return null;
    }
    if (length < 0 || length > buffer.remaining()) {
      throw new ProtocolViolationException("Invalid byte array length " + length
          + " with " + buffer.remaining() + " bytes remaining");
    }
    byte[] bytes = new byte[length];
    buffer.get(bytes);
    return bytes;
  }

  public List<String> readStringList() {
    int count = readInt();
    if (count < 0 || count > buffer.remaining() / 4) {
      throw new ProtocolViolationException("Invalid list length: " + count);
    }
    List<String> values = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      values.add(readString());
    }
    return values;
  }

  public WireResourceId readResource() {
    int instance = readInt();
    int hostResource = readInt();
    return new WireResourceId(instance, hostResource);
  }

  public HandleTransitToken readToken() {
    long transitId = readLong();
    int kindOrdinal = readInt();
    HandleKind[] kinds = HandleKind.values();
    if (kindOrdinal < 0 || kindOrdinal >= kinds.length) {
      throw new ProtocolViolationException("Unknown handle kind: " + kindOrdinal);
    }
    boolean valid = readBoolean();
    return new HandleTransitToken(transitId, kinds[kindOrdinal], valid);
  }

  /**
   * Gets the number of undecoded bytes.
   *
   * @return The remaining byte count
   */
  public int remaining() {
    return buffer.remaining();
  }
}
