package io.github.panghy.pluginproxy.message;

import io.github.panghy.pluginproxy.error.ProtocolViolationException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * Header of a wire message.
 *
 * <p>The header carries everything needed to route a message without looking at its
 * payload: the API group it is addressed to, the message kind the target proxy uses to
 * select a handler, and, for synchronous round trips, the id that pairs a reply with
 * the call waiting for it.</p>
 *
 * <p>Layout:</p>
 * <pre>
 * +------+------------+-----------+--------------+----------------+
 * | type | message id | api group | message kind | payload length |
 * | 1 B  | 16 B       | 4 B       | 4 B          | 4 B            |
 * +------+------------+-----------+--------------+----------------+
 * </pre>
 */
public class MessageHeader {

  /**
   * Serialized size of a header in bytes.
   */
  public static final int SIZE = 1 + 16 + 4 + 4 + 4;

  /**
   * How a message takes part in a round trip.
   */
  public enum MessageType {
    /**
     * A one-way message; any answer arrives later as a separate routed message.
     */
    ROUTED(1),

    /**
     * A call whose sender is blocked until the matching reply arrives.
     */
    SYNC_CALL(2),

    /**
     * The reply to a {@link #SYNC_CALL}, carrying the handler's output.
     */
    SYNC_REPLY(3),

    /**
     * The reply to a {@link #SYNC_CALL} whose handler was missing or failed.
     */
    SYNC_REPLY_FAILED(4);

    private final int code;

    MessageType(int code) {
      this.code = code;
    }

    public int getCode() {
      return code;
    }

    public static MessageType fromCode(int code) {
      for (MessageType type : values()) {
        if (type.code == code) {
          return type;
        }
      }
      throw new ProtocolViolationException("Unknown message type code: " + code);
    }
  }

  private final MessageType type;
  private final UUID messageId;
  private final int apiGroupId;
  private final int messageKind;
  private final int payloadLength;

  /**
   * Creates a header.
   *
   * @param type          The message type
   * @param messageId     The round-trip id, null for routed messages
   * @param apiGroupId    The raw API group id
   * @param messageKind   The proxy-specific message kind
   * @param payloadLength The payload length in bytes
   */
  public MessageHeader(MessageType type, UUID messageId, int apiGroupId, int messageKind, int payloadLength) {
    this.type = type;
    this.messageId = messageId;
    this.apiGroupId = apiGroupId;
    this.messageKind = messageKind;
    this.payloadLength = payloadLength;
  }

  public MessageType getType() {
    return type;
  }

  public UUID getMessageId() {
    return messageId;
  }

  /**
   * Gets the raw group id. It is deliberately not resolved to an {@link ApiGroup} here
   * so that a message naming an unknown group can still be decoded and rejected by the
   * dispatcher.
   *
   * @return The group id as sent
   */
  public int getApiGroupId() {
    return apiGroupId;
  }

  public int getMessageKind() {
    return messageKind;
  }

  public int getPayloadLength() {
    return payloadLength;
  }

  /**
   * Serializes this header.
   *
   * @return A flipped buffer holding the header bytes
   */
  public ByteBuffer serialize() {
    ByteBuffer buffer = ByteBuffer.allocate(SIZE);
    buffer.put((byte) type.getCode());
    if (messageId != null) {
      buffer.putLong(messageId.getMostSignificantBits());
      buffer.putLong(messageId.getLeastSignificantBits());
    } else {
      buffer.putLong(0);
      buffer.putLong(0);
    }
    buffer.putInt(apiGroupId);
    buffer.putInt(messageKind);
    buffer.putInt(payloadLength);
    buffer.flip();
    return buffer;
  }

  /**
   * Reads a header from the buffer's current position.
   *
   * @param buffer The buffer
   * @return The header
   * @throws ProtocolViolationException if the buffer is truncated or malformed
   */
  public static MessageHeader deserialize(ByteBuffer buffer) {
    try {
      MessageType type = MessageType.fromCode(buffer.get());
      long mostSigBits = buffer.getLong();
      long leastSigBits = buffer.getLong();
      UUID messageId = (mostSigBits != 0 || leastSigBits != 0)
          ? new UUID(mostSigBits, leastSigBits)
          : null;
      int apiGroupId = buffer.getInt();
      int messageKind = buffer.getInt();
      int payloadLength = buffer.getInt();
      if (payloadLength < 0) {
        throw new ProtocolViolationException("Negative payload length: " + payloadLength);
      }
      return new MessageHeader(type, messageId, apiGroupId, messageKind, payloadLength);
    } catch (BufferUnderflowException e) {
      throw new ProtocolViolationException("Truncated message header", e);
    }
  }

  @Override
  public String toString() {
    return "MessageHeader{" +
        "type=" + type +
        ", messageId=" + messageId +
        ", apiGroupId=" + apiGroupId +
        ", messageKind=" + messageKind +
        ", payloadLength=" + payloadLength +
        '}';
  }
}
