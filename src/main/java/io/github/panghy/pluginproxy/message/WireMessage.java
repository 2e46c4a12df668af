package io.github.panghy.pluginproxy.message;

import io.github.panghy.pluginproxy.error.ProtocolViolationException;

import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * A complete message exchanged between the two dispatchers of a channel: a
 * {@link MessageHeader} followed by a payload encoded with {@link ParamWriter}.
 *
 * <p>Messages are immutable once built. {@link #getPayload()} and {@link #reader()}
 * hand out independent views so a handler cannot disturb another reader of the same
 * message.</p>
 */
public class WireMessage {

  private static final ByteBuffer EMPTY = ByteBuffer.allocate(0);

  private final MessageHeader header;
  private final ByteBuffer payload;

  /**
   * Creates a message from a header and payload. The header's payload length must
   * match the payload.
   *
   * @param header  The header
   * @param payload The payload, may be null for an empty payload
   */
  public WireMessage(MessageHeader header, ByteBuffer payload) {
    this.header = header;
    this.payload = payload != null ? payload.asReadOnlyBuffer() : EMPTY;
    if (header.getPayloadLength() != this.payload.remaining()) {
      throw new IllegalArgumentException("Header declares " + header.getPayloadLength()
          + " payload bytes but payload has " + this.payload.remaining());
    }
  }

  /**
   * Builds a one-way message.
   *
   * @param group  The target group
   * @param kind   The message kind within the group
   * @param params The encoded parameters, may be null
   * @return The message
   */
  public static WireMessage routed(ApiGroup group, int kind, ParamWriter params) {
    return build(MessageHeader.MessageType.ROUTED, null, group.getId(), kind, params);
  }

  /**
   * Builds a synchronous call with a fresh round-trip id.
   *
   * @param group  The target group
   * @param kind   The message kind within the group
   * @param params The encoded parameters, may be null
   * @return The message
   */
  public static WireMessage syncCall(ApiGroup group, int kind, ParamWriter params) {
    return build(MessageHeader.MessageType.SYNC_CALL, UUID.randomUUID(), group.getId(), kind, params);
  }

  /**
   * Builds the reply to a synchronous call.
   *
   * @param call   The call being answered
   * @param output The handler output, may be null
   * @return The reply
   */
  public static WireMessage syncReply(WireMessage call, ParamWriter output) {
    MessageHeader callHeader = call.getHeader();
    return build(MessageHeader.MessageType.SYNC_REPLY, callHeader.getMessageId(),
        callHeader.getApiGroupId(), callHeader.getMessageKind(), output);
  }

  /**
   * Builds the reply telling the caller that its synchronous call could not be served.
   *
   * @param call The call being answered
   * @return The reply
   */
  public static WireMessage syncReplyFailed(WireMessage call) {
    MessageHeader callHeader = call.getHeader();
    return build(MessageHeader.MessageType.SYNC_REPLY_FAILED, callHeader.getMessageId(),
        callHeader.getApiGroupId(), callHeader.getMessageKind(), null);
  }

  private static WireMessage build(MessageHeader.MessageType type, UUID messageId, int groupId, int kind,
                                   ParamWriter params) {
    ByteBuffer payload = params != null ? params.toByteBuffer() : EMPTY;
    return new WireMessage(new MessageHeader(type, messageId, groupId, kind, payload.remaining()), payload);
  }

  public MessageHeader getHeader() {
    return header;
  }

  /**
   * Gets the message kind. Shorthand for {@code getHeader().getMessageKind()}.
   *
   * @return The message kind
   */
  public int getKind() {
    return header.getMessageKind();
  }

  /**
   * Gets a read-only view of the payload.
   *
   * @return The payload
   */
  public ByteBuffer getPayload() {
    return payload.duplicate();
  }

  /**
   * Opens a decoder positioned at the start of the payload.
   *
   * @return A fresh reader
   */
  public ParamReader reader() {
    return new ParamReader(payload.duplicate());
  }

  /**
   * Serializes the whole message.
   *
   * @return A flipped buffer holding header and payload
   */
  public ByteBuffer serialize() {
    ByteBuffer buffer = ByteBuffer.allocate(MessageHeader.SIZE + payload.remaining());
    buffer.put(header.serialize());
    buffer.put(payload.duplicate());
    buffer.flip();
    return buffer;
  }

  /**
   * Decodes a message.
   *
   * @param buffer The buffer positioned at the start of a message
   * @return The message
   * @throws ProtocolViolationException if the buffer does not hold a complete message
   */
  public static WireMessage deserialize(ByteBuffer buffer) {
    MessageHeader header = MessageHeader.deserialize(buffer);
    if (buffer.remaining() < header.getPayloadLength()) {
      throw new ProtocolViolationException("Payload truncated: expected " + header.getPayloadLength()
          + " bytes, found " + buffer.remaining());
    }
    byte[] bytes = new byte[header.getPayloadLength()];
    buffer.get(bytes);
    return new WireMessage(header, ByteBuffer.wrap(bytes));
  }

  @Override
  public String toString() {
    return "WireMessage{" +
        "header=" + header +
        '}';
  }
}
