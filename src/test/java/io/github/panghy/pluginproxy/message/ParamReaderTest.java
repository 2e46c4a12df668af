package io.github.panghy.pluginproxy.message;

import io.github.panghy.pluginproxy.error.ProtocolViolationException;
import io.github.panghy.pluginproxy.resource.WireResourceId;
import io.github.panghy.pluginproxy.transit.HandleKind;
import io.github.panghy.pluginproxy.transit.HandleTransitToken;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the parameter codec.
 */
public class ParamReaderTest {

  @Test
  public void testValuesReadBackInOrder() {
    HandleTransitToken token = new HandleTransitToken(77L, HandleKind.SHARED_MEMORY, true);
    ParamWriter writer = new ParamWriter()
        .writeResource(new WireResourceId(4, 400))
        .writeString(null)
        .writeStringList(Arrays.asList("a", null, "ünïcode"))
        .writeToken(token)
        .writeBytes(ByteBuffer.wrap(new byte[]{1, 2, 3}))
        .writeBoolean(false);

    ParamReader reader = new ParamReader(writer.toByteBuffer());

    assertThat(reader.readResource()).isEqualTo(new WireResourceId(4, 400));
    assertThat(reader.readString()).isNull();
    assertThat(reader.readStringList()).containsExactly("a", null, "ünïcode");
    assertThat(reader.readToken()).isEqualTo(token);
    assertThat(reader.readBytes()).containsExactly(1, 2, 3);
    assertThat(reader.readBoolean()).isFalse();
    assertThat(reader.remaining()).isZero();
  }

  @Test
  public void testWriterGrowsPastInitialCapacity() {
    byte[] large = new byte[1000];
    large[999] = 9;
    ParamReader reader = new ParamReader(new ParamWriter().writeInt(1).writeBytes(large).toByteBuffer());
    assertThat(reader.readInt()).isEqualTo(1);
    assertThat(reader.readBytes()[999]).isEqualTo((byte) 9);
  }

  @Test
  public void testTruncatedPayload() {
    ParamReader reader = new ParamReader(ByteBuffer.allocate(2));
    assertThatThrownBy(reader::readInt).isInstanceOf(ProtocolViolationException.class);
    assertThatThrownBy(() -> new ParamReader(ByteBuffer.allocate(0)).readLong())
        .isInstanceOf(ProtocolViolationException.class);
  }

  @Test
  public void testLengthsAreValidated() {
    ByteBuffer tooLong = new ParamWriter().writeInt(50).writeInt(0).toByteBuffer();
    assertThatThrownBy(() -> new ParamReader(tooLong).readBytes())
        .isInstanceOf(ProtocolViolationException.class);

    ByteBuffer negative = new ParamWriter().writeInt(-7).toByteBuffer();
    assertThatThrownBy(() -> new ParamReader(negative).readString())
        .isInstanceOf(ProtocolViolationException.class);

    ByteBuffer hugeList = new ParamWriter().writeInt(1_000_000).toByteBuffer();
    assertThatThrownBy(() -> new ParamReader(hugeList).readStringList())
        .isInstanceOf(ProtocolViolationException.class);
  }

  @Test
  public void testInvalidEnumsAndBooleans() {
    ByteBuffer badBoolean = ByteBuffer.wrap(new byte[]{2});
    assertThatThrownBy(() -> new ParamReader(badBoolean).readBoolean())
        .isInstanceOf(ProtocolViolationException.class);

    ByteBuffer badKind = new ParamWriter().writeLong(1).writeInt(HandleKind.values().length).writeBoolean(true)
        .toByteBuffer();
    assertThatThrownBy(() -> new ParamReader(badKind).readToken())
        .isInstanceOf(ProtocolViolationException.class);
  }

  @Test
  public void testEmptyList() {
    ParamReader reader = new ParamReader(new ParamWriter().writeStringList(List.of()).toByteBuffer());
    assertThat(reader.readStringList()).isEmpty();
  }
}
