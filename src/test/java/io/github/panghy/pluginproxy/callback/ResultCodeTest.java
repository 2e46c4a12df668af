package io.github.panghy.pluginproxy.callback;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for ResultCode.
 */
public class ResultCodeTest {

  @Test
  public void testCodes() {
    assertEquals(0, ResultCode.OK.getCode());
    assertEquals(-1, ResultCode.OK_COMPLETIONPENDING.getCode());
    assertEquals(-3, ResultCode.ABORTED.getCode());
    assertEquals(-11, ResultCode.INPROGRESS.getCode());
  }

  @Test
  public void testFromCode() {
    assertEquals(ResultCode.BADRESOURCE, ResultCode.fromCode(-5));
    // byte counts are successes
    assertEquals(ResultCode.OK, ResultCode.fromCode(1024));
    assertEquals(ResultCode.FAILED, ResultCode.fromCode(-999));
  }
}
