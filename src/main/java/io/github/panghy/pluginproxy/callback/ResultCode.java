package io.github.panghy.pluginproxy.callback;

/**
 * Result codes delivered to callers of capability operations. Non-negative values are
 * success (some operations report a byte count); negative values are failures.
 */
public enum ResultCode {
  OK(0),
  /**
   * The operation will complete later through its callback.
   */
  OK_COMPLETIONPENDING(-1),
  FAILED(-2),
  /**
   * The operation was cancelled because its resource or channel went away.
   */
  ABORTED(-3),
  BADARGUMENT(-4),
  BADRESOURCE(-5),
  NOINTERFACE(-6),
  NOACCESS(-7),
  /**
   * Another operation of the same kind is still in flight on the resource.
   */
  INPROGRESS(-11);

  private final int code;

  ResultCode(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  /**
   * Maps a numeric result to a code. Positive values are byte counts and map to OK.
   *
   * @param code The numeric result
   * @return The matching code, FAILED for an unknown negative value
   */
  public static ResultCode fromCode(int code) {
    if (code >= 0) {
      return OK;
    }
    for (ResultCode resultCode : values()) {
      if (resultCode.code == code) {
        return resultCode;
      }
    }
    return FAILED;
  }
}
