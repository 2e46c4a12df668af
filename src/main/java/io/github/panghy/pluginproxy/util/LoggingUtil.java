package io.github.panghy.pluginproxy.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logging helpers used throughout the proxy layer.
 *
 * <p>All output goes through {@code java.util.logging}. The helpers check the level
 * first so that callers can build messages by string concatenation without paying
 * for it when the level is disabled, and they attribute each record to the real
 * calling class and method rather than to this utility.</p>
 */
public final class LoggingUtil {

  private static final String SELF = LoggingUtil.class.getName();

  private LoggingUtil() {
  }

  public static void debug(Logger logger, String message) {
    log(logger, Level.FINE, message, null);
  }

  public static void debug(Logger logger, String message, Throwable throwable) {
    log(logger, Level.FINE, message, throwable);
  }

  public static void info(Logger logger, String message) {
    log(logger, Level.INFO, message, null);
  }

  public static void warn(Logger logger, String message) {
    log(logger, Level.WARNING, message, null);
  }

  public static void warn(Logger logger, String message, Throwable throwable) {
    log(logger, Level.WARNING, message, throwable);
  }

  public static void error(Logger logger, String message) {
    log(logger, Level.SEVERE, message, null);
  }

  public static void error(Logger logger, String message, Throwable throwable) {
    log(logger, Level.SEVERE, message, throwable);
  }

  private static void log(Logger logger, Level level, String message, Throwable throwable) {
    if (!logger.isLoggable(level)) {
      return;
    }
    StackTraceElement caller = findCaller();
    String className = caller != null ? caller.getClassName() : logger.getName();
    String methodName = caller != null ? caller.getMethodName() : null;
    if (throwable == null) {
      logger.logp(level, className, methodName, message);
    } else {
      logger.logp(level, className, methodName, message, throwable);
    }
  }

  /**
   * Walks the current stack past the frames belonging to this class.
   */
  private static StackTraceElement findCaller() {
    StackTraceElement[] stack = new Throwable().getStackTrace();
    for (StackTraceElement element : stack) {
      if (!element.getClassName().equals(SELF)) {
        return element;
      }
    }
    return null;
  }
}
