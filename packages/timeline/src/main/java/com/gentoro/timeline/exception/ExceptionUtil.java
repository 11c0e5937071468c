package com.gentoro.timeline.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/** Turns failures into the one-line diagnostics printed by the command line. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Collapse a failure and its causes into {@link ErrorDetails}.
   *
   * <p>Type and code come from the outermost {@link TimelineException} on the cause chain. The
   * context of every timeline exception on the chain is merged, outer entries winning, so an input
   * or output path attached deep inside the tool reaches the report.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t == null) {
      return new ErrorDetails("Unknown", "Unknown error", TimelineErrorCode.UNKNOWN, null, null);
    }
    TimelineException outermost = null;
    Map<String, Object> context = new LinkedHashMap<>();
    Throwable root = t;
    for (Throwable current = t; current != null; current = current.getCause()) {
      if (current instanceof TimelineException ex) {
        if (outermost == null) {
          outermost = ex;
        }
        ex.getContext().forEach(context::putIfAbsent);
      }
      root = current;
    }
    Throwable typed = outermost == null ? t : outermost;
    return new ErrorDetails(
        typed.getClass().getSimpleName(),
        extractErrorMessage(t),
        outermost == null ? TimelineErrorCode.UNKNOWN : outermost.getCode(),
        context,
        origin(root));
  }

  /**
   * Extract a user-facing message from a throwable. The first {@link TimelineException} message
   * found along the cause chain wins; otherwise the top-level message, prefixed with the exception
   * type.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }

    Throwable current = t;
    while (current != null) {
      if (current instanceof TimelineException && StringUtils.isNotBlank(current.getMessage())) {
        String message = current.getMessage().trim();
        Throwable cause = current.getCause();
        if (cause != null && StringUtils.isNotBlank(cause.getMessage())) {
          return message + " (" + cause.getMessage().trim() + ")";
        }
        return message;
      }
      current = current.getCause();
    }

    String className = t.getClass().getSimpleName();
    if (StringUtils.isNotBlank(t.getMessage())) {
      return className + ": " + t.getMessage().trim();
    }
    return className;
  }

  private static String origin(Throwable root) {
    StackTraceElement[] frames = root.getStackTrace();
    return frames == null || frames.length == 0 ? "" : frames[0].toString();
  }
}
