package com.gentoro.timeline.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception for the timeline tool.
 *
 * <p>Every exception carries a {@link TimelineErrorCode} and an optional, ordered context map
 * (for instance the input path or the output file) that ends up in {@link ErrorDetails}.
 */
public class TimelineException extends RuntimeException {
  private final TimelineErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public TimelineException(TimelineErrorCode code, String message) {
    super(message);
    this.code = code == null ? TimelineErrorCode.UNKNOWN : code;
  }

  public TimelineException(TimelineErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? TimelineErrorCode.UNKNOWN : code;
  }

  public TimelineErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry and return this exception for fluent throwing. */
  public TimelineException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
