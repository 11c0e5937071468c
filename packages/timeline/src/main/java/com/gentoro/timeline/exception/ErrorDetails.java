package com.gentoro.timeline.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Structured view of a failure as reported on the command line.
 *
 * @param origin first stack frame of the root cause, empty when unknown
 */
public record ErrorDetails(
    String type,
    String message,
    TimelineErrorCode code,
    Map<String, Object> context,
    String origin) {

  public ErrorDetails {
    context =
        context == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    origin = origin == null ? "" : origin;
  }

  /** The message followed by the context entries, e.g. {@code Failed to write [output=a.html]}. */
  public String summary() {
    if (context.isEmpty()) {
      return message;
    }
    return context.entrySet().stream()
        .map(e -> e.getKey() + "=" + e.getValue())
        .collect(Collectors.joining(", ", message + " [", "]"));
  }
}
