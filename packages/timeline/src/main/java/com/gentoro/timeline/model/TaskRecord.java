package com.gentoro.timeline.model;

import java.util.List;
import java.util.Objects;

/**
 * One timed task read from the trace.
 *
 * <p>Records are immutable. Layout results (row, color, coordinates) are carried by the layout
 * types that reference a record, never written back into it.
 *
 * @param start start timestamp, same unit as every other record
 * @param end end timestamp; {@code end < start} is accepted and renders as a degenerate task
 * @param lane lane (thread) identifier
 * @param name raw name template as read from the input
 * @param label name with its placeholders substituted
 * @param args auxiliary arguments, never null
 * @param overheadDuration non-negative overhead following {@code end}, or null
 * @param explicitColor explicit color code in {@code 0..0xFFFFFFFF}, or null
 * @param sequenceIndex position in the input, used as a stable tie-break and color fallback key
 * @param lineNumber 1-based source line
 */
public record TaskRecord(
    double start,
    double end,
    String lane,
    String name,
    String label,
    List<String> args,
    Double overheadDuration,
    Long explicitColor,
    int sequenceIndex,
    int lineNumber) {

  public TaskRecord {
    lane = Objects.requireNonNullElse(lane, "");
    name = Objects.requireNonNullElse(name, "");
    label = Objects.requireNonNullElse(label, name);
    args = args == null ? List.of() : List.copyOf(args);
  }

  /** Convenience factory for records without arguments, overhead or color. */
  public static TaskRecord of(
      double start, double end, String lane, String label, int sequenceIndex) {
    return new TaskRecord(
        start, end, lane, label, label, List.of(), null, null, sequenceIndex, sequenceIndex + 1);
  }

  public boolean hasExplicitColor() {
    return explicitColor != null;
  }

  public boolean hasOverhead() {
    return overheadDuration != null && overheadDuration > 0;
  }

  /** Two tasks overlap when they share a span of positive length. */
  public boolean overlaps(TaskRecord other) {
    return start < other.end && other.start < end;
  }
}
