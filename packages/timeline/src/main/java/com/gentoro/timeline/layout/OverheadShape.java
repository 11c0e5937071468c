package com.gentoro.timeline.layout;

import com.gentoro.timeline.model.TaskRecord;

/**
 * Inset strip that follows a task for its overhead duration, on the task's row.
 *
 * @param start the parent task's end
 * @param end {@code start + overheadDuration}
 */
public record OverheadShape(
    TaskRecord task,
    String lane,
    int laneIndex,
    int row,
    double x,
    double y,
    double width,
    double height,
    double start,
    double end)
    implements DrawableItem {
  public static final String LABEL_SUFFIX = " (ov)";

  @Override
  public Kind kind() {
    return Kind.OVERHEAD;
  }

  public String label() {
    return task.label() + LABEL_SUFFIX;
  }
}
