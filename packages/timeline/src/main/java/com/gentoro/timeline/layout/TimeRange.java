package com.gentoro.timeline.layout;

import com.gentoro.timeline.model.TaskRecord;
import java.util.Collection;

/** Closed time interval {@code [start, end]}. */
public record TimeRange(double start, double end) {

  /** {@code [min(start), max(end)]} over {@code tasks}. */
  public static TimeRange covering(Collection<TaskRecord> tasks) {
    if (tasks == null || tasks.isEmpty()) {
      throw new IllegalArgumentException("Cannot compute the time range of an empty task set");
    }
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (TaskRecord t : tasks) {
      min = Math.min(min, t.start());
      max = Math.max(max, t.end());
    }
    return new TimeRange(min, max);
  }

  public double width() {
    return end - start;
  }

  /**
   * This range, or {@code [start, start + epsilon]} when it has no positive width (all tasks
   * share one instant, or every task ends before it starts).
   */
  public TimeRange widenedIfEmpty(double epsilon) {
    return width() > 0 ? this : new TimeRange(start, start + epsilon);
  }
}
