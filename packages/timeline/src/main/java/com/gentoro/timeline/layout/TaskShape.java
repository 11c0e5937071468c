package com.gentoro.timeline.layout;

import com.gentoro.timeline.model.TaskRecord;

/**
 * Rectangle of one packed task.
 *
 * @param row lane-local row
 * @param globalRow row counted across all lanes rendered so far
 */
public record TaskShape(
    TaskRecord task,
    String lane,
    int laneIndex,
    int row,
    int globalRow,
    double x,
    double y,
    double width,
    double height,
    HslColor color)
    implements DrawableItem {

  @Override
  public Kind kind() {
    return Kind.TASK;
  }

  public String label() {
    return task.label();
  }

  public double start() {
    return task.start();
  }

  public double end() {
    return task.end();
  }
}
