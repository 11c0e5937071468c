package com.gentoro.timeline.layout;

/** Positioned element of a {@link Scene}. */
public interface DrawableItem {

  enum Kind {
    LANE_HEADER,
    TASK,
    OVERHEAD
  }

  Kind kind();

  String lane();

  int laneIndex();

  double x();

  double y();

  double width();

  double height();

  /** Vertical position used for lane membership when a lane is collapsed. */
  default double centerY() {
    return y() + height() / 2;
  }
}
