package com.gentoro.timeline.layout;

/** Full-width background band of a lane; alternating lanes get the darker shade. */
public record LaneHeader(
    String lane,
    int laneIndex,
    int rowCount,
    double x,
    double y,
    double width,
    double height,
    boolean alternate)
    implements DrawableItem {

  @Override
  public Kind kind() {
    return Kind.LANE_HEADER;
  }
}
