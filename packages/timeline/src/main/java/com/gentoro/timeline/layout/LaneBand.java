package com.gentoro.timeline.layout;

/**
 * Vertical extent of a lane: the lane → row-range index entry the viewer uses to collapse it.
 *
 * @param firstGlobalRow rows of all earlier lanes
 * @param top y of the lane's row 0
 * @param bottom {@code top + rowCount * rowPitch}; exclusive
 */
public record LaneBand(
    String lane,
    int index,
    int firstGlobalRow,
    int rowCount,
    double top,
    double bottom,
    DensityHistogram density) {

  public boolean contains(double y) {
    return y >= top && y < bottom;
  }
}
