package com.gentoro.timeline.layout;

import java.util.List;

/**
 * Fully positioned timeline.
 *
 * @param dataRange raw {@code [min(start), max(end)]} of the input
 * @param range mapping range ({@code dataRange} widened when empty)
 * @param lanes lane index, in rendering order
 * @param items headers and shapes; each lane header precedes that lane's shapes
 */
public record Scene(
    TimeRange dataRange,
    TimeRange range,
    double width,
    double height,
    List<LaneBand> lanes,
    List<DrawableItem> items,
    List<RulerTick> ticks,
    LayoutSettings settings) {

  public Scene {
    lanes = List.copyOf(lanes);
    items = List.copyOf(items);
    ticks = List.copyOf(ticks);
  }

  public int totalRows() {
    return lanes.stream().mapToInt(LaneBand::rowCount).sum();
  }
}
