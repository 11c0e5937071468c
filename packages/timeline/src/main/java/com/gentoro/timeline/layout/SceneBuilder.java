package com.gentoro.timeline.layout;

import com.gentoro.timeline.logging.LoggingService;
import com.gentoro.timeline.model.TaskRecord;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;

/**
 * Composes packed lanes into a positioned {@link Scene}.
 *
 * <p>Lanes are laid out in lexicographic order of their identifier. Row {@code r} of lane {@code
 * i} sits at {@code headerHeight + (offset(i) + r) * rowPitch + i * trackSpacing}, where {@code
 * offset(i)} is the number of rows used by lanes {@code 0..i-1}.
 */
public class SceneBuilder {
  private static final Logger log = LoggingService.getLogger(SceneBuilder.class);

  /** Overhead strips occupy the lower part of their row. */
  static final double OVERHEAD_INSET = 0.6;

  private final LayoutSettings settings;

  public SceneBuilder(LayoutSettings settings) {
    this.settings = settings;
  }

  public Scene build(Collection<TaskRecord> tasks) {
    TimeRange dataRange = TimeRange.covering(tasks);
    TimeRange range = dataRange.widenedIfEmpty(settings.rangeEpsilon());
    if (range != dataRange) {
      log.debug("Empty time range {}, widened to {}", dataRange, range);
    }
    CoordinateMapper mapper = new CoordinateMapper(range, settings);

    Map<String, List<TaskRecord>> byLane = groupByLane(tasks);
    List<PackedLane> packed = new ArrayList<>(byLane.size());
    for (Map.Entry<String, List<TaskRecord>> e : byLane.entrySet()) {
      packed.add(RowPacker.pack(e.getKey(), e.getValue()));
    }

    double pitch = settings.rowPitch();
    List<LaneBand> bands = new ArrayList<>(packed.size());
    List<DrawableItem> items = new ArrayList<>();
    int rowOffset = 0;
    for (int laneIndex = 0; laneIndex < packed.size(); laneIndex++) {
      PackedLane lane = packed.get(laneIndex);
      double top = rowY(rowOffset, 0, laneIndex);
      double bottom = top + lane.rowCount() * pitch;
      bands.add(
          new LaneBand(
              lane.lane(),
              laneIndex,
              rowOffset,
              lane.rowCount(),
              top,
              bottom,
              DensityHistogram.of(byLane.get(lane.lane()), range, settings.densityBins())));
      items.add(
          new LaneHeader(
              lane.lane(),
              laneIndex,
              lane.rowCount(),
              0,
              top,
              settings.widthPx(),
              bottom - top,
              laneIndex % 2 == 1));

      for (RowAssignment a : lane.assignments()) {
        TaskRecord t = a.task();
        double x = mapper.x(t.start());
        double y = rowY(rowOffset, a.row(), laneIndex);
        items.add(
            new TaskShape(
                t,
                lane.lane(),
                laneIndex,
                a.row(),
                rowOffset + a.row(),
                x,
                y,
                mapper.width(t.start(), t.end()),
                settings.rowHeight(),
                ColorResolver.resolve(t)));
        if (t.hasOverhead()) {
          items.add(overhead(t, lane.lane(), laneIndex, a.row(), y, mapper));
        }
      }
      rowOffset += lane.rowCount();
    }

    double height =
        settings.headerHeight()
            + rowOffset * pitch
            + packed.size() * settings.trackSpacing()
            + settings.bottomMargin();

    log.debug("Scene: {} lane(s), {} row(s), {} item(s)", bands.size(), rowOffset, items.size());
    return new Scene(
        dataRange, range, settings.widthPx(), height, bands, items, ticks(mapper), settings);
  }

  /** Top of lane-local row {@code row} in the lane at {@code laneIndex}. */
  double rowY(int laneRowOffset, int row, int laneIndex) {
    return settings.headerHeight()
        + (laneRowOffset + row) * settings.rowPitch()
        + laneIndex * settings.trackSpacing();
  }

  private OverheadShape overhead(
      TaskRecord t, String lane, int laneIndex, int row, double rowTop, CoordinateMapper mapper) {
    double start = t.end();
    double end = start + t.overheadDuration();
    double inset = settings.rowHeight() * OVERHEAD_INSET;
    return new OverheadShape(
        t,
        lane,
        laneIndex,
        row,
        mapper.x(start),
        rowTop + inset,
        mapper.width(start, end),
        settings.rowHeight() - inset,
        start,
        end);
  }

  private List<RulerTick> ticks(CoordinateMapper mapper) {
    TimeRange range = mapper.range();
    int intervals = settings.rulerTicks();
    List<RulerTick> ticks = new ArrayList<>(intervals + 1);
    for (int i = 0; i <= intervals; i++) {
      double t = range.start() + range.width() * i / intervals;
      ticks.add(new RulerTick(t, mapper.x(t)));
    }
    return ticks;
  }

  private static Map<String, List<TaskRecord>> groupByLane(Collection<TaskRecord> tasks) {
    Map<String, List<TaskRecord>> byLane = new TreeMap<>();
    for (TaskRecord t : tasks) {
      byLane.computeIfAbsent(t.lane(), k -> new ArrayList<>()).add(t);
    }
    return byLane;
  }
}
