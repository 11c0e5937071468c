package com.gentoro.timeline.layout;

import com.gentoro.timeline.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/**
 * Geometry of the rendered timeline, in pixels unless stated otherwise.
 *
 * @param widthPx total canvas width
 * @param leftMargin space reserved for lane labels
 * @param rightMargin space reserved for overflow past the last timestamp
 * @param rowHeight height of one task rectangle
 * @param rowPadding vertical gap between rows
 * @param trackSpacing extra gap between lanes
 * @param headerHeight height of the ruler area above the first lane
 * @param bottomMargin space below the last lane
 * @param minTaskWidth floor applied to rendered task widths
 * @param labelMinWidth tasks narrower than this get no inline text
 * @param labelMaxChars inline text truncation length
 * @param rulerTicks number of ruler intervals (ticks drawn = intervals + 1)
 * @param rangeEpsilon widening applied to an empty time range, in time units
 * @param densityBins number of time bins in each lane's density histogram
 */
public record LayoutSettings(
    double widthPx,
    double leftMargin,
    double rightMargin,
    double rowHeight,
    double rowPadding,
    double trackSpacing,
    double headerHeight,
    double bottomMargin,
    double minTaskWidth,
    double labelMinWidth,
    int labelMaxChars,
    int rulerTicks,
    double rangeEpsilon,
    int densityBins) {

  public LayoutSettings {
    if (widthPx - leftMargin - rightMargin <= 0) {
      throw new ConfigException(
          "layout.width-px must exceed left and right margins (width=%s, left=%s, right=%s)"
              .formatted(widthPx, leftMargin, rightMargin));
    }
    if (rowHeight <= 0) {
      throw new ConfigException("layout.row-height must be positive");
    }
    if (rangeEpsilon <= 0) {
      throw new ConfigException("layout.range-epsilon must be positive");
    }
    rulerTicks = Math.max(1, rulerTicks);
    densityBins = Math.max(1, densityBins);
    labelMaxChars = Math.max(1, labelMaxChars);
  }

  public static LayoutSettings defaults() {
    return new LayoutSettings(1400, 200, 40, 20, 6, 12, 40, 100, 2, 40, 30, 8, 1, 256);
  }

  /** Read {@code layout.*} keys, falling back to {@link #defaults()} for missing keys. */
  public static LayoutSettings fromConfiguration(Configuration config) {
    LayoutSettings d = defaults();
    if (config == null) {
      return d;
    }
    try {
      return new LayoutSettings(
          config.getDouble("layout.width-px", d.widthPx()),
          config.getDouble("layout.left-margin", d.leftMargin()),
          config.getDouble("layout.right-margin", d.rightMargin()),
          config.getDouble("layout.row-height", d.rowHeight()),
          config.getDouble("layout.row-padding", d.rowPadding()),
          config.getDouble("layout.track-spacing", d.trackSpacing()),
          config.getDouble("layout.header-height", d.headerHeight()),
          config.getDouble("layout.bottom-margin", d.bottomMargin()),
          config.getDouble("layout.min-task-width", d.minTaskWidth()),
          config.getDouble("layout.label-min-width", d.labelMinWidth()),
          config.getInt("layout.label-max-chars", d.labelMaxChars()),
          config.getInt("layout.ruler-ticks", d.rulerTicks()),
          config.getDouble("layout.range-epsilon", d.rangeEpsilon()),
          config.getInt("layout.density-bins", d.densityBins()));
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid layout configuration", e);
    }
  }

  /** Vertical distance between the tops of two consecutive rows. */
  public double rowPitch() {
    return rowHeight + rowPadding;
  }

  /** Horizontal span available to the time axis. */
  public double drawableWidth() {
    return widthPx - leftMargin - rightMargin;
  }
}
