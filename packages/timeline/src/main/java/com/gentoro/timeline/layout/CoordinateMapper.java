package com.gentoro.timeline.layout;

/**
 * Affine mapping from time to horizontal pixels.
 *
 * <p>{@code range.start} maps to the left margin and {@code range.end} to {@code leftMargin +
 * drawableWidth}. The mapping is not clamped; times past the range land in the right margin.
 */
public final class CoordinateMapper {
  private final TimeRange range;
  private final double leftMargin;
  private final double drawableWidth;
  private final double minWidth;

  public CoordinateMapper(TimeRange range, LayoutSettings settings) {
    if (!(range.width() > 0)) {
      throw new IllegalArgumentException("Time range must have positive width: " + range);
    }
    this.range = range;
    this.leftMargin = settings.leftMargin();
    this.drawableWidth = settings.drawableWidth();
    this.minWidth = settings.minTaskWidth();
  }

  public double x(double t) {
    return leftMargin + (t - range.start()) / range.width() * drawableWidth;
  }

  /** Rendered width of {@code [start, end]}, never below the configured minimum. */
  public double width(double start, double end) {
    return Math.max(minWidth, x(end) - x(start));
  }

  public TimeRange range() {
    return range;
  }
}
