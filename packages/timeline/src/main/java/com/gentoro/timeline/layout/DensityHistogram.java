package com.gentoro.timeline.layout;

import com.gentoro.timeline.model.TaskRecord;
import java.util.Arrays;
import java.util.Collection;

/**
 * Number of tasks overlapping each of {@code counts.length} equal time bins. Drawn as a sparkline
 * in the header of a collapsed lane.
 */
public final class DensityHistogram {
  private final double start;
  private final double binWidth;
  private final int[] counts;

  private DensityHistogram(double start, double binWidth, int[] counts) {
    this.start = start;
    this.binWidth = binWidth;
    this.counts = counts;
  }

  public static DensityHistogram of(Collection<TaskRecord> tasks, TimeRange range, int bins) {
    int[] counts = new int[bins];
    double binWidth = range.width() / bins;
    for (TaskRecord t : tasks) {
      int b0 = bin(t.start(), range.start(), binWidth, bins);
      int b1 = bin(Math.max(t.start(), t.end()), range.start(), binWidth, bins);
      for (int b = b0; b <= b1; b++) {
        counts[b]++;
      }
    }
    return new DensityHistogram(range.start(), binWidth, counts);
  }

  private static int bin(double t, double start, double binWidth, int bins) {
    int idx = (int) Math.floor((t - start) / binWidth);
    return Math.max(0, Math.min(bins - 1, idx));
  }

  public double start() {
    return start;
  }

  public double binWidth() {
    return binWidth;
  }

  public int binCount() {
    return counts.length;
  }

  public int count(int bin) {
    return counts[bin];
  }

  public int max() {
    return Arrays.stream(counts).max().orElse(0);
  }

  public int[] counts() {
    return counts.clone();
  }
}
