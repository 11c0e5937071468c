package com.gentoro.timeline.layout;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.timeline.model.TaskRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class DensityHistogramTest {

  @Test
  void countsTasksPerOverlappedBin() {
    DensityHistogram h =
        DensityHistogram.of(
            List.of(TaskRecord.of(0, 4, "a", "x", 0), TaskRecord.of(3, 9.5, "a", "y", 1)),
            new TimeRange(0, 10),
            10);

    assertArrayEquals(new int[] {1, 1, 1, 2, 2, 1, 1, 1, 1, 1}, h.counts());
    assertEquals(2, h.max());
    assertEquals(1, h.binWidth(), 1e-9);
  }

  @Test
  void clampsOutOfRangeTimes() {
    DensityHistogram h =
        DensityHistogram.of(List.of(TaskRecord.of(-5, 50, "a", "x", 0)), new TimeRange(0, 10), 4);
    assertArrayEquals(new int[] {1, 1, 1, 1}, h.counts());
  }
}
