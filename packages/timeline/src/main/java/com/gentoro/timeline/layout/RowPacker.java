package com.gentoro.timeline.layout;

import com.gentoro.timeline.model.TaskRecord;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy interval partitioning of one lane's tasks into rows.
 *
 * <p>Tasks are visited by {@code (start, end, sequenceIndex)}. Each goes to the lowest row whose
 * last task ends at or before its start, or opens a new row. For tasks of positive duration,
 * visiting by start time makes the row count equal to the lane's peak number of simultaneously
 * active tasks.
 */
public final class RowPacker {

  /** Packing order. {@code sequenceIndex} makes it total, so the result is input-order free. */
  public static final Comparator<TaskRecord> PACKING_ORDER =
      Comparator.comparingDouble(TaskRecord::start)
          .thenComparingDouble(TaskRecord::end)
          .thenComparingInt(TaskRecord::sequenceIndex);

  private RowPacker() {}

  public static PackedLane pack(String lane, Collection<TaskRecord> tasks) {
    List<TaskRecord> sorted = new ArrayList<>(tasks);
    sorted.sort(PACKING_ORDER);

    // rowEnds.get(r) is the end time of the last task placed on row r
    List<Double> rowEnds = new ArrayList<>();
    List<RowAssignment> assignments = new ArrayList<>(sorted.size());
    for (TaskRecord task : sorted) {
      int row = firstFreeRow(rowEnds, task.start());
      if (row < 0) {
        rowEnds.add(task.end());
        row = rowEnds.size() - 1;
      } else {
        rowEnds.set(row, task.end());
      }
      assignments.add(new RowAssignment(task, row));
    }
    return new PackedLane(lane, assignments, rowEnds.size());
  }

  private static int firstFreeRow(List<Double> rowEnds, double start) {
    for (int r = 0; r < rowEnds.size(); r++) {
      if (rowEnds.get(r) <= start) {
        return r;
      }
    }
    return -1;
  }
}
