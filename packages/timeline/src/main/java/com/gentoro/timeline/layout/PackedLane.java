package com.gentoro.timeline.layout;

import java.util.List;

/**
 * Row packing result for one lane.
 *
 * @param lane lane identifier
 * @param assignments one entry per task, in packing order
 * @param rowCount number of rows used; rows are {@code 0..rowCount-1}
 */
public record PackedLane(String lane, List<RowAssignment> assignments, int rowCount) {

  public PackedLane {
    assignments = List.copyOf(assignments);
  }

  /** Assignments placed on {@code row}, in packing order. */
  public List<RowAssignment> row(int row) {
    return assignments.stream().filter(a -> a.row() == row).toList();
  }
}
