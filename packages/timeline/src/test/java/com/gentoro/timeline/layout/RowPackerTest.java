package com.gentoro.timeline.layout;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.timeline.model.TaskRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RowPacker")
class RowPackerTest {

  @Test
  @DisplayName("overlapping task opens a second row; a later task reuses row 0")
  void packsBasicScenario() {
    TaskRecord a = TaskRecord.of(0, 10, "T1", "a", 0);
    TaskRecord b = TaskRecord.of(5, 15, "T1", "b", 1);
    TaskRecord c = TaskRecord.of(20, 30, "T1", "c", 2);

    PackedLane lane = RowPacker.pack("T1", List.of(a, b, c));

    assertEquals(2, lane.rowCount());
    Map<String, Integer> rows = rowsByLabel(lane);
    assertEquals(0, rows.get("a"));
    assertEquals(1, rows.get("b"));
    assertEquals(0, rows.get("c"));
  }

  @Test
  void touchingIntervalsShareARow() {
    PackedLane lane =
        RowPacker.pack(
            "T1", List.of(TaskRecord.of(0, 10, "T1", "a", 0), TaskRecord.of(10, 20, "T1", "b", 1)));

    assertEquals(1, lane.rowCount());
    assertEquals(2, lane.row(0).size());
  }

  @Test
  void packingDoesNotDependOnInputOrder() {
    List<TaskRecord> tasks = randomTasks(new Random(7), 120);
    Map<Integer, Integer> expected = rowsBySequence(RowPacker.pack("L", tasks));

    Random shuffler = new Random(11);
    for (int i = 0; i < 10; i++) {
      List<TaskRecord> shuffled = new ArrayList<>(tasks);
      Collections.shuffle(shuffled, shuffler);
      assertEquals(expected, rowsBySequence(RowPacker.pack("L", shuffled)));
    }
  }

  @Test
  @DisplayName("no two tasks on a row overlap and rows equal peak concurrency")
  void rowsAreDisjointAndMinimal() {
    Random random = new Random(42);
    for (int round = 0; round < 20; round++) {
      List<TaskRecord> tasks = randomTasks(random, 10 + random.nextInt(150));
      PackedLane lane = RowPacker.pack("L", tasks);

      for (int r = 0; r < lane.rowCount(); r++) {
        List<RowAssignment> row = lane.row(r);
        for (int i = 0; i < row.size(); i++) {
          for (int j = i + 1; j < row.size(); j++) {
            TaskRecord x = row.get(i).task();
            TaskRecord y = row.get(j).task();
            assertFalse(x.overlaps(y), () -> "overlap on row: " + x + " / " + y);
          }
        }
      }
      assertEquals(maxConcurrency(tasks), lane.rowCount());
    }
  }

  @Test
  void emptyLaneHasNoRows() {
    PackedLane lane = RowPacker.pack("T1", List.of());
    assertEquals(0, lane.rowCount());
    assertTrue(lane.assignments().isEmpty());
  }

  private static List<TaskRecord> randomTasks(Random random, int count) {
    List<TaskRecord> tasks = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      double start = random.nextInt(1000);
      double end = start + 1 + random.nextInt(80);
      tasks.add(TaskRecord.of(start, end, "L", "t" + i, i));
    }
    return tasks;
  }

  /** Peak number of simultaneously active half-open intervals. */
  private static int maxConcurrency(List<TaskRecord> tasks) {
    List<double[]> events = new ArrayList<>();
    for (TaskRecord t : tasks) {
      events.add(new double[] {t.start(), 1});
      events.add(new double[] {t.end(), -1});
    }
    // ends sort before starts at the same instant
    events.sort((p, q) -> p[0] != q[0] ? Double.compare(p[0], q[0]) : Double.compare(p[1], q[1]));
    int active = 0;
    int peak = 0;
    for (double[] e : events) {
      active += (int) e[1];
      peak = Math.max(peak, active);
    }
    return peak;
  }

  private static Map<String, Integer> rowsByLabel(PackedLane lane) {
    Map<String, Integer> rows = new HashMap<>();
    lane.assignments().forEach(a -> rows.put(a.task().label(), a.row()));
    return rows;
  }

  private static Map<Integer, Integer> rowsBySequence(PackedLane lane) {
    Map<Integer, Integer> rows = new HashMap<>();
    lane.assignments().forEach(a -> rows.put(a.task().sequenceIndex(), a.row()));
    return rows;
  }
}
