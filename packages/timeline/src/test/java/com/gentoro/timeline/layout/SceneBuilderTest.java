package com.gentoro.timeline.layout;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.timeline.model.TaskRecord;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SceneBuilder")
class SceneBuilderTest {

  private final SceneBuilder builder = new SceneBuilder(LayoutSettings.defaults());

  @Test
  @DisplayName("two lanes with one task each get row offsets 0 and 1")
  void offsetsLanesByRowCount() {
    Scene scene =
        builder.build(
            List.of(TaskRecord.of(5, 15, "T2", "b", 0), TaskRecord.of(0, 10, "T1", "a", 1)));

    assertEquals(2, scene.lanes().size());
    LaneBand t1 = scene.lanes().get(0);
    LaneBand t2 = scene.lanes().get(1);
    assertEquals("T1", t1.lane());
    assertEquals(0, t1.firstGlobalRow());
    assertEquals(1, t1.rowCount());
    assertEquals("T2", t2.lane());
    assertEquals(1, t2.firstGlobalRow());
    assertEquals(1, t2.rowCount());

    // header 40, pitch 26, track spacing 12
    assertEquals(40, t1.top(), 1e-9);
    assertEquals(66, t1.bottom(), 1e-9);
    assertEquals(78, t2.top(), 1e-9);
    assertEquals(104, t2.bottom(), 1e-9);
    assertEquals(40 + 2 * 26 + 2 * 12 + 100, scene.height(), 1e-9);
    assertEquals(1400, scene.width(), 1e-9);
  }

  @Test
  void emitsEachHeaderBeforeItsShapes() {
    Scene scene =
        builder.build(
            List.of(
                TaskRecord.of(0, 10, "b", "x", 0),
                TaskRecord.of(0, 10, "a", "y", 1),
                TaskRecord.of(5, 15, "a", "z", 2)));

    List<String> sequence =
        scene.items().stream()
            .map(i -> i.kind().name().charAt(0) + ":" + i.lane())
            .collect(Collectors.toList());
    assertEquals(List.of("L:a", "T:a", "T:a", "L:b", "T:b"), sequence);

    LaneHeader first = (LaneHeader) scene.items().get(0);
    LaneHeader second = (LaneHeader) scene.items().get(3);
    assertFalse(first.alternate());
    assertTrue(second.alternate());
    assertEquals(2 * 26, first.height(), 1e-9);
    assertEquals(1400, first.width(), 1e-9);
  }

  @Test
  void ordersLanesLexicographically() {
    Scene scene =
        builder.build(
            List.of(
                TaskRecord.of(0, 1, "T2", "a", 0),
                TaskRecord.of(0, 1, "T10", "b", 1),
                TaskRecord.of(0, 1, "T1", "c", 2)));

    assertEquals(
        List.of("T1", "T10", "T2"), scene.lanes().stream().map(LaneBand::lane).toList());
  }

  @Test
  @DisplayName("row y follows header + (offset + row) * pitch + lane * spacing")
  void placesRowsOnTheGrid() {
    Scene scene =
        builder.build(
            List.of(
                TaskRecord.of(0, 10, "A", "a", 0),
                TaskRecord.of(5, 15, "A", "b", 1),
                TaskRecord.of(20, 30, "A", "c", 2),
                TaskRecord.of(0, 30, "B", "d", 3)));

    List<TaskShape> shapes = tasks(scene);
    assertEquals(4, shapes.size());
    for (TaskShape shape : shapes) {
      int offset = scene.lanes().get(shape.laneIndex()).firstGlobalRow();
      double expected = 40 + (offset + shape.row()) * 26 + shape.laneIndex() * 12;
      assertEquals(expected, shape.y(), 1e-9, shape.label());
      assertEquals(offset + shape.row(), shape.globalRow());
      assertEquals(20, shape.height(), 1e-9);
    }
    TaskShape d = shapes.stream().filter(s -> s.label().equals("d")).findFirst().orElseThrow();
    assertEquals(40 + 2 * 26 + 12, d.y(), 1e-9);
    assertEquals(3, scene.totalRows());
    assertEquals(40 + 3 * 26 + 2 * 12 + 100, scene.height(), 1e-9);
  }

  @Test
  void positionsTasksAndColorsThem() {
    Scene scene =
        builder.build(
            List.of(TaskRecord.of(0, 10, "T1", "a", 0), TaskRecord.of(5, 15, "T2", "b", 1)));

    TaskShape a = tasks(scene).get(0);
    assertEquals(200, a.x(), 1e-9);
    assertEquals(10.0 / 15 * 1160, a.width(), 1e-9);
    assertEquals("hsl(44 60% 51%)", a.color().css());
  }

  @Test
  void addsOverheadStripAfterTheTask() {
    TaskRecord task = new TaskRecord(0, 10, "T1", "a", "a", List.of(), 2.0, null, 0, 1);
    Scene scene = builder.build(List.of(task));

    List<OverheadShape> strips =
        scene.items().stream()
            .filter(OverheadShape.class::isInstance)
            .map(OverheadShape.class::cast)
            .toList();
    assertEquals(1, strips.size());
    OverheadShape strip = strips.get(0);
    assertEquals(10, strip.start(), 1e-9);
    assertEquals(12, strip.end(), 1e-9);
    assertEquals(1360, strip.x(), 1e-9);
    assertEquals(232, strip.width(), 1e-9);
    assertEquals(40 + 12, strip.y(), 1e-9);
    assertEquals(8, strip.height(), 1e-9);
    assertEquals("a (ov)", strip.label());
  }

  @Test
  void zeroOverheadAddsNothing() {
    TaskRecord task = new TaskRecord(0, 10, "T1", "a", "a", List.of(), 0.0, null, 0, 1);
    Scene scene = builder.build(List.of(task));
    assertTrue(scene.items().stream().noneMatch(OverheadShape.class::isInstance));
  }

  @Test
  void drawsNineRulerTicksByDefault() {
    Scene scene = builder.build(List.of(TaskRecord.of(0, 80, "T1", "a", 0)));

    assertEquals(9, scene.ticks().size());
    assertEquals(0, scene.ticks().get(0).time(), 1e-9);
    assertEquals(200, scene.ticks().get(0).x(), 1e-9);
    assertEquals(40, scene.ticks().get(4).time(), 1e-9);
    assertEquals(80, scene.ticks().get(8).time(), 1e-9);
    assertEquals(1360, scene.ticks().get(8).x(), 1e-9);
  }

  @Test
  @DisplayName("single-instant trace is widened and still renders")
  void widensDegenerateRange() {
    Scene scene = builder.build(List.of(TaskRecord.of(5, 5, "T1", "a", 0)));

    assertEquals(new TimeRange(5, 5), scene.dataRange());
    assertEquals(new TimeRange(5, 6), scene.range());
    TaskShape shape = tasks(scene).get(0);
    assertEquals(200, shape.x(), 1e-9);
    assertEquals(2, shape.width(), 1e-9);
  }

  @Test
  void computesRowYDirectly() {
    assertEquals(40, builder.rowY(0, 0, 0), 1e-9);
    assertEquals(40 + 4 * 26 + 2 * 12, builder.rowY(3, 1, 2), 1e-9);
  }

  private static List<TaskShape> tasks(Scene scene) {
    return scene.items().stream()
        .filter(TaskShape.class::isInstance)
        .map(TaskShape.class::cast)
        .toList();
  }
}
