package com.gentoro.timeline.layout;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.timeline.model.TaskRecord;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ColorResolver")
class ColorResolverTest {

  @Test
  @DisplayName("explicit color 16711680 always resolves to hue 104")
  void explicitColorIsStable() {
    TaskRecord task =
        new TaskRecord(0, 10, "T1", "a", "a", List.of(), null, 16711680L, 0, 1);

    HslColor first = ColorResolver.resolve(task);
    for (int i = 0; i < 5; i++) {
      assertEquals(first, ColorResolver.resolve(task));
    }
    assertEquals(104, first.hue());
    assertEquals("hsl(104 64% 54%)", first.css());
  }

  @Test
  void mixesIntegerCodes() {
    assertEquals("hsl(0 60% 45%)", ColorResolver.fromInt(0).css());
    assertEquals("hsl(23 79% 49%)", ColorResolver.fromInt(255).css());
    assertEquals("hsl(248 68% 50%)", ColorResolver.fromInt(0xFF8800).css());
    assertEquals("hsl(15 66% 47%)", ColorResolver.fromInt(0xFFFFFFFFL).css());
  }

  @Test
  void hashesLabelsWithFnv1a() {
    assertEquals("hsl(44 60% 51%)", ColorResolver.fromKey("a").css());
    assertEquals("hsl(50 75% 46%)", ColorResolver.fromKey("compute").css());
    assertEquals("hsl(247 62% 50%)", ColorResolver.fromKey("T1 work").css());
    assertEquals("hsl(61 77% 46%)", ColorResolver.fromKey("").css());
  }

  @Test
  void fnvOfEmptyKeyIsOffsetBasis() {
    assertEquals(0xcbf29ce484222325L, ColorResolver.fnv1a64(""));
  }

  @Test
  @DisplayName("label falls back to the sequence index when empty")
  void emptyLabelUsesSequenceIndex() {
    TaskRecord unnamed = TaskRecord.of(0, 1, "T1", "", 7);
    TaskRecord named = TaskRecord.of(0, 1, "T1", "a", 7);

    assertEquals("7", ColorResolver.fallbackKey(unnamed));
    assertEquals("hsl(166 64% 54%)", ColorResolver.resolve(unnamed).css());
    assertEquals("a", ColorResolver.fallbackKey(named));
  }

  @Test
  void explicitColorWinsOverLabel() {
    TaskRecord colored = new TaskRecord(0, 1, "T1", "a", "a", List.of(), null, 255L, 0, 1);
    assertEquals(ColorResolver.fromInt(255), ColorResolver.resolve(colored));
    assertNotEquals(ColorResolver.fromKey("a"), ColorResolver.resolve(colored));
  }

  @Test
  void componentsStayInRange() {
    for (long v = 0; v < 5000; v += 7) {
      HslColor c = ColorResolver.fromInt(v * 104729);
      assertTrue(c.hue() >= 0 && c.hue() < 360);
      assertTrue(c.saturation() >= 60 && c.saturation() < 80);
      assertTrue(c.lightness() >= 45 && c.lightness() < 55);
    }
  }
}
