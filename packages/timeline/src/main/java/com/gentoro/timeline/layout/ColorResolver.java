package com.gentoro.timeline.layout;

import com.gentoro.timeline.model.TaskRecord;

/**
 * Deterministic task colors.
 *
 * <p>An explicit color code is mixed with a multiplicative constant and spread over hue,
 * saturation and lightness. Without one, the label (or the sequence index when the label is
 * empty) is hashed with 64-bit FNV-1a and its low 32 bits go through the same mixing. Results do
 * not depend on the process, platform, locale or iteration order.
 */
public final class ColorResolver {
  static final long MIX = 2654435761L;
  static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
  static final long FNV_PRIME = 0x100000001b3L;
  private static final long LOW_32 = 0xFFFFFFFFL;

  private ColorResolver() {}

  public static HslColor resolve(TaskRecord task) {
    if (task.hasExplicitColor()) {
      return fromInt(task.explicitColor());
    }
    return fromKey(fallbackKey(task));
  }

  /** Label when non-empty, otherwise the sequence index. */
  public static String fallbackKey(TaskRecord task) {
    return task.label().isEmpty() ? String.valueOf(task.sequenceIndex()) : task.label();
  }

  public static HslColor fromInt(long value) {
    long h = ((value & LOW_32) * MIX) & LOW_32;
    int hue = (int) (h % 360);
    int saturation = 60 + (int) ((h >>> 8) % 20);
    int lightness = 45 + (int) ((h >>> 16) % 10);
    return new HslColor(hue, saturation, lightness);
  }

  public static HslColor fromKey(String key) {
    return fromInt(fnv1a64(key) & LOW_32);
  }

  /** 64-bit FNV-1a over the Unicode code points of {@code key}. */
  public static long fnv1a64(String key) {
    long h = FNV_OFFSET_BASIS;
    if (key == null) {
      return h;
    }
    int i = 0;
    while (i < key.length()) {
      int cp = key.codePointAt(i);
      h ^= cp;
      h *= FNV_PRIME;
      i += Character.charCount(cp);
    }
    return h;
  }
}
