package com.gentoro.timeline.ingest;

/** Parses the color column: decimal, {@code #RRGGBB} / {@code #hex}, or {@code 0x} hex. */
final class ColorToken {
  static final long MASK = 0xFFFFFFFFL;

  private ColorToken() {}

  /**
   * @return the color masked to 32 bits, or null for a blank token
   * @throws TraceCsvParser.RecordException for any other token
   */
  static Long parse(String raw) {
    String value = raw == null ? "" : raw.trim();
    if (value.isEmpty()) {
      return null;
    }
    try {
      if (value.startsWith("#")) {
        return Long.parseUnsignedLong(value.substring(1), 16) & MASK;
      }
      if (value.startsWith("0x") || value.startsWith("0X")) {
        return Long.parseUnsignedLong(value.substring(2), 16) & MASK;
      }
      return Long.parseLong(value) & MASK;
    } catch (NumberFormatException e) {
      throw new TraceCsvParser.RecordException("invalid color '" + value + "'");
    }
  }
}
