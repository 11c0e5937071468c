package com.gentoro.timeline.utility;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/** Compact, locale-independent number text for documents. */
public final class NumberText {
  private static final MathContext LABEL_PRECISION = new MathContext(10, RoundingMode.HALF_EVEN);

  private NumberText() {}

  /** Shortest plain decimal for {@code value}: {@code 10.0 -> "10"}, {@code 1e7 -> "10000000"}. */
  public static String plain(double value) {
    if (!Double.isFinite(value)) {
      return String.valueOf(value);
    }
    if (value == 0) {
      return "0";
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  /** Time for labels, rounded to ten significant digits. */
  public static String label(double value) {
    if (!Double.isFinite(value) || value == 0) {
      return plain(value);
    }
    return BigDecimal.valueOf(value).round(LABEL_PRECISION).stripTrailingZeros().toPlainString();
  }

  /** Pixel coordinate with at most two decimals. */
  public static String coord(double value) {
    if (!Double.isFinite(value) || value == 0) {
      return plain(value);
    }
    return BigDecimal.valueOf(value)
        .setScale(2, RoundingMode.HALF_UP)
        .stripTrailingZeros()
        .toPlainString();
  }
}
