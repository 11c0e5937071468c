package com.gentoro.timeline.format;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PrintfLabelFormatter")
class PrintfLabelFormatterTest {

  private final LabelFormatter formatter = new PrintfLabelFormatter();

  @Test
  void substitutesPositionally() {
    assertEquals("task 3 of io", formatter.format("task %d of %s", List.of("3", "io")));
    assertEquals("42", formatter.format("%i", List.of("42")));
  }

  @Test
  void honoursFlagsWidthAndPrecision() {
    assertEquals(" 3.14", formatter.format("%5.2f", List.of("3.14159")));
    assertEquals("00042", formatter.format("%05d", List.of("42")));
    assertEquals("ab  |", formatter.format("%-4s|", List.of("ab")));
    assertEquals("ff/FF", formatter.format("%x/%X", List.of("255", "255")));
    assertEquals("1.234568e+04", formatter.format("%e", List.of("12345.678")));
  }

  @Test
  void integralConversionsTruncate() {
    assertEquals("3", formatter.format("%d", List.of("3.7")));
  }

  @Test
  void characterConversion() {
    assertEquals("A", formatter.format("%c", List.of("65")));
    assertEquals("x", formatter.format("%c", List.of("xyz")));
  }

  @Test
  @DisplayName("arguments that cannot be coerced are inserted raw")
  void fallsBackToRawArgument() {
    assertEquals("n=abc", formatter.format("n=%d", List.of("abc")));
    assertEquals("5", formatter.format("%#d", List.of("5")));
  }

  @Test
  void oversizedFieldsInsertTheRawArgument() {
    assertEquals("[x]", formatter.format("[%999999999s]", List.of("x")));
    assertEquals("3.5", formatter.format("%.100000f", List.of("3.5")));
    assertEquals("n=7", formatter.format("n=%1000d", List.of("7")));
    assertEquals(999, formatter.format("%999s", List.of("y")).length());
  }

  @Test
  void leavesUnmatchedPlaceholdersVerbatim() {
    assertEquals("a %s", formatter.format("%s %s", List.of("a")));
    assertEquals("%d items", formatter.format("%d items", List.of()));
  }

  @Test
  void ignoresSurplusArguments() {
    assertEquals("a", formatter.format("%s", List.of("a", "b")));
  }

  @Test
  void percentLiteral() {
    assertEquals("100% of 4", formatter.format("100%% of %d", List.of("4")));
  }

  @Test
  void plainTextAndNullTemplate() {
    assertEquals("compute", formatter.format("compute", List.of("x")));
    assertEquals("", formatter.format(null, List.of()));
    assertEquals("z %q", formatter.format("%s %q", List.of("z")));
  }
}
