package com.gentoro.timeline.layout;

/** Color in HSL space; saturation and lightness are percentages. */
public record HslColor(int hue, int saturation, int lightness) {

  /** CSS Color 4 notation, e.g. {@code hsl(104 64% 54%)}. */
  public String css() {
    return "hsl(" + hue + " " + saturation + "% " + lightness + "%)";
  }

  @Override
  public String toString() {
    return css();
  }
}
