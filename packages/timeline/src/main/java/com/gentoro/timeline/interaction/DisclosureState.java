package com.gentoro.timeline.interaction;

/** Per-lane disclosure state. Lanes start {@link #EXPANDED}. */
public enum DisclosureState {
  EXPANDED("▼"),
  COLLAPSED("▶");

  private final String glyph;

  DisclosureState(String glyph) {
    this.glyph = glyph;
  }

  /** Indicator shown in front of the lane label. */
  public String glyph() {
    return glyph;
  }

  public DisclosureState toggle() {
    return this == EXPANDED ? COLLAPSED : EXPANDED;
  }
}
