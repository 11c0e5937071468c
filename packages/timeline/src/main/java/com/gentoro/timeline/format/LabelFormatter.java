package com.gentoro.timeline.format;

import java.util.List;

/** Substitutes task arguments into a task name template. */
public interface LabelFormatter {

  /**
   * Fill {@code template} with {@code args}. Implementations never fail: anything they cannot
   * substitute is left as written.
   */
  String format(String template, List<String> args);

  /** Formatter that returns the template untouched. */
  static LabelFormatter verbatim() {
    return (template, args) -> template == null ? "" : template;
  }
}
