package com.gentoro.timeline.render;

import org.apache.commons.configuration2.Configuration;

/**
 * Text and styling choices shared by the renderers.
 *
 * @param title document title
 * @param timeUnit unit appended to times in labels and tooltips
 * @param overheadColor fill of overhead strips
 * @param sourceName input name shown in the page header
 */
public record RenderSettings(
    String title, String timeUnit, String overheadColor, String sourceName) {

  public static RenderSettings defaults() {
    return new RenderSettings("Timeline", "μs", "#4CAF50", "input");
  }

  public static RenderSettings fromConfiguration(Configuration config, String sourceName) {
    RenderSettings d = defaults();
    if (config == null) {
      return d.withSourceName(sourceName);
    }
    return new RenderSettings(
        config.getString("render.title", d.title()),
        config.getString("render.time-unit", d.timeUnit()),
        config.getString("render.overhead-color", d.overheadColor()),
        sourceName == null ? d.sourceName() : sourceName);
  }

  public RenderSettings withSourceName(String name) {
    return new RenderSettings(title, timeUnit, overheadColor, name == null ? sourceName : name);
  }
}
