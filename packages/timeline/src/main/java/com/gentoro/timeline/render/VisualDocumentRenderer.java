package com.gentoro.timeline.render;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.timeline.exception.RenderException;
import com.gentoro.timeline.interaction.DisclosureState;
import com.gentoro.timeline.interaction.LaneVisibilityState;
import com.gentoro.timeline.layout.DensityHistogram;
import com.gentoro.timeline.layout.DrawableItem;
import com.gentoro.timeline.layout.LaneBand;
import com.gentoro.timeline.layout.LaneHeader;
import com.gentoro.timeline.layout.LayoutSettings;
import com.gentoro.timeline.layout.OverheadShape;
import com.gentoro.timeline.layout.RulerTick;
import com.gentoro.timeline.layout.Scene;
import com.gentoro.timeline.layout.SceneBuilder;
import com.gentoro.timeline.layout.TaskShape;
import com.gentoro.timeline.logging.LoggingService;
import com.gentoro.timeline.model.TaskRecord;
import com.gentoro.timeline.utility.IoUtil;
import com.gentoro.timeline.utility.JacksonUtility;
import com.gentoro.timeline.utility.NumberText;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.StringEscapeUtils;
import org.apache.commons.text.StringSubstitutor;
import org.slf4j.Logger;

/**
 * Renders a self-contained HTML page: one inline SVG, one stylesheet and one script, no external
 * resources.
 *
 * <p>The page embeds the scene's lane index as an {@code application/json} block. The viewer
 * script collapses a lane by hiding every {@code lane-item} whose {@code data-cy} falls inside the
 * lane's {@code [top, bottom)} band, which is the rule {@link LaneVisibilityState} implements.
 */
public class VisualDocumentRenderer implements TimelineRenderer {
  private static final Logger log = LoggingService.getLogger(VisualDocumentRenderer.class);

  public static final String MEDIA_TYPE = "text/html; charset=utf-8";
  public static final String FILE_NAME = "timeline.html";

  static final String PAGE_TEMPLATE = "templates/timeline.html";
  static final String STYLE_RESOURCE = "templates/timeline.css";
  static final String SCRIPT_RESOURCE = "templates/timeline.js";

  private static final String ELLIPSIS = "…";
  private static final String LANE_FILL = "#f2f2f2";
  private static final String LANE_FILL_ALTERNATE = "#e0e0e0";

  private final LayoutSettings layout;
  private final RenderSettings settings;
  private final DisclosureState initialState;

  public VisualDocumentRenderer(LayoutSettings layout, RenderSettings settings) {
    this(layout, settings, DisclosureState.EXPANDED);
  }

  /**
   * @param initialState disclosure state every lane starts in
   */
  public VisualDocumentRenderer(
      LayoutSettings layout, RenderSettings settings, DisclosureState initialState) {
    this.layout = layout;
    this.settings = settings;
    this.initialState = initialState;
  }

  @Override
  public RenderedArtifact render(List<TaskRecord> tasks) {
    Scene scene = new SceneBuilder(layout).build(tasks);
    LaneVisibilityState visibility = new LaneVisibilityState(scene);
    visibility.bulkSet(initialState);
    String html = page(scene, visibility, tasks.size());
    log.debug(
        "Visual document: {} lane(s), {} item(s), {}x{} px",
        scene.lanes().size(),
        scene.items().size(),
        NumberText.coord(scene.width()),
        NumberText.coord(scene.height()));
    return new RenderedArtifact(html, MEDIA_TYPE, FILE_NAME);
  }

  String page(Scene scene, LaneVisibilityState visibility, int taskCount) {
    Map<String, String> values = new HashMap<>();
    values.put("title", escape(settings.title()));
    values.put("source", escape(settings.sourceName()));
    values.put("rangeStart", NumberText.label(scene.dataRange().start()));
    values.put("rangeEnd", NumberText.label(scene.dataRange().end()));
    values.put("unit", escape(settings.timeUnit()));
    values.put("laneCount", String.valueOf(scene.lanes().size()));
    values.put("taskCount", String.valueOf(taskCount));
    values.put("style", IoUtil.readResource(STYLE_RESOURCE));
    values.put("script", IoUtil.readResource(SCRIPT_RESOURCE));
    values.put("svg", svg(scene, visibility));
    values.put("laneIndex", laneIndex(scene, visibility));

    StringSubstitutor substitutor = new StringSubstitutor(values);
    substitutor.setDisableSubstitutionInValues(true);
    substitutor.setEnableUndefinedVariableException(true);
    try {
      return substitutor.replace(IoUtil.readResource(PAGE_TEMPLATE));
    } catch (IllegalArgumentException e) {
      throw new RenderException("Page template references an unknown value", e);
    }
  }

  String svg(Scene scene, LaneVisibilityState visibility) {
    StringBuilder out = new StringBuilder(scene.items().size() * 256);
    out.append("<svg xmlns=\"http://www.w3.org/2000/svg\" id=\"timeline\"")
        .append(" width=\"").append(NumberText.coord(scene.width())).append('"')
        .append(" height=\"").append(NumberText.coord(scene.height())).append('"')
        .append(" data-unit=\"").append(escape(settings.timeUnit())).append("\">\n");
    appendRuler(out, scene);
    for (DrawableItem item : scene.items()) {
      boolean visible = visibility.isVisible(item);
      if (item instanceof LaneHeader header) {
        LaneBand band = scene.lanes().get(header.laneIndex());
        appendLane(out, header, band, visibility.state(header.lane()));
      } else if (item instanceof TaskShape task) {
        appendTask(out, task, visible);
      } else if (item instanceof OverheadShape overhead) {
        appendOverhead(out, overhead, visible);
      }
    }
    out.append("</svg>");
    return out.toString();
  }

  private void appendRuler(StringBuilder out, Scene scene) {
    double top = layout.headerHeight() - 8;
    double bottom = scene.height() - layout.bottomMargin();
    out.append("<g class=\"ruler\">\n");
    for (RulerTick tick : scene.ticks()) {
      String x = NumberText.coord(tick.x());
      out.append("<line x1=\"").append(x).append("\" y1=\"").append(NumberText.coord(top))
          .append("\" x2=\"").append(x).append("\" y2=\"").append(NumberText.coord(bottom))
          .append("\"/>\n");
      out.append("<text x=\"").append(x).append("\" y=\"")
          .append(NumberText.coord(top - 6)).append("\">")
          .append(NumberText.label(tick.time())).append(' ').append(escape(settings.timeUnit()))
          .append("</text>\n");
    }
    out.append("</g>\n");
  }

  private void appendLane(
      StringBuilder out, LaneHeader header, LaneBand band, DisclosureState state) {
    boolean collapsed = state == DisclosureState.COLLAPSED;
    double labelY = header.y() + Math.min(layout.rowPitch(), header.height()) / 2 + 4;
    out.append("<g class=\"lane\" data-lane=\"").append(header.laneIndex()).append("\">\n");
    out.append("<rect class=\"lane-bg\"")
        .append(box(header.x(), header.y(), header.width(), header.height()))
        .append(" fill=\"").append(header.alternate() ? LANE_FILL_ALTERNATE : LANE_FILL)
        .append("\"/>\n");
    out.append("<text class=\"lane-label\" data-lane=\"").append(header.laneIndex())
        .append("\" x=\"8\" y=\"").append(NumberText.coord(labelY)).append("\">")
        .append("<tspan class=\"glyph\">").append(state.glyph()).append("</tspan> ")
        .append(escape(truncate(header.lane())))
        .append("<title>").append(escape(header.lane())).append("</title></text>\n");
    out.append("<polyline class=\"density\" data-lane=\"").append(header.laneIndex())
        .append("\" points=\"").append(sparkline(band)).append('"');
    if (!collapsed) {
      out.append(" style=\"display:none\"");
    }
    out.append("/>\n</g>\n");
  }

  /** Density polyline across the drawable width, in the lane's first row. */
  String sparkline(LaneBand band) {
    DensityHistogram density = band.density();
    int bins = density.binCount();
    double max = Math.max(1, density.max());
    double base = band.top() + layout.rowHeight();
    double amplitude = Math.max(1, layout.rowHeight() - 4);
    double step = layout.drawableWidth() / bins;
    StringBuilder points = new StringBuilder(bins * 12);
    for (int b = 0; b < bins; b++) {
      if (b > 0) {
        points.append(' ');
      }
      double x = layout.leftMargin() + (b + 0.5) * step;
      double y = base - density.count(b) / max * amplitude;
      points.append(NumberText.coord(x)).append(',').append(NumberText.coord(y));
    }
    return points.toString();
  }

  private void appendTask(StringBuilder out, TaskShape task, boolean visible) {
    out.append("<rect class=\"task lane-item hoverable\"")
        .append(itemData(task, task.label(), task.start(), task.end()))
        .append(box(task.x(), task.y(), task.width(), task.height()))
        .append(" fill=\"").append(task.color().css()).append('"')
        .append(hidden(visible))
        .append("/>\n");
    if (task.width() > layout.labelMinWidth()) {
      out.append("<text class=\"task-label lane-item\" data-lane=\"").append(task.laneIndex())
          .append("\" data-cy=\"").append(NumberText.coord(task.centerY()))
          .append("\" x=\"").append(NumberText.coord(task.x() + 3))
          .append("\" y=\"").append(NumberText.coord(task.y() + task.height() * 0.7)).append('"')
          .append(hidden(visible)).append('>')
          .append(escape(truncate(task.label())))
          .append("</text>\n");
    }
  }

  private void appendOverhead(StringBuilder out, OverheadShape overhead, boolean visible) {
    out.append("<rect class=\"overhead lane-item hoverable\"")
        .append(itemData(overhead, overhead.label(), overhead.start(), overhead.end()))
        .append(box(overhead.x(), overhead.y(), overhead.width(), overhead.height()))
        .append(" fill=\"").append(escape(settings.overheadColor())).append('"')
        .append(hidden(visible))
        .append("/>\n");
  }

  private static String itemData(DrawableItem item, String label, double start, double end) {
    return " data-lane=\"" + item.laneIndex() + '"'
        + " data-lane-id=\"" + escape(item.lane()) + '"'
        + " data-cy=\"" + NumberText.coord(item.centerY()) + '"'
        + " data-label=\"" + escape(label) + '"'
        + " data-start=\"" + NumberText.plain(start) + '"'
        + " data-end=\"" + NumberText.plain(end) + '"';
  }

  private static String box(double x, double y, double width, double height) {
    return " x=\"" + NumberText.coord(x) + "\" y=\"" + NumberText.coord(y)
        + "\" width=\"" + NumberText.coord(width) + "\" height=\"" + NumberText.coord(height)
        + '"';
  }

  private static String hidden(boolean visible) {
    return visible ? "" : " style=\"display:none\"";
  }

  /** Lane index for the viewer, safe to embed inside a script element. */
  String laneIndex(Scene scene, LaneVisibilityState visibility) {
    List<LaneIndexEntry> entries =
        scene.lanes().stream()
            .map(
                band ->
                    new LaneIndexEntry(
                        band.lane(),
                        band.index(),
                        band.firstGlobalRow(),
                        band.rowCount(),
                        band.top(),
                        band.bottom(),
                        visibility.state(band.lane()) == DisclosureState.COLLAPSED))
            .toList();
    try {
      String json = JacksonUtility.getJsonMapper().writeValueAsString(entries);
      return json.replace("<", "\\u003c");
    } catch (JsonProcessingException e) {
      throw new RenderException("Failed to serialize lane index", e);
    }
  }

  String truncate(String text) {
    int max = layout.labelMaxChars();
    if (max < 2) {
      return StringUtils.left(text, max);
    }
    return StringUtils.abbreviate(text, ELLIPSIS, max);
  }

  private static String escape(String text) {
    return StringEscapeUtils.escapeXml10(text);
  }

  record LaneIndexEntry(
      @JsonProperty("lane") String lane,
      @JsonProperty("index") int index,
      @JsonProperty("first_row") int firstRow,
      @JsonProperty("rows") int rows,
      @JsonProperty("top") double top,
      @JsonProperty("bottom") double bottom,
      @JsonProperty("collapsed") boolean collapsed) {}
}
