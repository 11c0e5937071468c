package com.gentoro.timeline.render;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.timeline.exception.RenderException;
import com.gentoro.timeline.layout.ColorResolver;
import com.gentoro.timeline.layout.TimeRange;
import com.gentoro.timeline.logging.LoggingService;
import com.gentoro.timeline.model.TaskRecord;
import com.gentoro.timeline.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;

/**
 * Emits the trace as a JSON document grouped by lane.
 *
 * <p>Lanes are sorted lexicographically, tasks keep ingestion order. The document carries no
 * rows or pixel coordinates: a viewer lays it out on its own.
 */
public class StructuredDocumentRenderer implements TimelineRenderer {
  private static final Logger log = LoggingService.getLogger(StructuredDocumentRenderer.class);

  public static final String MEDIA_TYPE = "application/json";
  public static final String FILE_NAME = "trace.json";

  private final RenderSettings settings;
  private final ObjectMapper mapper;

  public StructuredDocumentRenderer(RenderSettings settings) {
    this(settings, JacksonUtility.getJsonMapper());
  }

  StructuredDocumentRenderer(RenderSettings settings, ObjectMapper mapper) {
    this.settings = settings;
    this.mapper = mapper;
  }

  @Override
  public RenderedArtifact render(List<TaskRecord> tasks) {
    TraceDocument document = document(tasks);
    try {
      String json = mapper.writeValueAsString(document);
      log.debug("Structured document: {} lane(s), {} task(s)", document.lanes().size(), tasks.size());
      return new RenderedArtifact(json, MEDIA_TYPE, FILE_NAME);
    } catch (JsonProcessingException e) {
      throw new RenderException("Failed to serialize trace document", e);
    }
  }

  /** Builds the document tree without serializing it. */
  public TraceDocument document(List<TaskRecord> tasks) {
    TimeRange range = TimeRange.covering(tasks);
    Map<String, List<TaskDocument>> byLane = new TreeMap<>();
    for (TaskRecord t : tasks) {
      byLane.computeIfAbsent(t.lane(), k -> new ArrayList<>()).add(TaskDocument.of(t));
    }
    List<LaneDocument> lanes = new ArrayList<>(byLane.size());
    byLane.forEach((id, laneTasks) -> lanes.add(new LaneDocument(id, laneTasks)));
    return new TraceDocument(range.start(), range.end(), settings.timeUnit(), lanes);
  }

  public record TraceDocument(
      @JsonProperty("global_start") double globalStart,
      @JsonProperty("global_end") double globalEnd,
      @JsonProperty("unit") String unit,
      @JsonProperty("lanes") List<LaneDocument> lanes) {}

  public record LaneDocument(
      @JsonProperty("id") String id, @JsonProperty("tasks") List<TaskDocument> tasks) {}

  public record TaskDocument(
      @JsonProperty("start") double start,
      @JsonProperty("end") double end,
      @JsonProperty("name") String name,
      @JsonProperty("label") String label,
      @JsonProperty("args") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> args,
      @JsonProperty("overhead_duration") Double overheadDuration,
      @JsonProperty("color") Long color,
      @JsonProperty("fill") String fill) {

    static TaskDocument of(TaskRecord t) {
      return new TaskDocument(
          t.start(),
          t.end(),
          t.name(),
          t.label(),
          t.args(),
          t.overheadDuration(),
          t.explicitColor(),
          ColorResolver.resolve(t).css());
    }
  }
}
