package com.gentoro.timeline;

import com.gentoro.timeline.format.PrintfLabelFormatter;
import com.gentoro.timeline.http.EmbeddedJettyServer;
import com.gentoro.timeline.http.TimelineEndpoints;
import com.gentoro.timeline.ingest.ParseResult;
import com.gentoro.timeline.ingest.TraceCsvParser;
import com.gentoro.timeline.interaction.DisclosureState;
import com.gentoro.timeline.layout.LayoutSettings;
import com.gentoro.timeline.logging.LoggingService;
import com.gentoro.timeline.model.TaskRecord;
import com.gentoro.timeline.render.RenderSettings;
import com.gentoro.timeline.render.RenderedArtifact;
import com.gentoro.timeline.render.StructuredDocumentRenderer;
import com.gentoro.timeline.render.TimelineRenderer;
import com.gentoro.timeline.render.VisualDocumentRenderer;
import com.gentoro.timeline.utility.IoUtil;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/**
 * Wires configuration, ingestion and rendering together.
 *
 * <p>One instance serves one invocation: ingest a trace, render it with one of the renderers and
 * write or serve the result.
 */
public class TraceTimeline {
  private static final org.slf4j.Logger log = LoggingService.getLogger(TraceTimeline.class);

  private final Configuration configuration;
  private final LayoutSettings layout;
  private final TraceCsvParser parser;

  public TraceTimeline(ConfigurationProvider configurationProvider) {
    this.configuration = configurationProvider.config();
    // Apply logging levels before anything else logs.
    LoggingService.applyConfiguration(configuration);
    this.layout = LayoutSettings.fromConfiguration(configuration);
    this.parser = new TraceCsvParser(new PrintfLabelFormatter());
  }

  public ParseResult ingest(Path input) {
    ParseResult result = parser.parse(input);
    log.info(
        "Read {} task(s) from {}, skipped {} line(s)",
        result.tasks().size(),
        input,
        result.diagnostics().size());
    return result;
  }

  public StructuredDocumentRenderer structuredRenderer(Path input) {
    return new StructuredDocumentRenderer(renderSettings(input));
  }

  public VisualDocumentRenderer visualRenderer(Path input, DisclosureState initialState) {
    return new VisualDocumentRenderer(layout, renderSettings(input), initialState);
  }

  /**
   * Render {@code result} unless it holds no valid records.
   *
   * @return the artifact, or empty when there is nothing to draw
   */
  public Optional<RenderedArtifact> render(ParseResult result, TimelineRenderer renderer) {
    if (result.isEmpty()) {
      log.error("No valid task records in input; nothing to render");
      return Optional.empty();
    }
    return Optional.of(renderer.render(result.tasks()));
  }

  public Path write(RenderedArtifact artifact, Path destination) {
    Path written = IoUtil.writeString(destination, artifact.content());
    log.info("Wrote {} ({} bytes)", written, artifact.bytes().length);
    return written;
  }

  /**
   * Render both documents once and serve them over HTTP.
   *
   * @param host overrides {@code http.hostname} when non-null
   * @param port overrides {@code http.port} when non-null
   * @return the started server, or empty when the input holds no valid records
   */
  public Optional<EmbeddedJettyServer> serve(
      Path input, String host, Integer port, DisclosureState initialState) {
    ParseResult result = ingest(input);
    Optional<RenderedArtifact> page = render(result, visualRenderer(input, initialState));
    if (page.isEmpty()) {
      return Optional.empty();
    }
    RenderedArtifact document = structuredRenderer(input).render(result.tasks());
    int lanes = (int) result.tasks().stream().map(TaskRecord::lane).distinct().count();

    EmbeddedJettyServer server = EmbeddedJettyServer.fromConfiguration(configuration, host, port);
    server.prepare();
    new TimelineEndpoints(server, page.get(), document, lanes, result.tasks().size()).register();
    try {
      server.start();
    } catch (RuntimeException e) {
      server.stop();
      throw e;
    }
    return Optional.of(server);
  }

  /** HTML output file from {@code output.html-file}. */
  public Path defaultHtmlFile() {
    return Path.of(configuration.getString("output.html-file", VisualDocumentRenderer.FILE_NAME));
  }

  /** JSON output directory from {@code output.json-dir}. */
  public Path defaultJsonDirectory() {
    return Path.of(configuration.getString("output.json-dir", "static"));
  }

  private RenderSettings renderSettings(Path input) {
    Path fileName = input == null ? null : input.getFileName();
    return RenderSettings.fromConfiguration(
        configuration, fileName == null ? null : fileName.toString());
  }
}
