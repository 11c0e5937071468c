package com.gentoro.timeline.cli;

import com.gentoro.timeline.ConfigurationProvider;
import com.gentoro.timeline.TraceTimeline;
import com.gentoro.timeline.exception.ErrorDetails;
import com.gentoro.timeline.exception.ExceptionUtil;
import com.gentoro.timeline.http.EmbeddedJettyServer;
import com.gentoro.timeline.ingest.ParseResult;
import com.gentoro.timeline.interaction.DisclosureState;
import com.gentoro.timeline.logging.LoggingService;
import com.gentoro.timeline.render.RenderedArtifact;
import com.gentoro.timeline.render.StructuredDocumentRenderer;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * {@code trace-timeline [-c <config.yaml>] [-v] <command>}.
 *
 * <p>Exit codes: 0 on success (including an input with no valid records, which produces no
 * artifact), 1 when execution fails, 2 on usage errors.
 */
@Command(
    name = "trace-timeline",
    mixinStandardHelpOptions = true,
    version = "trace-timeline 0.1.0",
    description = "Render a CSV event trace as a lane timeline",
    subcommands = {
      TimelineCommand.HtmlCommand.class,
      TimelineCommand.JsonCommand.class,
      TimelineCommand.ServeCommand.class
    })
public final class TimelineCommand implements Runnable {
  private static final Logger log = LoggingService.getLogger(TimelineCommand.class);

  static final int EXIT_FAILURE = 1;

  @Spec CommandSpec spec;

  @Option(
      names = {"-c", "--config"},
      paramLabel = "<config.yaml>",
      description = "YAML file overriding the bundled application.yaml")
  Path configFile;

  @Option(
      names = {"-v", "--verbose"},
      description = "Log at DEBUG level")
  boolean verbose;

  @Override
  public void run() {
    throw new CommandLine.ParameterException(
        spec.commandLine(), "Missing command: choose one of html, json, serve");
  }

  /** Command line with the failure handler installed. */
  public static CommandLine commandLine() {
    return new CommandLine(new TimelineCommand())
        .setExecutionExceptionHandler(TimelineCommand::handleFailure);
  }

  static int handleFailure(
      Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
    ErrorDetails details = ExceptionUtil.toErrorDetails(ex);
    log.error("{}", details.summary());
    log.debug("{} [{}] raised at {}", details.type(), details.code(), details.origin(), ex);
    return EXIT_FAILURE;
  }

  TraceTimeline timeline() {
    TraceTimeline timeline = new TraceTimeline(new ConfigurationProvider(configFile));
    if (verbose) {
      LoggingService.enableVerbose();
    }
    return timeline;
  }

  @Command(name = "html", description = "Write an interactive HTML/SVG timeline")
  static final class HtmlCommand implements Callable<Integer> {
    @ParentCommand TimelineCommand parent;

    @Parameters(index = "0", paramLabel = "<input>", description = "Trace CSV file")
    Path input;

    @Parameters(
        index = "1",
        arity = "0..1",
        paramLabel = "<output-file>",
        description = "Output file (default: output.html-file, timeline.html)")
    Path output;

    @Option(names = "--collapsed", description = "Start with every lane collapsed")
    boolean collapsed;

    @Override
    public Integer call() {
      TraceTimeline timeline = parent.timeline();
      ParseResult result = timeline.ingest(input);
      Optional<RenderedArtifact> artifact =
          timeline.render(result, timeline.visualRenderer(input, initialState(collapsed)));
      artifact.ifPresent(
          a -> timeline.write(a, output != null ? output : timeline.defaultHtmlFile()));
      return 0;
    }
  }

  @Command(name = "json", description = "Write the trace as a structured JSON document")
  static final class JsonCommand implements Callable<Integer> {
    @ParentCommand TimelineCommand parent;

    @Parameters(index = "0", paramLabel = "<input>", description = "Trace CSV file")
    Path input;

    @Parameters(
        index = "1",
        arity = "0..1",
        paramLabel = "<output-dir>",
        description = "Directory receiving trace.json (default: output.json-dir, static)")
    Path outputDir;

    @Override
    public Integer call() {
      TraceTimeline timeline = parent.timeline();
      ParseResult result = timeline.ingest(input);
      Path dir = outputDir != null ? outputDir : timeline.defaultJsonDirectory();
      timeline
          .render(result, timeline.structuredRenderer(input))
          .ifPresent(a -> timeline.write(a, dir.resolve(StructuredDocumentRenderer.FILE_NAME)));
      return 0;
    }
  }

  @Command(name = "serve", description = "Serve the timeline and trace.json over HTTP")
  static final class ServeCommand implements Callable<Integer> {
    @ParentCommand TimelineCommand parent;

    @Parameters(index = "0", paramLabel = "<input>", description = "Trace CSV file")
    Path input;

    @Option(names = "--port", description = "Listening port (default: http.port, 8080)")
    Integer port;

    @Option(names = "--host", description = "Bind address (default: http.hostname, 0.0.0.0)")
    String host;

    @Option(names = "--collapsed", description = "Start with every lane collapsed")
    boolean collapsed;

    @Override
    public Integer call() throws InterruptedException {
      TraceTimeline timeline = parent.timeline();
      Optional<EmbeddedJettyServer> started =
          timeline.serve(input, host, port, initialState(collapsed));
      if (started.isEmpty()) {
        return 0;
      }
      EmbeddedJettyServer server = started.get();
      Runtime.getRuntime()
          .addShutdownHook(new Thread(server::stop, "trace-timeline-shutdown-hook"));
      server.join();
      return 0;
    }
  }

  private static DisclosureState initialState(boolean collapsed) {
    return collapsed ? DisclosureState.COLLAPSED : DisclosureState.EXPANDED;
  }
}
