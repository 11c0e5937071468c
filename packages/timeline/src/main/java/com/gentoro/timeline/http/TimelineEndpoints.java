package com.gentoro.timeline.http;

import com.gentoro.timeline.render.RenderedArtifact;
import com.gentoro.timeline.render.StructuredDocumentRenderer;
import java.util.Set;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** Mounts the rendered page, its structured document and a health check on a server. */
public class TimelineEndpoints {
  private static final org.slf4j.Logger log =
      com.gentoro.timeline.logging.LoggingService.getLogger(TimelineEndpoints.class);

  public static final String PAGE_PATH = "/";
  public static final String DOCUMENT_PATH = "/" + StructuredDocumentRenderer.FILE_NAME;
  public static final String HEALTH_PATH = "/health";

  private final EmbeddedJettyServer server;
  private final RenderedArtifact page;
  private final RenderedArtifact document;
  private final int lanes;
  private final int tasks;

  public TimelineEndpoints(
      EmbeddedJettyServer server,
      RenderedArtifact page,
      RenderedArtifact document,
      int lanes,
      int tasks) {
    this.server = server;
    this.page = page;
    this.document = document;
    this.lanes = lanes;
    this.tasks = tasks;
  }

  public void register() {
    ServletContextHandler context = server.getContextHandler();
    context.addServlet(
        new ServletHolder(new ArtifactServlet(page, Set.of(PAGE_PATH, "/index.html"))),
        PAGE_PATH);
    context.addServlet(new ServletHolder(new ArtifactServlet(document)), DOCUMENT_PATH);
    context.addServlet(new ServletHolder(new HealthServlet(lanes, tasks)), HEALTH_PATH);
    log.debug("Registered {}, {} and {}", PAGE_PATH, DOCUMENT_PATH, HEALTH_PATH);
  }
}
