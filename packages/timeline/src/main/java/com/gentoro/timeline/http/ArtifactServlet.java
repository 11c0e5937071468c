package com.gentoro.timeline.http;

import com.gentoro.timeline.render.RenderedArtifact;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * GET of a document rendered once at startup.
 *
 * <p>When {@code paths} is non-empty, requests whose servlet path is not listed get a 404. This
 * lets the page be mounted on the default mapping without answering for every URL.
 */
public final class ArtifactServlet extends HttpServlet {

  private final transient RenderedArtifact artifact;
  private final Set<String> paths;

  public ArtifactServlet(RenderedArtifact artifact) {
    this(artifact, Set.of());
  }

  public ArtifactServlet(RenderedArtifact artifact, Set<String> paths) {
    this.artifact = artifact;
    this.paths = Set.copyOf(paths);
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    if (!paths.isEmpty() && !paths.contains(path(req))) {
      resp.sendError(HttpServletResponse.SC_NOT_FOUND);
      return;
    }
    resp.setStatus(HttpServletResponse.SC_OK);
    resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
    resp.setContentType(artifact.mediaType());
    resp.setHeader("Cache-Control", "no-cache");
    resp.getWriter().write(artifact.content());
  }

  private static String path(HttpServletRequest req) {
    String servletPath = req.getServletPath() == null ? "" : req.getServletPath();
    String pathInfo = req.getPathInfo() == null ? "" : req.getPathInfo();
    String path = servletPath + pathInfo;
    return path.isEmpty() ? "/" : path;
  }
}
