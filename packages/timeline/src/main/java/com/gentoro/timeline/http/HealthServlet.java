package com.gentoro.timeline.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.timeline.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET /health
 *
 * <p>Returns {@code {"status":"UP", "lanes":N, "tasks":N}} for the trace being served.
 */
public final class HealthServlet extends HttpServlet {

  private final int lanes;
  private final int tasks;
  private final transient ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public HealthServlet(int lanes, int tasks) {
    this.lanes = lanes;
    this.tasks = tasks;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "UP");
    body.put("lanes", lanes);
    body.put("tasks", tasks);

    resp.setStatus(HttpServletResponse.SC_OK);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(body));
  }
}
