package com.gentoro.injob.management.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.injob.daemon.Daemon;
import com.gentoro.injob.daemon.JobEntry;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /mng/jobs lists registered jobs, POST /mng/jobs/{name}/stop stops one. */
public final class JobsServlet extends HttpServlet {
  private final Daemon daemon;
  private final ObjectMapper mapper = new ObjectMapper();

  public JobsServlet(Daemon daemon) {
    this.daemon = daemon;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String path = req.getPathInfo();
    if (path != null && !path.equals("/")) {
      resp.sendError(404, "Unknown resource");
      return;
    }
    ArrayNode out = mapper.createArrayNode();
    for (JobEntry entry : daemon.jobs()) {
      ObjectNode node = out.addObject();
      node.put("name", entry.name());
      node.put("action", entry.action().name());
      node.put("execNum", entry.status().execNum());
      node.put("running", entry.status().running());
      if (entry.schedule() != null) node.put("schedule", entry.schedule().toString());
      ObjectNode conditions = node.putObject("conditions");
      entry.spec().conditions().forEach(conditions::put);
    }
    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(out));
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String path = req.getPathInfo();
    if (path == null || !path.endsWith("/stop") || path.length() <= "/stop".length() + 1) {
      resp.sendError(400, "Expected /jobs/{name}/stop");
      return;
    }
    String name = path.substring(1, path.length() - "/stop".length());
    if (!daemon.stopJob(name)) {
      resp.sendError(404, "Unknown job");
      return;
    }
    resp.setStatus(202);
  }
}
