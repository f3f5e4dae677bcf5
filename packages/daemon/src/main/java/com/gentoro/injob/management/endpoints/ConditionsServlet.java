package com.gentoro.injob.management.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.injob.daemon.Daemon;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Condition signals.
 *
 * <ul>
 *   <li>GET /mng/conditions: all conditions with their last assertion time
 *   <li>PUT /mng/conditions/{name}[?at=millis]: assert a condition
 *   <li>DELETE /mng/conditions/{name}: clear a condition
 * </ul>
 */
public final class ConditionsServlet extends HttpServlet {
  private final Daemon daemon;
  private final ObjectMapper mapper = new ObjectMapper();

  public ConditionsServlet(Daemon daemon) {
    this.daemon = daemon;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String name = conditionName(req);
    if (name == null) {
      writeJson(resp, daemon.conditions());
      return;
    }
    var at = daemon.conditionTime(name);
    if (at.isEmpty()) {
      resp.sendError(404, "Unknown condition");
      return;
    }
    var node = mapper.createObjectNode();
    node.put("name", name);
    node.put("at", at.get());
    writeJson(resp, node);
  }

  @Override
  protected void doPut(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String name = conditionName(req);
    if (name == null) {
      resp.sendError(400, "Missing condition name");
      return;
    }
    String at = req.getParameter("at");
    if (at == null || at.isBlank()) {
      daemon.assertCondition(name);
    } else {
      try {
        daemon.assertCondition(name, Long.parseLong(at.trim()));
      } catch (NumberFormatException e) {
        resp.sendError(400, "Invalid 'at' timestamp");
        return;
      }
    }
    resp.setStatus(204);
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String name = conditionName(req);
    if (name == null) {
      resp.sendError(400, "Missing condition name");
      return;
    }
    daemon.clearCondition(name);
    resp.setStatus(204);
  }

  private static String conditionName(HttpServletRequest req) {
    String path = req.getPathInfo();
    if (path == null || path.length() <= 1) {
      return null;
    }
    String name = path.substring(1);
    return name.isBlank() || name.contains("/") ? null : name;
  }

  private void writeJson(HttpServletResponse resp, Object body) throws IOException {
    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(body));
  }
}
