package com.gentoro.injob.management.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.injob.daemon.Daemon;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /mng/daemon/report: brief report of all started jobs. */
public final class BriefReportServlet extends HttpServlet {
  private final Daemon daemon;
  private final ObjectMapper mapper = new ObjectMapper();

  public BriefReportServlet(Daemon daemon) {
    this.daemon = daemon;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(daemon.briefReport()));
  }
}
