package com.gentoro.injob.management;

import com.gentoro.injob.InJob;
import com.gentoro.injob.daemon.Daemon;
import com.gentoro.injob.management.endpoints.BriefReportServlet;
import com.gentoro.injob.management.endpoints.ConditionsServlet;
import com.gentoro.injob.management.endpoints.JobsServlet;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Registers the daemon's management endpoints with the shared Jetty context:
 *
 * <ul>
 *   <li>{@code GET {ctx}/daemon/report} brief report
 *   <li>{@code GET|PUT|DELETE {ctx}/conditions[/{name}]} external condition signals
 *   <li>{@code GET {ctx}/jobs}, {@code POST {ctx}/jobs/{name}/stop} job administration
 * </ul>
 */
public final class ManagementServer {

  private final InJob inJob;

  public ManagementServer(InJob inJob) {
    this.inJob = inJob;
  }

  private String contextPath() {
    String path = inJob.configuration().getString("http.management.context-path", "/mng");
    if (path == null || path.isBlank() || "/".equals(path.trim())) {
      return "";
    }
    path = path.trim();
    if (!path.startsWith("/")) path = "/" + path;
    return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
  }

  /** Register all management-related servlets with the Jetty context handler. */
  public void register() {
    var ctx = inJob.httpServer().getContextHandler();
    Daemon daemon = inJob.daemon();

    ctx.addServlet(
        new ServletHolder(new BriefReportServlet(daemon)),
        "%s/daemon/report".formatted(contextPath()));
    ctx.addServlet(
        new ServletHolder(new ConditionsServlet(daemon)),
        "%s/conditions/*".formatted(contextPath()));
    ctx.addServlet(
        new ServletHolder(new JobsServlet(daemon)), "%s/jobs/*".formatted(contextPath()));
  }
}
