package com.gentoro.reportbatch.endpoints;

import com.gentoro.reportbatch.batch.BatchOrchestrator;
import com.gentoro.reportbatch.filters.FilterOptionsService;
import com.gentoro.reportbatch.http.EmbeddedJettyServer;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** Registers the batch, filter and health servlets on the shared Jetty context. */
public final class ReportBatchServer {
  private final EmbeddedJettyServer httpServer;
  private final BatchOrchestrator orchestrator;
  private final FilterOptionsService filterOptions;

  public ReportBatchServer(
      EmbeddedJettyServer httpServer,
      BatchOrchestrator orchestrator,
      FilterOptionsService filterOptions) {
    this.httpServer = httpServer;
    this.orchestrator = orchestrator;
    this.filterOptions = filterOptions;
  }

  public void register() {
    var ctx = httpServer.getContextHandler();
    // "/batch/*" also matches "/batch" itself, with a null path info
    ctx.addServlet(new ServletHolder(new BatchServlet(orchestrator)), "/batch/*");
    ctx.addServlet(new ServletHolder(new FilterOptionsServlet(filterOptions)), "/api/report/filters");
    ctx.addServlet(new ServletHolder(new HealthServlet()), "/health");
  }
}
