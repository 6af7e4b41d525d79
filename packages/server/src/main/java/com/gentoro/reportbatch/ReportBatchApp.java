package com.gentoro.reportbatch;

public class ReportBatchApp {

  private static final org.slf4j.Logger log =
      com.gentoro.reportbatch.logging.LoggingService.getLogger(ReportBatchApp.class);

  public static void main(String[] args) {
    try {
      ReportBatch app = new ReportBatch(args);
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
