package com.gentoro.injob;

public class InJobApp {

  private static final org.slf4j.Logger log =
      com.gentoro.injob.logging.LoggingService.getLogger(InJobApp.class);

  public static void main(String[] args) {
    try {
      InJob app = new InJob(args);
      app.initialize();
      // Keep the daemon running until shutdown signal
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
