package com.proxypool;

public class ProxyPoolApp {

  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(ProxyPoolApp.class);

  public static void main(String[] args) {
    try {
      ProxyPool app = new ProxyPool(args);
      app.initialize();
      if (app.isOneShot()) {
        app.shutdown();
        return;
      }
      // Keep the coordinator or worker running until shutdown signal
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
