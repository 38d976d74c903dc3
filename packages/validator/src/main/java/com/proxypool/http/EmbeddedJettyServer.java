package com.proxypool.http;

import com.proxypool.exception.ConfigException;
import com.proxypool.exception.ExceptionUtil;
import com.proxypool.exception.NetworkException;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (prepare/start/stop/join) and exposes the underlying
 * {@link ServletContextHandler} so that the coordinator control plane can register its servlets.
 * Port and bind address come from {@code http.port} (default 8000) and {@code http.hostname}
 * (default 0.0.0.0). A port of 0 binds an ephemeral port, see {@link #getPort()}.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(EmbeddedJettyServer.class);
  public static final int DEFAULT_PORT = 8000;

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServerConnector connector;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    log.trace("Initializing control plane Jetty server");
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = configuration.getInt("http.port", DEFAULT_PORT);
        log.trace("Resolving http.port: {}", port);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }
      if (port < 0 || port > 65535) {
        throw new ConfigException("http.port out of range: " + port);
      }

      String hostname;
      try {
        hostname = configuration.getString("http.hostname", "0.0.0.0");
        if (Objects.isNull(hostname) || hostname.isBlank()) {
          throw new ConfigException("Missing http.hostname configuration");
        }
        hostname = hostname.trim();
        log.trace("Resolving http.hostname: {}", hostname);
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ConfigException("Failed to resolve http.hostname configuration", ex));
      }

      try {
        // Daemon threads so that a worker-less coordinator JVM can still exit on shutdown
        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setDaemon(true);
        threadPool.setName("coordinator-http");

        server = new Server(threadPool);
        connector = new ServerConnector(server);
        if (!hostname.equals("0.0.0.0")) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException(
            "There was a problem while attempting to initialize the control plane server. "
                + "Please, check that the chosen port and hostname are available",
            e);
      }
    }
  }

  /** Start Jetty if not already started. Calls {@link #prepare()} when needed. */
  public void start() {
    log.trace("Starting control plane Jetty server");
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }

      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }

      try {
        server.start();
        log.info("Control plane listening on http://{}:{}", hostLabel(), connector.getLocalPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "There was a problem while attempting to start the control plane server. "
                        + "Please, check that the chosen port and hostname are available",
                    ex));
      }
    }
  }

  public void stop() {
    log.trace("Stopping control plane Jetty server");
    synchronized (lifecycleLock) {
      if (server == null) {
        return;
      }
      Server s = server;
      try {
        if (s.isRunning() || s.isStarted() || s.isStarting()) {
          s.setStopTimeout(2000);
          s.stop();
        }
      } catch (Exception e) {
        log.error(
            "Error stopping jetty server, exception was captured and logged so that other "
                + "services can still stop.",
            e);
      } finally {
        server = null;
        connector = null;
        contextHandler = null;
      }
    }
  }

  public void join() throws InterruptedException {
    Server s;
    synchronized (lifecycleLock) {
      s = this.server;
    }
    if (s != null) s.join();
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** The bound port once started, otherwise the configured one. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted() && connector != null) {
        return connector.getLocalPort();
      }
      return configuration.getInt("http.port", DEFAULT_PORT);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      if (contextHandler == null) {
        throw new com.proxypool.exception.StateException(
            "Jetty server not prepared. Call prepare() first.");
      }
      return contextHandler;
    }
  }

  private String hostLabel() {
    String host = connector.getHost();
    return host == null ? "0.0.0.0" : host;
  }

  @Override
  public void close() {
    stop();
  }
}
