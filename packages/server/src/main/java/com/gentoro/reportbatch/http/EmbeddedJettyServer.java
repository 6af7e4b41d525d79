package com.gentoro.reportbatch.http;

import com.gentoro.reportbatch.exception.ConfigException;
import com.gentoro.reportbatch.exception.ExceptionUtil;
import com.gentoro.reportbatch.exception.NetworkException;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>Owns the Jetty lifecycle (prepare/start/stop) and exposes the context handler so endpoints
 * can register their servlets between {@link #prepare()} and {@link #start()}. Port 0 binds an
 * ephemeral port; {@link #getPort()} reports the bound one once started.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.reportbatch.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  private final String hostname;
  private final int port;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(String hostname, int port) {
    if (hostname == null || hostname.isBlank()) {
      throw new ConfigException("Missing http.hostname configuration");
    }
    if (port < 0 || port > 65535) {
      throw new ConfigException("Invalid http.port: " + port);
    }
    this.hostname = hostname.trim();
    this.port = port;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }
      try {
        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setDaemon(true);
        threadPool.setName("jetty-http");
        server = new Server(threadPool);

        ServerConnector connector = new ServerConnector(server);
        if (!hostname.equals("0.0.0.0")) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException("Failed to initialize the HTTP server", e);
      }
    }
  }

  public void start() {
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
        log.info("Jetty listening on http://{}:{}", hostname, getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "Could not start the HTTP listener on %s:%d. Check that the port is free."
                        .formatted(hostname, port),
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) return;
      Server s = server;
      try {
        if (s.isRunning() || s.isStarting()) {
          s.setStopTimeout(2000);
          s.stop();
        }
      } catch (Exception e) {
        // keep shutting down the remaining services
        log.error("Error stopping jetty server", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return server.getURI().getPort();
      }
      return port;
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
