package com.gentoro.openapimcp.http;

import com.gentoro.openapimcp.exception.ConfigException;
import com.gentoro.openapimcp.exception.ExceptionUtil;
import com.gentoro.openapimcp.exception.NetworkException;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}, used by the streamable HTTP
 * transport.
 *
 * <p>This class owns the Jetty lifecycle (prepare/start/stop) and exposes the context handler
 * so that the MCP servlet can be mounted on it.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.openapimcp.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  public static final int DEFAULT_PORT = 8080;
  public static final String ANY_HOST = "0.0.0.0";

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

  /** Reads {@code http.hostname} and {@code http.port}; a non-null {@code portOverride} wins. */
  public static EmbeddedJettyServer fromConfiguration(Configuration cfg, Integer portOverride) {
    int port;
    try {
      port = portOverride != null ? portOverride : cfg.getInt("http.port", DEFAULT_PORT);
    } catch (Exception e) {
      throw new ConfigException("Failed to resolve http.port configuration", e);
    }
    return new EmbeddedJettyServer(cfg.getString("http.hostname", ANY_HOST), port);
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }
      try {
        if (!ANY_HOST.equals(hostname)) {
          server = new Server();
          ServerConnector connector = new ServerConnector(server);
          connector.setHost(hostname);
          connector.setPort(port);
          server.addConnector(connector);
        } else {
          server = new Server(port);
        }

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException(
            "Failed to initialize Jetty on " + hostname + ":" + port + ": " + e.getMessage(), e);
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
        log.info("Starting Jetty server on {}:{}...", hostname, port);
        server.start();
        log.info("Jetty listening on http://{}:{}", hostname, getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "Failed to start Jetty on "
                        + hostname
                        + ":"
                        + port
                        + ", check that the port is available",
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) return;
      try {
        if (server.isRunning() || server.isStarting()) {
          server.stop();
        }
      } catch (Exception e) {
        // logged only, so that the remaining services still get stopped
        log.error("Error stopping Jetty server", e);
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

  /** Bound port once started (resolves an ephemeral {@code 0}), else the configured one. */
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
