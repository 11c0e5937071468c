package com.gentoro.timeline.http;

import com.gentoro.timeline.exception.ConfigException;
import com.gentoro.timeline.exception.NetworkException;
import com.gentoro.timeline.exception.TimelineException;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Connector;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (prepare/start/stop/join) and exposes the context handler
 * so that endpoints can register their servlets before {@link #start()}.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.timeline.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  public static final String ANY_HOST = "0.0.0.0";
  public static final int DEFAULT_PORT = 8080;

  private final String hostname;
  private final int port;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  /**
   * @param port listening port; 0 picks a free one
   */
  public EmbeddedJettyServer(String hostname, int port) {
    if (StringUtils.isBlank(hostname)) {
      throw new ConfigException("Missing http.hostname configuration");
    }
    if (port < 0 || port > 65535) {
      throw new ConfigException("http.port out of range: " + port);
    }
    this.hostname = hostname.trim();
    this.port = port;
  }

  /** Resolve {@code http.hostname} and {@code http.port}, letting non-null overrides win. */
  public static EmbeddedJettyServer fromConfiguration(
      Configuration configuration, String hostOverride, Integer portOverride) {
    int port;
    try {
      port =
          portOverride != null
              ? portOverride
              : configuration.getInt("http.port", DEFAULT_PORT);
      log.trace("Resolving http.port: {}", port);
    } catch (Exception e) {
      throw new ConfigException("Failed to resolve http.port configuration", e);
    }
    String hostname =
        hostOverride != null ? hostOverride : configuration.getString("http.hostname", ANY_HOST);
    log.trace("Resolving http.hostname: {}", hostname);
    return new EmbeddedJettyServer(hostname, port);
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }
      try {
        // Daemon threads so the JVM can exit once the main thread is done.
        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setDaemon(true);
        threadPool.setName("jetty-http");

        server = new Server(threadPool);
        ServerConnector connector = new ServerConnector(server);
        if (!ANY_HOST.equals(hostname)) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException(
            "There was a problem while attempting to initialize the HTTP server on "
                + hostname
                + ":"
                + port,
            e);
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
        log.info("Timeline available at http://{}:{}/", displayHost(), getPort());
      } catch (TimelineException e) {
        throw e;
      } catch (Exception e) {
        throw new NetworkException("Could not start the HTTP server, is the port available?", e)
            .withContext("host", hostname)
            .withContext("port", port);
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) {
        return;
      }
      Server s = server;
      try {
        if (s.isRunning() || s.isStarting()) {
          s.setStopTimeout(2000);
          s.stop();
        }
      } catch (Exception e) {
        log.error("Error stopping HTTP server; continuing shutdown", e);
      } finally {
        server = null;
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

  /** Bound port once started, the configured one before. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        for (Connector connector : server.getConnectors()) {
          if (connector instanceof ServerConnector serverConnector) {
            return serverConnector.getLocalPort();
          }
        }
      }
      return port;
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      if (contextHandler == null) {
        throw new IllegalStateException("Server not prepared");
      }
      return contextHandler;
    }
  }

  private String displayHost() {
    return ANY_HOST.equals(hostname) ? "localhost" : hostname;
  }

  @Override
  public void close() {
    stop();
  }
}
