// This file is part of TSRead.
// Copyright (C) 2024  The TSRead Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsread.tsd;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xnio.Options;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.accesslog.AccessLogHandler;
import io.undertow.server.handlers.accesslog.AccessLogReceiver;
import net.tsread.configuration.Configuration;
import net.tsread.query.execution.RemoteReadExecutor;
import net.tsread.storage.MemoryQueryable;
import net.tsread.storage.Queryable;

/**
 * A simple main method that serves the remote read endpoint over an 
 * in-memory storage with the Undertow HTTP server.
 * 
 * @since 1.0
 */
public class RemoteReadMain {
  private static Logger LOG = LoggerFactory.getLogger(RemoteReadMain.class);
  
  /** Property keys */
  public static final String HTTP_PORT_KEY = "tsd.network.port";
  public static final String BIND_KEY = "tsd.network.bind";
  public static final String PATH_KEY = "tsd.http.remote_read.path";
  public static final String READ_TO_KEY = "tsd.network.read_timeout";
  public static final String WRITE_TO_KEY = "tsd.network.write_timeout";
  
  /** Defaults */
  public static final int DEFAULT_PORT = 4242;
  public static final String DEFAULT_PATH = "/api/v1/read";
  
  /** The Undertow server reference. Static so we can shutdown gracefully. */
  private static Undertow server = null;
  
  /** The executor reference. Static so we can shutdown gracefully. */
  private static RemoteReadExecutor executor = null;
  
  /**
   * Parses the configuration and starts the server.
   * @param args CLI args in the form {@code --key=value}.
   */
  public static void main(final String[] args) {
    try {
      System.in.close();  // Release a FD we don't need.
    } catch (Exception e) {
      LOG.warn("Failed to close stdin", e);
    }
    
    final Configuration config = new Configuration(args);
    registerConfigs(config);
    
    final int port = config.getInt(HTTP_PORT_KEY);
    if (port < 1) {
      System.err.println("Must provide an HTTP port.");
      System.exit(1);
    }
    
    // make sure to shutdown gracefully.
    registerShutdownHook();
    
    try {
      server = buildServer(config, new MemoryQueryable());
      server.start();
      LOG.info("Undertow server successfully started, listening on " 
          + config.getString(BIND_KEY) + ":" + port 
          + config.getString(PATH_KEY));
    } catch (IllegalArgumentException e) {
      LOG.error("Invalid configuration", e);
      System.exit(1);
    } catch (Exception e) {
      LOG.error("Unexpected exception starting server", e);
      System.exit(1);
    }
  }
  
  /**
   * Registers the server keys if they aren't registered yet.
   * @param config A non-null configuration.
   */
  static void registerConfigs(final Configuration config) {
    if (!config.hasProperty(HTTP_PORT_KEY)) {
      config.register(HTTP_PORT_KEY, DEFAULT_PORT, false, 
          "A port to listen on for HTTP requests.");
    }
    if (!config.hasProperty(BIND_KEY)) {
      config.register(BIND_KEY, "0.0.0.0", false, 
          "The IP to bind listeners to.");
    }
    if (!config.hasProperty(PATH_KEY)) {
      config.register(PATH_KEY, DEFAULT_PATH, false, 
          "The path serving Prometheus remote read requests.");
    }
    if (!config.hasProperty(READ_TO_KEY)) {
      config.register(READ_TO_KEY, 5 * 60 * 1000, false, 
          "A timeout in milliseconds for reading data from a client after "
          + "which Undertow will close the connection.");
    }
    if (!config.hasProperty(WRITE_TO_KEY)) {
      config.register(WRITE_TO_KEY, 5 * 60 * 1000, false, 
          "A timeout in milliseconds for writing data to a client after "
          + "which Undertow will close the connection.");
    }
  }
  
  /**
   * Builds, but doesn't start, a server for the storage.
   * @param config A non-null configuration.
   * @param queryable A non-null storage.
   * @return The server.
   * @throws IllegalArgumentException if a setting was invalid.
   */
  static Undertow buildServer(final Configuration config, 
                              final Queryable queryable) {
    registerConfigs(config);
    executor = new RemoteReadExecutor(config, queryable);
    HttpHandler handler = new RemoteReadHandler(config, executor);
    handler = Handlers.path()
        .addExactPath(config.getString(PATH_KEY), handler);
    handler = new AccessLogHandler(
        handler,
        new Slf4jAccessLogReceiver(),
        "combined",
        RemoteReadMain.class.getClassLoader());
    
    return Undertow.builder()
        .setHandler(handler)
        .addHttpListener(config.getInt(HTTP_PORT_KEY), 
            config.getString(BIND_KEY))
        // https://issues.jboss.org/browse/UNDERTOW-991
        .setSocketOption(Options.READ_TIMEOUT, config.getInt(READ_TO_KEY))
        .setSocketOption(Options.WRITE_TIMEOUT, config.getInt(WRITE_TO_KEY))
        .build();
  }
  
  /**
   * Helper method that will attach a callback to the runtime shutdown so that
   * if we receive a SIGTERM then we can gracefully stop the web server and
   * the worker pool.
   */
  private static void registerShutdownHook() {
    final class RemoteReadShutdown extends Thread {
      public RemoteReadShutdown() {
        super("RemoteReadShutdown");
      }
      public void run() {
        try {
          if (server != null) {
            LOG.info("Stopping Undertow server");
            server.stop();
          }
          if (executor != null) {
            LOG.info("Shutting down the remote read executor");
            executor.shutdown();
          }
          LOG.info("Shutdown complete.");
        } catch (Exception e) {
          LoggerFactory.getLogger(RemoteReadShutdown.class)
            .error("Uncaught exception during shutdown", e);
        }
      }
    }
    Runtime.getRuntime().addShutdownHook(new RemoteReadShutdown());
  }

  /** Routes the access log through SLF4J. */
  public static class Slf4jAccessLogReceiver implements AccessLogReceiver {
    private static Logger ACCESS_LOG = LoggerFactory.getLogger("AccessLog");
    
    @Override
    public void logMessage(final String message) {
      ACCESS_LOG.info(message);      
    }
    
  }
}
