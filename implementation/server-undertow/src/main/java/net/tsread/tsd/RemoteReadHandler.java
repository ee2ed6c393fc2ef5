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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xnio.IoUtils;
import org.xnio.conduits.ConduitStreamSourceChannel;
import org.xnio.conduits.ReadReadyHandler;
import org.xnio.conduits.StreamSourceConduit;

import com.stumbleupon.async.TimeoutException;

import io.undertow.server.ExchangeCompletionListener;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.ServerConnection;
import io.undertow.server.protocol.http.HttpServerConnection;
import io.undertow.util.AttachmentKey;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;
import net.tsread.configuration.Configuration;
import net.tsread.exceptions.EncodingFailureException;
import net.tsread.exceptions.QueryExecutionException;
import net.tsread.exceptions.SerdesException;
import net.tsread.query.QueryContext;
import net.tsread.query.ReadRequest;
import net.tsread.query.ReadResponse;
import net.tsread.query.execution.RemoteReadExecution;
import net.tsread.query.execution.RemoteReadExecutor;
import net.tsread.query.serdes.RemoteReadSerdes;

/**
 * Serves the Prometheus remote read endpoint. The body is decoded before 
 * anything is dispatched, the sub-queries are fanned out through the 
 * {@link RemoteReadExecutor} and the response is fully encoded before any 
 * header is written so a failure can still change the status.
 * 
 * @since 1.0
 */
public class RemoteReadHandler implements HttpHandler {
  private static final Logger LOG = LoggerFactory.getLogger(
      RemoteReadHandler.class);
  
  public static final String MAX_REQUEST_BYTES_KEY = 
      RemoteReadExecutor.KEY_PREFIX + "max_request_bytes";
  public static final String TIMEOUT_KEY = 
      RemoteReadExecutor.KEY_PREFIX + "timeout";
  
  /** The close listener of a connection, registered once per connection. */
  static final AttachmentKey<CancelOnClose> CANCEL_ON_CLOSE = 
      AttachmentKey.create(CancelOnClose.class);
  
  /** The disconnect watcher of an exchange while its query runs. */
  static final AttachmentKey<DisconnectWatcher> DISCONNECT_WATCHER = 
      AttachmentKey.create(DisconnectWatcher.class);
  
  /** Used to build the query context IDs. */
  private static final AtomicLong REQUEST_IDS = new AtomicLong();
  
  /** The fan-out executor. */
  private final RemoteReadExecutor executor;
  
  /** The request size ceiling. */
  private final int max_request_bytes;
  
  /** How long to wait for the fan-out in milliseconds. */
  private final long timeout;
  
  /**
   * Default ctor.
   * @param config A non-null configuration to register and read from.
   * @param executor A non-null executor.
   * @throws IllegalArgumentException if a parameter was null or a setting
   * was invalid.
   */
  public RemoteReadHandler(final Configuration config, 
                           final RemoteReadExecutor executor) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null.");
    }
    if (!config.hasProperty(MAX_REQUEST_BYTES_KEY)) {
      config.register(MAX_REQUEST_BYTES_KEY, 
          RemoteReadSerdes.DEFAULT_MAX_REQUEST_BYTES, false, 
          "The maximum size in bytes of a remote read request, both "
          + "compressed and decompressed.");
    }
    if (!config.hasProperty(TIMEOUT_KEY)) {
      config.register(TIMEOUT_KEY, 120000L, false, 
          "How long, in milliseconds, to wait for all of the sub-queries of "
          + "a remote read request before canceling and returning a 504.");
    }
    this.executor = executor;
    max_request_bytes = config.getInt(MAX_REQUEST_BYTES_KEY);
    timeout = config.getLong(TIMEOUT_KEY);
    if (max_request_bytes < 1) {
      throw new IllegalArgumentException("Max request bytes must be greater "
          + "than 0: " + max_request_bytes);
    }
    if (timeout < 1) {
      throw new IllegalArgumentException("Timeout must be greater than 0: " 
          + timeout);
    }
  }
  
  @Override
  public void handleRequest(final HttpServerExchange exchange) throws Exception {
    if (exchange.isInIoThread()) {
      exchange.dispatch(this);
      return;
    }
    if (!exchange.getRequestMethod().equals(Methods.POST)) {
      exchange.getResponseHeaders().put(Headers.ALLOW, Methods.POST_STRING);
      sendError(exchange, StatusCodes.METHOD_NOT_ALLOWED, 
          "Method not allowed: " + exchange.getRequestMethod());
      return;
    }
    exchange.startBlocking();
    
    final ReadRequest request;
    try {
      request = RemoteReadSerdes.deserialize(exchange.getInputStream(), 
          exchange.getRequestContentLength(), max_request_bytes);
    } catch (SerdesException e) {
      LOG.error("Failed to decode remote read request from " 
          + exchange.getSourceAddress() + ": " + e.getMessage());
      sendError(exchange, e.getStatusCode(), e.getMessage());
      return;
    }
    
    final QueryContext context = new QueryContext("remote-read-" 
        + REQUEST_IDS.incrementAndGet());
    final RemoteReadExecution execution = 
        executor.executeQuery(context, request);
    final ServerConnection connection = exchange.getConnection();
    final CancelOnClose cancel_on_close = cancelOnClose(connection);
    cancel_on_close.watch(execution);
    final DisconnectWatcher watcher = 
        connection instanceof HttpServerConnection ? 
            new DisconnectWatcher((HttpServerConnection) connection) : null;
    exchange.addExchangeCompleteListener(new ExchangeCompletionListener() {
      @Override
      public void exchangeEvent(final HttpServerExchange completed, 
                                final NextListener next_listener) {
        cancel_on_close.release(execution);
        if (watcher != null) {
          watcher.stop();
        }
        next_listener.proceed();
      }
    });
    if (!connection.isOpen()) {
      cancel_on_close.closed(connection);
    } else if (watcher != null) {
      exchange.putAttachment(DISCONNECT_WATCHER, watcher);
      watcher.start();
    }
    
    final ReadResponse response;
    try {
      response = execution.deferred().join(timeout);
    } catch (TimeoutException e) {
      execution.cancel();
      LOG.warn("Remote read " + context.id() + " with " + request.size() 
          + " queries timed out after " + timeout + "ms");
      sendError(exchange, StatusCodes.GATEWAY_TIME_OUT, 
          "Remote read timed out after " + timeout + "ms");
      return;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      execution.cancel();
      sendError(exchange, StatusCodes.SERVICE_UNAVAILABLE, 
          "Interrupted while waiting on the remote read.");
      return;
    } catch (QueryExecutionException e) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Remote read " + context.id() + " failed", e);
      }
      sendError(exchange, statusCode(e.getStatusCode()), e.getMessage());
      return;
    } catch (Exception e) {
      LOG.error("Unexpected exception executing remote read " 
          + context.id(), e);
      sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, 
          "Unexpected exception: " + e.getMessage());
      return;
    }
    
    final byte[] body;
    try {
      body = RemoteReadSerdes.serialize(response);
    } catch (EncodingFailureException e) {
      LOG.error("Failed to encode remote read response " + context.id(), e);
      sendError(exchange, e.getStatusCode(), e.getMessage());
      return;
    }
    
    stopWatching(exchange);
    exchange.setStatusCode(StatusCodes.OK);
    exchange.getResponseHeaders()
        .put(Headers.CONTENT_TYPE, RemoteReadSerdes.CONTENT_TYPE)
        .put(Headers.CONTENT_ENCODING, RemoteReadSerdes.CONTENT_ENCODING);
    exchange.getResponseSender().send(ByteBuffer.wrap(body));
  }
  
  /**
   * Writes a plain text error.
   * @param exchange The exchange.
   * @param status The status code.
   * @param message The body.
   */
  static void sendError(final HttpServerExchange exchange, 
                        final int status, 
                        final String message) {
    stopWatching(exchange);
    exchange.setStatusCode(status);
    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, 
        "text/plain; charset=utf-8");
    exchange.getResponseSender().send(message == null ? "" : message, 
        StandardCharsets.UTF_8);
  }
  
  /**
   * Stops watching for a disconnect before the response goes out and closes
   * the connection after the response if the watcher swallowed bytes of a 
   * pipelined request.
   * @param exchange The exchange.
   */
  static void stopWatching(final HttpServerExchange exchange) {
    final DisconnectWatcher watcher = exchange.getAttachment(DISCONNECT_WATCHER);
    if (watcher == null) {
      return;
    }
    watcher.stop();
    if (watcher.consumedRequestBytes()) {
      exchange.setPersistent(false);
    }
  }
  
  /**
   * @param status A status from an exception.
   * @return The status if it's an HTTP error code, 500 if not.
   */
  static int statusCode(final int status) {
    if (status < 400 || status > 599) {
      return StatusCodes.INTERNAL_SERVER_ERROR;
    }
    return status;
  }
  
  /**
   * Returns the close listener of the connection, attaching and registering
   * it the first time the connection serves a remote read.
   * @param connection A non-null connection.
   * @return The listener for the connection.
   */
  static CancelOnClose cancelOnClose(final ServerConnection connection) {
    synchronized (connection) {
      CancelOnClose listener = connection.getAttachment(CANCEL_ON_CLOSE);
      if (listener == null) {
        listener = new CancelOnClose();
        connection.putAttachment(CANCEL_ON_CLOSE, listener);
        connection.addCloseListener(listener);
      }
      return listener;
    }
  }
  
  /** 
   * Cancels the in-flight execution of a connection if the connection closes
   * before we respond. One per connection, the execution slot is set and 
   * cleared per exchange.
   */
  static class CancelOnClose implements ServerConnection.CloseListener {
    private final AtomicReference<RemoteReadExecution> execution = 
        new AtomicReference<RemoteReadExecution>();
    
    /** @param execution The execution now running on the connection. */
    void watch(final RemoteReadExecution execution) {
      this.execution.set(execution);
    }
    
    /** @param execution The execution that finished on the connection. */
    void release(final RemoteReadExecution execution) {
      this.execution.compareAndSet(execution, null);
    }
    
    @Override
    public void closed(final ServerConnection connection) {
      final RemoteReadExecution extant = execution.getAndSet(null);
      if (extant != null && !extant.isDone()) {
        LOG.info("Client connection closed, canceling remote read " 
            + extant.context().id());
        extant.cancel();
      }
    }
  }
  
  /**
   * Undertow stops reading an HTTP/1.1 connection once the request has been
   * parsed so a client going away isn't noticed until we write. While the 
   * query runs this handler reads the connection's own source conduit, 
   * beneath the exhausted request body conduit, and closes the connection 
   * on end of stream, which fires the {@link CancelOnClose} listener. The 
   * channel's handler is put back when the exchange completes.
   */
  static class DisconnectWatcher implements ReadReadyHandler {
    private final HttpServerConnection connection;
    private final StreamSourceConduit conduit;
    
    /** Set if the client sent bytes of another request while we ran. */
    private volatile boolean consumed_request_bytes;
    
    /** Set once the channel's handler was put back. */
    private final AtomicBoolean stopped = new AtomicBoolean();
    
    DisconnectWatcher(final HttpServerConnection connection) {
      this.connection = connection;
      conduit = connection.getOriginalSourceConduit();
    }
    
    void start() {
      conduit.setReadReadyHandler(this);
      conduit.resumeReads();
    }
    
    void stop() {
      if (!stopped.compareAndSet(false, true)) {
        return;
      }
      conduit.suspendReads();
      conduit.setReadReadyHandler(
          new ReadReadyHandler.ChannelListenerHandler<ConduitStreamSourceChannel>(
              connection.getChannel().getSourceChannel()));
    }
    
    /** @return Whether bytes of a pipelined request were read and lost. */
    boolean consumedRequestBytes() {
      return consumed_request_bytes;
    }
    
    @Override
    public void readReady() {
      if (stopped.get()) {
        return;
      }
      final ByteBuffer buffer = ByteBuffer.allocate(1);
      int read;
      try {
        read = conduit.read(buffer);
      } catch (IOException e) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Failed reading from " + connection.getPeerAddress(), e);
        }
        read = -1;
      }
      if (read < 0) {
        conduit.suspendReads();
        IoUtils.safeClose(connection);
      } else if (read > 0) {
        // a pipelined request, we can't hand the byte back so the 
        // connection is closed after the response.
        LOG.warn("Client " + connection.getPeerAddress() + " pipelined a "
            + "request during a remote read, closing after the response.");
        consumed_request_bytes = true;
        conduit.suspendReads();
      }
    }

    @Override
    public void forceTermination() {
      // nothing buffered to release
    }

    @Override
    public void terminated() {
      // the close listener handles cancellation
    }
  }
}
