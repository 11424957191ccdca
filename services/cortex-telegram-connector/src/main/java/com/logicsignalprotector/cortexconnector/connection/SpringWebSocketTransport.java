package com.logicsignalprotector.cortexconnector.connection;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

/** {@link BackendTransport} on top of Spring's WebSocket client. */
public class SpringWebSocketTransport implements BackendTransport {

  private final WebSocketClient client;
  private final Duration handshakeTimeout;

  public SpringWebSocketTransport(WebSocketClient client, Duration handshakeTimeout) {
    this.client = client;
    this.handshakeTimeout = handshakeTimeout;
  }

  @Override
  public BackendConnection connect(URI uri) throws IOException, InterruptedException {
    SpringWebSocketConnection connection = new SpringWebSocketConnection();
    CompletableFuture<WebSocketSession> future =
        client.execute(connection, new WebSocketHttpHeaders(), uri);
    try {
      WebSocketSession session = future.get(handshakeTimeout.toMillis(), TimeUnit.MILLISECONDS);
      connection.attach(session);
      return connection;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      throw new IOException("WebSocket handshake failed: " + cause.getMessage(), cause);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new IOException("WebSocket handshake timed out after " + handshakeTimeout, e);
    }
  }
}
