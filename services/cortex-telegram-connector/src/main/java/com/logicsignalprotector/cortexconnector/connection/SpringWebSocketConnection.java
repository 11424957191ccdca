package com.logicsignalprotector.cortexconnector.connection;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Adapts Spring's callback-style handler to the blocking {@link BackendConnection} contract: the
 * callbacks push frames and close/error signals into a queue that {@link #receive()} takes from.
 */
@Slf4j
class SpringWebSocketConnection extends TextWebSocketHandler implements BackendConnection {

  private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
  private volatile WebSocketSession session;

  void attach(WebSocketSession session) {
    this.session = session;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    this.session = session;
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    inbound.add(message.getPayload());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    inbound.add(exception);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    inbound.add(status);
  }

  @Override
  public void send(String frame) throws IOException {
    WebSocketSession current = session;
    if (current == null || !current.isOpen()) {
      throw new IOException("WebSocket is not open");
    }
    current.sendMessage(new TextMessage(frame));
  }

  @Override
  public String receive() throws IOException, InterruptedException {
    Object item = inbound.take();
    if (item instanceof String frame) {
      return frame;
    }
    // keep the terminal signal for any later receive() call
    inbound.add(item);
    if (item instanceof Throwable error) {
      throw new IOException("WebSocket transport error: " + error.getMessage(), error);
    }
    log.info("WebSocket closed by Cortex-M: {}", item);
    return null;
  }

  @Override
  public boolean isOpen() {
    WebSocketSession current = session;
    return current != null && current.isOpen();
  }

  @Override
  public void close() {
    WebSocketSession current = session;
    if (current == null || !current.isOpen()) {
      return;
    }
    try {
      current.close(CloseStatus.NORMAL);
    } catch (IOException e) {
      log.debug("Failed to close WebSocket cleanly: {}", e.getMessage());
    }
  }
}
