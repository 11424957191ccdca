package com.logicsignalprotector.cortexconnector.connection;

import com.logicsignalprotector.cortexconnector.config.CortexProperties;
import com.logicsignalprotector.cortexconnector.relay.DispatchRouter;
import com.logicsignalprotector.cortexconnector.relay.OutboundDispatcher;
import com.logicsignalprotector.cortexconnector.relay.OutboundQueue;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Keeps the single Cortex-M connection alive.
 *
 * <p>Each cycle acquires a session, connects, resets the backoff, rebuilds the outbound queue from
 * the unresolved requests, then runs a writer (queue to wire) and a reader (wire to router) until
 * either of them stops. Pending requests survive a lost connection and are re-sent on the next
 * one. The loop only ends when the application shuts down.
 */
@Component
@Slf4j
@ConditionalOnProperty(
    name = "cortex.connection.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ConnectionSupervisor implements SmartLifecycle {

  private static final long STOP_TIMEOUT_MS = 5_000;
  private static final int PREVIEW_LENGTH = 120;

  private final SessionClient sessionClient;
  private final BackendTransport transport;
  private final OutboundDispatcher dispatcher;
  private final OutboundQueue queue;
  private final DispatchRouter router;
  private final ExponentialBackoff backoff;
  private final AtomicInteger sessions = new AtomicInteger();

  private volatile ConnectionState state = ConnectionState.IDLE;
  private volatile boolean running;
  private volatile Thread thread;
  private volatile Duration pumpShutdownTimeout = Duration.ofSeconds(5);

  @Autowired
  public ConnectionSupervisor(
      SessionClient sessionClient,
      BackendTransport transport,
      OutboundDispatcher dispatcher,
      OutboundQueue queue,
      DispatchRouter router,
      CortexProperties properties) {
    this(
        sessionClient,
        transport,
        dispatcher,
        queue,
        router,
        new ExponentialBackoff(properties.backoff().initial(), properties.backoff().max()));
  }

  public ConnectionSupervisor(
      SessionClient sessionClient,
      BackendTransport transport,
      OutboundDispatcher dispatcher,
      OutboundQueue queue,
      DispatchRouter router,
      ExponentialBackoff backoff) {
    this.sessionClient = sessionClient;
    this.transport = transport;
    this.dispatcher = dispatcher;
    this.queue = queue;
    this.router = router;
    this.backoff = backoff;
  }

  @Override
  public void start() {
    if (running) {
      return;
    }
    running = true;
    Thread t = new Thread(this::superviseForever, "cortex-connection-supervisor");
    t.setDaemon(true);
    thread = t;
    t.start();
  }

  @Override
  public void stop() {
    running = false;
    Thread t = thread;
    if (t != null) {
      t.interrupt();
      try {
        t.join(STOP_TIMEOUT_MS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    state = ConnectionState.STOPPED;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  public ConnectionState state() {
    return state;
  }

  /** Number of sessions that reached the streaming state since startup. */
  public int completedHandshakes() {
    return sessions.get();
  }

  void superviseForever() {
    while (running) {
      String reason;
      try {
        runSession();
        reason = "connection closed";
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (Exception e) {
        reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
      }
      if (!running) {
        break;
      }

      // pending requests stay registered; their envelopes are re-queued on the next connect
      Duration delay = backoff.nextDelay();
      log.error("WebSocket error ({}), retrying in {}s", reason, delay.toSeconds());
      try {
        pause(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
    }
    state = ConnectionState.STOPPED;
  }

  /**
   * One connection lifetime: handshake, connect, resync, then pump until the connection is lost.
   * Returns normally if the backend closed the connection, throws on any failure.
   */
  void runSession() throws Exception {
    state = ConnectionState.HANDSHAKING;
    try {
      String sessionId = sessionClient.acquireSession();
      URI uri = sessionClient.connectionUri(sessionId);
      log.info("Connecting to Cortex-M at {}", uri);

      try (BackendConnection connection = transport.connect(uri)) {
        state = ConnectionState.CONNECTED;
        log.info("WebSocket connected (session={})", sessionId);
        backoff.reset();

        state = ConnectionState.RESYNC;
        dispatcher.resync();

        state = ConnectionState.STREAMING;
        sessions.incrementAndGet();
        pump(connection);
      }
    } finally {
      if (state != ConnectionState.STOPPED) {
        state = ConnectionState.IDLE;
      }
    }
  }

  void pumpShutdownTimeout(Duration timeout) {
    this.pumpShutdownTimeout = timeout;
  }

  protected void pause(Duration delay) throws InterruptedException {
    Thread.sleep(delay.toMillis());
  }

  private void pump(BackendConnection connection) throws Exception {
    ExecutorService pumps =
        Executors.newFixedThreadPool(
            2,
            r -> {
              Thread t = new Thread(r, "cortex-connection-pump");
              t.setDaemon(true);
              return t;
            });
    ExecutorCompletionService<Void> completion = new ExecutorCompletionService<>(pumps);
    try {
      completion.submit(
          () -> {
            writeLoop(connection);
            return null;
          });
      completion.submit(
          () -> {
            readLoop(connection);
            return null;
          });

      try {
        completion.take().get();
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Exception ex) {
          throw ex;
        }
        throw new BackendUnavailableException("Connection pump failed", cause);
      }
    } finally {
      connection.close();
      pumps.shutdownNow();
      awaitPumps(pumps);
    }
  }

  /** Blocks until both pumps have exited, so no writer outlives its connection. */
  private void awaitPumps(ExecutorService pumps) throws InterruptedException {
    long timeoutMs = pumpShutdownTimeout.toMillis();
    while (!pumps.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
      log.warn("Connection pumps still running after {} ms, holding off reconnect", timeoutMs);
    }
  }

  private void writeLoop(BackendConnection connection) throws IOException, InterruptedException {
    while (!Thread.currentThread().isInterrupted()) {
      String payload = queue.dequeueNext();
      connection.send(payload);
      if (log.isDebugEnabled()) {
        log.debug("-> Cortex-M: {}", preview(payload));
      }
    }
  }

  private void readLoop(BackendConnection connection) throws IOException, InterruptedException {
    while (true) {
      String frame = connection.receive();
      if (frame == null) {
        return;
      }
      try {
        router.route(frame);
      } catch (RuntimeException e) {
        log.warn("Failed to route frame from Cortex-M: {}", e.getMessage(), e);
      }
    }
  }

  private static String preview(String frame) {
    return frame.length() <= PREVIEW_LENGTH ? frame : frame.substring(0, PREVIEW_LENGTH);
  }
}
