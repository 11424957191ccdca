package com.logicsignalprotector.cortexconnector.relay;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Conversation id to pending-reply map.
 *
 * <p>All operations are linearizable: they run under the table's monitor. Futures are completed
 * outside of it, and whoever removes an entry is the only one allowed to complete it, so a resolve
 * racing a cancel has exactly one winner.
 */
@Component
@Slf4j
public class CorrelationTable {

  private final Map<String, PendingRequest> pending = new LinkedHashMap<>();
  private final Clock clock;

  public CorrelationTable(Clock clock) {
    this.clock = clock;
  }

  /** Registers a request; an earlier unresolved request for the same conversation is superseded. */
  public PendingRequest register(String conversationId, String envelope) {
    PendingRequest request = new PendingRequest(conversationId, envelope, Instant.now(clock));
    PendingRequest previous;
    synchronized (this) {
      previous = pending.remove(conversationId);
      pending.put(conversationId, request);
    }
    if (previous != null && !previous.isDone()) {
      log.debug("Superseded pending request for conversation {}", conversationId);
    }
    return request;
  }

  /**
   * Completes the live waiter for {@code conversationId}.
   *
   * @return true only if this call delivered the text to a waiter
   */
  public boolean resolve(String conversationId, String text) {
    if (conversationId == null) {
      return false;
    }
    PendingRequest request;
    synchronized (this) {
      request = pending.remove(conversationId);
    }
    return request != null && request.complete(text);
  }

  /** Removes whatever is registered for the conversation, without resolving it. */
  public void cancel(String conversationId) {
    synchronized (this) {
      pending.remove(conversationId);
    }
  }

  /**
   * Removes {@code request} only if it is still the registered one.
   *
   * @return false if it was already resolved, cancelled or superseded
   */
  public boolean cancel(PendingRequest request) {
    synchronized (this) {
      return pending.remove(request.conversationId(), request);
    }
  }

  /** Unresolved requests in registration order. */
  public synchronized List<PendingRequest> snapshotUnresolved() {
    List<PendingRequest> out = new ArrayList<>(pending.size());
    for (PendingRequest request : pending.values()) {
      if (!request.isDone()) {
        out.add(request);
      }
    }
    return out;
  }

  public synchronized boolean contains(String conversationId) {
    return pending.containsKey(conversationId);
  }

  public synchronized int size() {
    return pending.size();
  }
}
