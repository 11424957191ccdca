package com.logicsignalprotector.cortexconnector.relay;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * One outstanding request to Cortex-M: the serialized envelope plus a single-assignment reply slot.
 *
 * <p>Identity matters: a timed-out handler cancels only its own request, never a newer one
 * registered for the same conversation.
 */
public final class PendingRequest {

  private final String conversationId;
  private final String envelope;
  private final Instant createdAt;
  private final CompletableFuture<String> reply = new CompletableFuture<>();

  PendingRequest(String conversationId, String envelope, Instant createdAt) {
    this.conversationId = conversationId;
    this.envelope = envelope;
    this.createdAt = createdAt;
  }

  public String conversationId() {
    return conversationId;
  }

  public String envelope() {
    return envelope;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public CompletableFuture<String> reply() {
    return reply;
  }

  public boolean isDone() {
    return reply.isDone();
  }

  boolean complete(String text) {
    return reply.complete(text);
  }

  @Override
  public String toString() {
    return "PendingRequest{conversationId=" + conversationId + ", createdAt=" + createdAt + "}";
  }
}
