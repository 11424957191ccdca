package com.logicsignalprotector.cortexconnector.relay;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Producer-side entry point: builds, registers and enqueues in one step, and rebuilds the queue
 * after a reconnect.
 *
 * <p>{@link #submit} and {@link #resync} share one lock. A message submitted during a resync is
 * therefore either part of the re-queued set or enqueued after it, never both and never lost.
 */
@Service
@Slf4j
public class OutboundDispatcher {

  private final EnvelopeCodec codec;
  private final CorrelationTable table;
  private final OutboundQueue queue;
  private final Object lock = new Object();

  public OutboundDispatcher(EnvelopeCodec codec, CorrelationTable table, OutboundQueue queue) {
    this.codec = codec;
    this.table = table;
    this.queue = queue;
  }

  public PendingRequest submit(String conversationId, String roomId, String text) {
    String envelope = codec.buildInbound(conversationId, roomId, text);
    PendingRequest request;
    synchronized (lock) {
      request = table.register(conversationId, envelope);
      queue.enqueue(envelope);
    }
    log.info("Queued inbound event for conversation {}", conversationId);
    return request;
  }

  /**
   * Drops whatever is left in the queue from a previous connection and re-enqueues every
   * unresolved request's original envelope, in table order.
   *
   * @return number of re-queued envelopes
   */
  public int resync() {
    List<PendingRequest> unresolved;
    int stale;
    synchronized (lock) {
      stale = queue.drainAll().size();
      unresolved = table.snapshotUnresolved();
      for (PendingRequest request : unresolved) {
        queue.enqueue(request.envelope());
      }
    }
    if (stale > 0) {
      log.debug("Dropped {} stale queue entries before resync", stale);
    }
    for (PendingRequest request : unresolved) {
      log.info(
          "Re-queued pending message for conversation {} after reconnect",
          request.conversationId());
    }
    return unresolved.size();
  }
}
