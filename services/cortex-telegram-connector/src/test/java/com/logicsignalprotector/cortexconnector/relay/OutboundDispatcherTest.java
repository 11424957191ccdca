package com.logicsignalprotector.cortexconnector.relay;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.junit.jupiter.api.Test;

class OutboundDispatcherTest {

  private final CorrelationTable table = new CorrelationTable(Clock.systemUTC());
  private final OutboundQueue queue = new OutboundQueue();
  private final OutboundDispatcher dispatcher =
      new OutboundDispatcher(
          new EnvelopeCodec(new ObjectMapper(), Clock.systemUTC(), "telegram-1"), table, queue);

  @Test
  void submit_registersAndEnqueuesSameEnvelope() {
    PendingRequest request = dispatcher.submit("42", "42", "hi");

    assertThat(table.contains("42")).isTrue();
    assertThat(queue.drainAll()).containsExactly(request.envelope());
  }

  @Test
  void resync_requeuesUnresolvedEnvelopesVerbatim() {
    PendingRequest a = dispatcher.submit("1", "1", "one");
    PendingRequest b = dispatcher.submit("2", "2", "two");
    PendingRequest c = dispatcher.submit("3", "3", "three");
    // writer of the previous connection already took "1" off the queue
    queue.drainAll();
    queue.enqueue(c.envelope());
    table.resolve("2", "done");

    int requeued = dispatcher.resync();

    assertThat(requeued).isEqualTo(2);
    assertThat(queue.drainAll()).containsExactly(a.envelope(), c.envelope());
    assertThat(b.reply()).isCompletedWithValue("done");
  }

  @Test
  void resync_dropsSupersededEnvelopes() {
    dispatcher.submit("42", "42", "first");
    PendingRequest second = dispatcher.submit("42", "42", "second");

    dispatcher.resync();

    assertThat(queue.drainAll()).containsExactly(second.envelope());
  }

  @Test
  void resync_isIdempotent() {
    PendingRequest a = dispatcher.submit("1", "1", "one");

    dispatcher.resync();
    dispatcher.resync();

    assertThat(queue.drainAll()).containsExactly(a.envelope());
  }
}
