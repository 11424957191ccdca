package com.logicsignalprotector.cortexconnector.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Envelope exchanged with Cortex-M over the connector WebSocket (CloudEvents 1.0 structured mode).
 *
 * <p>Outbound events are serialized once and re-sent verbatim on reconnect, so {@code id} and
 * {@code time} stay stable across redelivery attempts.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CloudEvent(
    String specversion,
    String type,
    String source,
    String id,
    String time,
    String datacontenttype,
    EventData data) {

  public static final String SPEC_VERSION = "1.0";
  public static final String TYPE_INBOUND = "assistant.message.inbound";
  public static final String TYPE_OUTBOUND = "assistant.message.outbound";
  public static final String BROADCAST_CONVERSATION = "broadcast";

  public CloudEvent {
    data = data == null ? EventData.EMPTY : data;
  }

  @JsonIgnore
  public boolean isOutboundReply() {
    return TYPE_OUTBOUND.equals(type);
  }

  @JsonIgnore
  public boolean isBroadcast() {
    return BROADCAST_CONVERSATION.equals(data.conversationId());
  }
}
