package com.logicsignalprotector.cortexconnector.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logicsignalprotector.cortexconnector.config.CortexProperties;
import com.logicsignalprotector.cortexconnector.model.CloudEvent;
import com.logicsignalprotector.cortexconnector.model.EventData;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Builds and parses connector envelopes.
 *
 * <p>{@link #buildInbound} has no hidden state: only the event id and timestamp differ between
 * calls with the same arguments.
 */
@Component
public class EnvelopeCodec {

  private final ObjectMapper mapper;
  private final Clock clock;
  private final String connectorId;
  private final String source;

  @Autowired
  public EnvelopeCodec(ObjectMapper mapper, Clock clock, CortexProperties properties) {
    this(mapper, clock, properties.connectorId());
  }

  public EnvelopeCodec(ObjectMapper mapper, Clock clock, String connectorId) {
    this.mapper = mapper;
    this.clock = clock;
    this.connectorId = connectorId;
    this.source = "urn:connector:" + connectorId;
  }

  public String buildInbound(String conversationId, String roomId, String text) {
    CloudEvent event =
        new CloudEvent(
            CloudEvent.SPEC_VERSION,
            CloudEvent.TYPE_INBOUND,
            source,
            UUID.randomUUID().toString(),
            Instant.now(clock).toString(),
            "application/json",
            new EventData(connectorId, conversationId, roomId, text));
    try {
      return mapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize inbound event", e);
    }
  }

  public CloudEvent parseInbound(String rawFrame) throws EnvelopeParseException {
    if (rawFrame == null || rawFrame.isBlank()) {
      throw new EnvelopeParseException("Empty frame");
    }
    JsonNode root;
    try {
      root = mapper.readTree(rawFrame);
    } catch (JsonProcessingException e) {
      throw new EnvelopeParseException("Frame is not JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new EnvelopeParseException("Frame is not a JSON object");
    }

    JsonNode data = root.path("data");
    EventData eventData =
        data.isObject()
            ? new EventData(
                text(data, "connectorId"),
                text(data, "conversationId"),
                text(data, "roomId"),
                text(data, "text"))
            : EventData.EMPTY;

    return new CloudEvent(
        text(root, "specversion"),
        text(root, "type"),
        text(root, "source"),
        text(root, "id"),
        text(root, "time"),
        text(root, "datacontenttype"),
        eventData);
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
      return null;
    }
    return value.asText();
  }
}
