package com.logicsignalprotector.cortexconnector.relay;

import com.logicsignalprotector.cortexconnector.model.CloudEvent;
import com.logicsignalprotector.cortexconnector.telegram.ReplySender;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes frames read from the Cortex-M connection: replies go to the waiting chat handler,
 * broadcasts to every known chat, everything else is dropped with a log line. Never throws for bad
 * input.
 */
@Component
@Slf4j
public class DispatchRouter {

  private static final int PREVIEW_LENGTH = 120;

  private final EnvelopeCodec codec;
  private final CorrelationTable table;
  private final KnownChatRegistry knownChats;
  private final ReplySender replySender;

  public DispatchRouter(
      EnvelopeCodec codec,
      CorrelationTable table,
      KnownChatRegistry knownChats,
      ReplySender replySender) {
    this.codec = codec;
    this.table = table;
    this.knownChats = knownChats;
    this.replySender = replySender;
  }

  public RouteOutcome route(String rawFrame) {
    if (log.isDebugEnabled()) {
      log.debug("<- Cortex-M: {}", preview(rawFrame));
    }

    CloudEvent event;
    try {
      event = codec.parseInbound(rawFrame);
    } catch (EnvelopeParseException e) {
      log.warn("Received non-JSON frame, ignoring: {}", e.getMessage());
      return RouteOutcome.MALFORMED;
    }

    if (!event.isOutboundReply()) {
      log.debug("Ignoring event type: {}", event.type());
      return RouteOutcome.IGNORED;
    }

    String conversationId = event.data().conversationId();
    String text = event.data().textOrEmpty();

    if (conversationId != null && !conversationId.isBlank() && table.resolve(conversationId, text)) {
      return RouteOutcome.RESOLVED;
    }
    if (event.isBroadcast()) {
      broadcast(text);
      return RouteOutcome.BROADCAST;
    }
    log.warn("Received reply for unknown conversationId: {}", conversationId);
    return RouteOutcome.UNKNOWN_CONVERSATION;
  }

  private void broadcast(String text) {
    List<String> chats = knownChats.snapshot();
    log.info("Broadcasting message to {} known chat(s)", chats.size());
    if (chats.isEmpty()) {
      return;
    }

    String html;
    try {
      html = replySender.render(text);
    } catch (RuntimeException e) {
      log.warn("Failed to render broadcast, sending plain text: {}", e.getMessage());
      html = null;
    }

    for (String chatId : chats) {
      try {
        if (html == null) {
          replySender.deliverPlain(chatId, text);
        } else {
          replySender.deliverRendered(chatId, html, text);
        }
      } catch (RuntimeException e) {
        log.warn("Failed to broadcast to chat {}: {}", chatId, e.getMessage());
      }
    }
  }

  private static String preview(String frame) {
    if (frame == null) {
      return "null";
    }
    return frame.length() <= PREVIEW_LENGTH ? frame : frame.substring(0, PREVIEW_LENGTH);
  }

  public enum RouteOutcome {
    RESOLVED,
    BROADCAST,
    UNKNOWN_CONVERSATION,
    IGNORED,
    MALFORMED
  }
}
