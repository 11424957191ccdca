package com.logicsignalprotector.cortexconnector.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Extracts plain text messages from Telegram updates. Bot commands, callbacks and non-text
 * messages are not forwarded to Cortex-M.
 */
@Component
public class TelegramUpdateParser {

  public Optional<InboundChatMessage> parse(JsonNode update) {
    if (update == null) {
      return Optional.empty();
    }
    JsonNode message = update.path("message");
    if (message.isMissingNode() || message.isNull()) {
      return Optional.empty();
    }

    JsonNode textNode = message.path("text");
    if (!textNode.isTextual()) {
      return Optional.empty();
    }
    if (isCommand(message)) {
      return Optional.empty();
    }

    JsonNode chatId = message.path("chat").path("id");
    if (chatId.isMissingNode() || chatId.isNull()) {
      return Optional.empty();
    }

    JsonNode from = message.path("from");
    String fromId = from.path("id").isMissingNode() ? null : from.path("id").asText();
    String username = from.path("username").asText(null);

    return Optional.of(
        new InboundChatMessage(chatId.asText(), fromId, username, textNode.asText()));
  }

  private static boolean isCommand(JsonNode message) {
    JsonNode entities = message.path("entities");
    if (!entities.isArray()) {
      return false;
    }
    for (JsonNode entity : entities) {
      if ("bot_command".equals(entity.path("type").asText())
          && entity.path("offset").asInt(-1) == 0) {
        return true;
      }
    }
    return false;
  }
}
