package com.logicsignalprotector.cortexconnector.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.logicsignalprotector.cortexconnector.telegram.InboundChatMessage;
import com.logicsignalprotector.cortexconnector.telegram.TelegramMessageHandler;
import com.logicsignalprotector.cortexconnector.telegram.TelegramUpdateParser;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Telegram webhook endpoint, an alternative to long polling.
 *
 * <p>Needs a public URL registered with setWebhook, and {@code telegram.polling.enabled=false}.
 * The request returns as soon as the message is queued; the reply is sent asynchronously.
 */
@RestController
@RequestMapping("/telegram")
@Slf4j
public class TelegramWebhookController {

  private final TelegramUpdateParser parser;
  private final TelegramMessageHandler handler;
  private final String secretToken;

  public TelegramWebhookController(
      TelegramUpdateParser parser,
      TelegramMessageHandler handler,
      @Value("${telegram.webhook.secret-token:}") String secretToken) {
    this.parser = parser;
    this.handler = handler;
    this.secretToken = secretToken == null ? "" : secretToken.trim();
  }

  @PostMapping("/webhook")
  public Map<String, Object> webhook(
      @RequestBody JsonNode update,
      @RequestHeader(value = "X-Telegram-Bot-Api-Secret-Token", required = false)
          String headerSecret) {

    if (!secretToken.isBlank()) {
      if (headerSecret == null || !secretToken.equals(headerSecret)) {
        log.warn("Webhook secret token mismatch");
        return Map.of("ok", false);
      }
    }

    Optional<InboundChatMessage> message = parser.parse(update);
    if (message.isEmpty()) {
      return Map.of("ok", true, "ignored", "no_text");
    }

    handler.handle(message.get());
    return Map.of("ok", true, "queued", true);
  }
}
