package com.logicsignalprotector.cortexconnector.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Thin Telegram Bot API client (only the calls the connector needs). */
@Service
@Slf4j
public class TelegramBotClient {

  public static final String PARSE_MODE_HTML = "HTML";

  private final RestClient rest;
  private final String botToken;
  private final String apiBaseUrl;

  public TelegramBotClient(
      RestClient.Builder builder,
      @Value("${telegram.bot-token:}") String botToken,
      @Value("${telegram.api-base-url:https://api.telegram.org}") String apiBaseUrl) {
    this.botToken = botToken == null ? "" : botToken.trim();
    this.apiBaseUrl = apiBaseUrl;
    this.rest = builder.build();
  }

  public boolean isConfigured() {
    return !botToken.isBlank();
  }

  public JsonNode getUpdates(long offset, int timeoutSeconds) {
    if (!isConfigured()) {
      log.warn("Telegram bot token is not configured; skip getUpdates");
      return null;
    }

    try {
      return rest.get()
          .uri(method("getUpdates") + "?offset={offset}&timeout={timeout}", offset, timeoutSeconds)
          .retrieve()
          .body(JsonNode.class);
    } catch (RestClientException e) {
      log.warn("Failed to call getUpdates: {}", e.getMessage());
      return null;
    }
  }

  /** Removes any webhook so long polling works; optionally drops updates queued while offline. */
  public void deleteWebhook(boolean dropPendingUpdates) {
    if (!isConfigured()) {
      return;
    }
    try {
      rest.post()
          .uri(method("deleteWebhook"))
          .body(Map.of("drop_pending_updates", dropPendingUpdates))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientException e) {
      log.warn("Failed to delete Telegram webhook: {}", e.getMessage());
    }
  }

  public void sendMessage(String chatId, String text) {
    sendMessage(chatId, text, null);
  }

  /**
   * Sends a message to a chat.
   *
   * @throws TelegramDeliveryException if Telegram rejected the message (for example malformed
   *     HTML) or could not be reached
   */
  public void sendMessage(String chatId, String text, String parseMode) {
    if (!isConfigured()) {
      throw new TelegramDeliveryException("Telegram bot token is not configured");
    }

    Map<String, Object> body = new HashMap<>();
    body.put("chat_id", chatId);
    body.put("text", text);
    if (parseMode != null && !parseMode.isBlank()) {
      body.put("parse_mode", parseMode);
    }
    try {
      rest.post().uri(method("sendMessage")).body(body).retrieve().toBodilessEntity();
    } catch (RestClientException e) {
      throw new TelegramDeliveryException(
          "Failed to send Telegram message to chat " + chatId + ": " + e.getMessage(), e);
    }
  }

  private String method(String name) {
    return apiBaseUrl + "/bot" + botToken + "/" + name;
  }
}
