package com.logicsignalprotector.cortexconnector.polling;

import com.fasterxml.jackson.databind.JsonNode;
import com.logicsignalprotector.cortexconnector.client.TelegramBotClient;
import com.logicsignalprotector.cortexconnector.telegram.TelegramMessageHandler;
import com.logicsignalprotector.cortexconnector.telegram.TelegramUpdateParser;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Telegram long polling, the default way updates reach the connector.
 *
 * <p>On the first poll any webhook is removed and updates that piled up while the connector was
 * down are dropped. Handling a message only enqueues it, so a slow Cortex-M never stalls polling.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "telegram.polling.enabled", havingValue = "true")
public class TelegramPollingRunner {

  private final TelegramBotClient bot;
  private final TelegramUpdateParser parser;
  private final TelegramMessageHandler handler;
  private final int timeoutSeconds;
  private final AtomicLong offset = new AtomicLong(0);
  private final AtomicBoolean started = new AtomicBoolean(false);

  public TelegramPollingRunner(
      TelegramBotClient bot,
      TelegramUpdateParser parser,
      TelegramMessageHandler handler,
      @Value("${telegram.polling.timeout-seconds:20}") int timeoutSeconds) {
    this.bot = bot;
    this.parser = parser;
    this.handler = handler;
    this.timeoutSeconds = timeoutSeconds;
  }

  @Scheduled(fixedDelayString = "${telegram.polling.fixed-delay-ms:500}")
  public void poll() {
    if (!bot.isConfigured()) {
      log.warn("telegram.polling.enabled=true but TELEGRAM_TOKEN is empty; polling is skipped");
      return;
    }
    if (started.compareAndSet(false, true)) {
      bot.deleteWebhook(true);
      log.info("Telegram bot polling started");
    }

    try {
      JsonNode resp = bot.getUpdates(offset.get(), timeoutSeconds);
      if (resp == null) return;

      JsonNode result = resp.path("result");
      if (!result.isArray() || result.isEmpty()) return;

      long maxUpdateId = offset.get() - 1;

      for (JsonNode upd : result) {
        long updateId = upd.path("update_id").asLong(-1);
        if (updateId > maxUpdateId) maxUpdateId = updateId;

        parser.parse(upd).ifPresent(handler::handle);
      }

      // Telegram expects next offset = last_update_id + 1
      offset.set(maxUpdateId + 1);

    } catch (RuntimeException e) {
      log.warn("Telegram polling failed: {}", e.getMessage());
    }
  }

  long offset() {
    return offset.get();
  }
}
