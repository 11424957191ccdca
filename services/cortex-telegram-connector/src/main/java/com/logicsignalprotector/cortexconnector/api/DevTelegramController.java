package com.logicsignalprotector.cortexconnector.api;

import com.logicsignalprotector.cortexconnector.telegram.InboundChatMessage;
import com.logicsignalprotector.cortexconnector.telegram.TelegramMessageHandler;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Local testing endpoint: injects a "fake" Telegram message without a real update. The reply is
 * still delivered to {@code chatId} through the Bot API.
 */
@RestController
@RequestMapping("/dev/telegram")
@ConditionalOnProperty(name = "telegram.dev-endpoint.enabled", havingValue = "true")
public class DevTelegramController {

  private final TelegramMessageHandler handler;

  public DevTelegramController(TelegramMessageHandler handler) {
    this.handler = handler;
  }

  public record DevMessageRequest(
      @NotNull Long telegramUserId, String username, @NotNull Long chatId, @NotBlank String text) {}

  @PostMapping("/message")
  public Map<String, Object> message(@Valid @RequestBody DevMessageRequest req) {
    handler.handle(
        new InboundChatMessage(
            String.valueOf(req.chatId()),
            String.valueOf(req.telegramUserId()),
            req.username(),
            req.text()));
    return Map.of("ok", true, "queued", true);
  }
}
