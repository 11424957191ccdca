package com.logicsignalprotector.cortexconnector.telegram;

import com.logicsignalprotector.cortexconnector.client.TelegramBotClient;
import com.logicsignalprotector.cortexconnector.render.TelegramMarkupRenderer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Delivers Cortex-M Markdown to a chat as Telegram HTML, falling back to the raw text. */
@Component
@Slf4j
public class ReplySender {

  private final TelegramBotClient bot;
  private final TelegramMarkupRenderer renderer;

  public ReplySender(TelegramBotClient bot, TelegramMarkupRenderer renderer) {
    this.bot = bot;
    this.renderer = renderer;
  }

  public String render(String markdown) {
    return renderer.render(markdown);
  }

  /**
   * Renders and sends {@code markdown}; if rendering or the HTML send fails, sends it unrendered.
   *
   * @throws com.logicsignalprotector.cortexconnector.client.TelegramDeliveryException if the plain
   *     fallback fails as well
   */
  public void deliver(String chatId, String markdown) {
    String html;
    try {
      html = renderer.render(markdown);
    } catch (RuntimeException e) {
      log.warn("Failed to render reply for chat {}, sending plain text: {}", chatId, e.getMessage());
      bot.sendMessage(chatId, markdown);
      return;
    }
    deliverRendered(chatId, html, markdown);
  }

  /** Sends pre-rendered HTML, falling back to {@code plain} if Telegram rejects it. */
  public void deliverRendered(String chatId, String html, String plain) {
    try {
      bot.sendMessage(chatId, html, TelegramBotClient.PARSE_MODE_HTML);
    } catch (RuntimeException e) {
      log.warn("Failed to send HTML reply, falling back to plain text: {}", e.getMessage());
      bot.sendMessage(chatId, plain);
    }
  }

  public void deliverPlain(String chatId, String text) {
    bot.sendMessage(chatId, text);
  }
}
