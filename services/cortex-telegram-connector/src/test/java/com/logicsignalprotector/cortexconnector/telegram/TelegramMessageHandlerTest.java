package com.logicsignalprotector.cortexconnector.telegram;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logicsignalprotector.cortexconnector.client.TelegramBotClient;
import com.logicsignalprotector.cortexconnector.client.TelegramDeliveryException;
import com.logicsignalprotector.cortexconnector.relay.CorrelationTable;
import com.logicsignalprotector.cortexconnector.relay.DispatchRouter;
import com.logicsignalprotector.cortexconnector.relay.DispatchRouter.RouteOutcome;
import com.logicsignalprotector.cortexconnector.relay.EnvelopeCodec;
import com.logicsignalprotector.cortexconnector.relay.KnownChatRegistry;
import com.logicsignalprotector.cortexconnector.relay.OutboundDispatcher;
import com.logicsignalprotector.cortexconnector.relay.OutboundQueue;
import com.logicsignalprotector.cortexconnector.render.TelegramMarkupRenderer;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelegramMessageHandlerTest {

  private TelegramBotClient bot;
  private CorrelationTable table;
  private OutboundQueue queue;
  private KnownChatRegistry knownChats;
  private DispatchRouter router;
  private OutboundDispatcher dispatcher;
  private ReplySender replySender;

  @BeforeEach
  void setUp() {
    bot = mock(TelegramBotClient.class);
    table = new CorrelationTable(Clock.systemUTC());
    queue = new OutboundQueue();
    knownChats = new KnownChatRegistry();
    EnvelopeCodec codec = new EnvelopeCodec(new ObjectMapper(), Clock.systemUTC(), "telegram-1");
    dispatcher = new OutboundDispatcher(codec, table, queue);
    replySender = new ReplySender(bot, new TelegramMarkupRenderer());
    router = new DispatchRouter(codec, table, knownChats, replySender);
  }

  @Test
  void replyIsRenderedAndSentToChat() throws Exception {
    TelegramMessageHandler handler = handler("", Duration.ofSeconds(5));

    CompletableFuture<Void> done = handler.handle(message("42", "hi"));
    assertThat(queue.size()).isEqualTo(1);
    assertThat(table.contains("42")).isTrue();

    assertThat(router.route(reply("42", "ok"))).isEqualTo(RouteOutcome.RESOLVED);
    done.get(5, TimeUnit.SECONDS);

    verify(bot).sendMessage("42", "ok", TelegramBotClient.PARSE_MODE_HTML);
    assertThat(table.contains("42")).isFalse();
  }

  @Test
  void timeoutSendsNoticeAndLateReplyIsDropped() throws Exception {
    TelegramMessageHandler handler = handler("", Duration.ofMillis(50));

    handler.handle(message("7", "hello")).get(5, TimeUnit.SECONDS);

    verify(bot).sendMessage("7", TelegramMessageHandler.TIMEOUT_NOTICE);
    assertThat(table.contains("7")).isFalse();

    assertThat(router.route(reply("7", "late"))).isEqualTo(RouteOutcome.UNKNOWN_CONVERSATION);
    verify(bot, never()).sendMessage("7", "late", TelegramBotClient.PARSE_MODE_HTML);
  }

  @Test
  void timedOutRequestDoesNotCancelNewerOne() throws Exception {
    TelegramMessageHandler slow = handler("", Duration.ofMillis(50));
    TelegramMessageHandler patient = handler("", Duration.ofSeconds(5));

    CompletableFuture<Void> first = slow.handle(message("7", "one"));
    CompletableFuture<Void> second = patient.handle(message("7", "two"));
    first.get(5, TimeUnit.SECONDS);

    assertThat(table.contains("7")).isTrue();
    assertThat(router.route(reply("7", "answer"))).isEqualTo(RouteOutcome.RESOLVED);
    second.get(5, TimeUnit.SECONDS);
    verify(bot).sendMessage("7", "answer", TelegramBotClient.PARSE_MODE_HTML);
  }

  @Test
  void unauthorizedSenderIsIgnored() throws Exception {
    TelegramMessageHandler handler = handler("1001,alice", Duration.ofSeconds(5));

    handler.handle(new InboundChatMessage("42", "666", "mallory", "hi")).get(1, TimeUnit.SECONDS);

    assertThat(queue.size()).isZero();
    assertThat(table.size()).isZero();
    verifyNoInteractions(bot);
  }

  @Test
  void allowlistedUsernameIsAccepted() {
    TelegramMessageHandler handler = handler("1001,alice", Duration.ofSeconds(5));

    handler.handle(new InboundChatMessage("42", "2002", "alice", "hi"));

    assertThat(queue.size()).isEqualTo(1);
  }

  @Test
  void blankTextIsIgnoredButChatIsRemembered() throws Exception {
    TelegramMessageHandler handler = handler("", Duration.ofSeconds(5));

    handler.handle(message("42", "   ")).get(1, TimeUnit.SECONDS);

    assertThat(queue.size()).isZero();
    assertThat(knownChats.snapshot()).containsExactly("42");
  }

  @Test
  void htmlRejectionFallsBackToPlainText() throws Exception {
    doThrow(new TelegramDeliveryException("can't parse entities"))
        .when(bot)
        .sendMessage("42", "<b>ok</b>", TelegramBotClient.PARSE_MODE_HTML);
    TelegramMessageHandler handler = handler("", Duration.ofSeconds(5));

    CompletableFuture<Void> done = handler.handle(message("42", "hi"));
    router.route(reply("42", "**ok**"));
    done.get(5, TimeUnit.SECONDS);

    verify(bot).sendMessage("42", "**ok**");
  }

  @Test
  void deliveryFailureDoesNotFailTheHandler() throws Exception {
    doThrow(new TelegramDeliveryException("down")).when(bot).sendMessage(anyString(), anyString());
    TelegramMessageHandler handler = handler("", Duration.ofMillis(20));

    CompletableFuture<Void> done = handler.handle(message("9", "hi"));

    done.get(5, TimeUnit.SECONDS);
    assertThat(done).isCompleted().isNotCompletedExceptionally();
  }

  private TelegramMessageHandler handler(String allowlist, Duration timeout) {
    return new TelegramMessageHandler(
        dispatcher,
        table,
        knownChats,
        new SenderAccessPolicy(allowlist),
        replySender,
        Runnable::run,
        timeout);
  }

  private static InboundChatMessage message(String chatId, String text) {
    return new InboundChatMessage(chatId, "1001", "alice", text);
  }

  private static String reply(String conversationId, String text) {
    return "{\"type\":\"assistant.message.outbound\",\"data\":{\"conversationId\":\""
        + conversationId
        + "\",\"text\":\""
        + text
        + "\"}}";
  }
}
