package com.logicsignalprotector.cortexconnector.relay;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logicsignalprotector.cortexconnector.client.TelegramBotClient;
import com.logicsignalprotector.cortexconnector.client.TelegramDeliveryException;
import com.logicsignalprotector.cortexconnector.relay.DispatchRouter.RouteOutcome;
import com.logicsignalprotector.cortexconnector.render.TelegramMarkupRenderer;
import com.logicsignalprotector.cortexconnector.telegram.ReplySender;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DispatchRouterTest {

  private TelegramBotClient bot;
  private CorrelationTable table;
  private KnownChatRegistry knownChats;
  private DispatchRouter router;

  @BeforeEach
  void setUp() {
    bot = mock(TelegramBotClient.class);
    table = new CorrelationTable(Clock.systemUTC());
    knownChats = new KnownChatRegistry();
    router =
        new DispatchRouter(
            new EnvelopeCodec(new ObjectMapper(), Clock.systemUTC(), "telegram-1"),
            table,
            knownChats,
            new ReplySender(bot, new TelegramMarkupRenderer()));
  }

  @Test
  void replyResolvesPendingRequest() {
    PendingRequest request = table.register("42", "env");

    RouteOutcome outcome = router.route(reply("42", "ok"));

    assertThat(outcome).isEqualTo(RouteOutcome.RESOLVED);
    assertThat(request.reply()).isCompletedWithValue("ok");
    verifyNoInteractions(bot);
  }

  @Test
  void replyWithoutTextResolvesWithEmptyString() {
    PendingRequest request = table.register("42", "env");

    router.route("{\"type\":\"assistant.message.outbound\",\"data\":{\"conversationId\":\"42\"}}");

    assertThat(request.reply()).isCompletedWithValue("");
  }

  @Test
  void unknownConversationIsDropped() {
    assertThat(router.route(reply("99", "late"))).isEqualTo(RouteOutcome.UNKNOWN_CONVERSATION);
    verifyNoInteractions(bot);
  }

  @Test
  void otherEventTypesAreIgnored() {
    table.register("42", "env");

    RouteOutcome outcome =
        router.route(
            "{\"type\":\"assistant.message.inbound\",\"data\":{\"conversationId\":\"42\"}}");

    assertThat(outcome).isEqualTo(RouteOutcome.IGNORED);
    assertThat(table.contains("42")).isTrue();
  }

  @Test
  void malformedFramesAreReportedNotThrown() {
    assertThat(router.route("garbage")).isEqualTo(RouteOutcome.MALFORMED);
    assertThat(router.route(null)).isEqualTo(RouteOutcome.MALFORMED);
  }

  @Test
  void broadcastReachesEveryKnownChatDespiteOneFailure() {
    knownChats.remember("1");
    knownChats.remember("2");
    knownChats.remember("3");
    doThrow(new TelegramDeliveryException("blocked"))
        .when(bot)
        .sendMessage(eq("2"), anyString(), eq(TelegramBotClient.PARSE_MODE_HTML));
    doThrow(new TelegramDeliveryException("blocked")).when(bot).sendMessage("2", "**news**");

    RouteOutcome outcome = router.route(reply("broadcast", "**news**"));

    assertThat(outcome).isEqualTo(RouteOutcome.BROADCAST);
    verify(bot).sendMessage("1", "<b>news</b>", TelegramBotClient.PARSE_MODE_HTML);
    verify(bot).sendMessage("3", "<b>news</b>", TelegramBotClient.PARSE_MODE_HTML);
    verify(bot).sendMessage("2", "**news**");
  }

  @Test
  void broadcastFallsBackToPlainTextPerChat() {
    knownChats.remember("5");
    doThrow(new TelegramDeliveryException("can't parse entities"))
        .when(bot)
        .sendMessage("5", "<b>news</b>", TelegramBotClient.PARSE_MODE_HTML);

    router.route(reply("broadcast", "**news**"));

    verify(bot).sendMessage("5", "**news**");
  }

  @Test
  void broadcastWithNoKnownChatsSendsNothing() {
    assertThat(router.route(reply("broadcast", "hi"))).isEqualTo(RouteOutcome.BROADCAST);
    verify(bot, never()).sendMessage(anyString(), anyString());
    verify(bot, never()).sendMessage(anyString(), anyString(), anyString());
  }

  private static String reply(String conversationId, String text) {
    return "{\"specversion\":\"1.0\",\"type\":\"assistant.message.outbound\",\"id\":\"r1\","
        + "\"data\":{\"conversationId\":\""
        + conversationId
        + "\",\"text\":\""
        + text
        + "\"}}";
  }
}
