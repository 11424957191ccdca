package com.logicsignalprotector.cortexconnector.telegram;

import com.logicsignalprotector.cortexconnector.config.CortexProperties;
import com.logicsignalprotector.cortexconnector.relay.CorrelationTable;
import com.logicsignalprotector.cortexconnector.relay.KnownChatRegistry;
import com.logicsignalprotector.cortexconnector.relay.OutboundDispatcher;
import com.logicsignalprotector.cortexconnector.relay.PendingRequest;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Forwards a Telegram message to Cortex-M and answers the chat once the reply arrives, or with a
 * "try again" notice when it does not arrive within the reply timeout.
 *
 * <p>Waiting does not hold a thread: the reply slot is a future and the continuation runs on the
 * relay executor.
 */
@Service
@Slf4j
public class TelegramMessageHandler {

  public static final String TIMEOUT_NOTICE =
      "⏳ Cortex-M did not respond in time. Please try again.";

  private final OutboundDispatcher dispatcher;
  private final CorrelationTable table;
  private final KnownChatRegistry knownChats;
  private final SenderAccessPolicy accessPolicy;
  private final ReplySender replySender;
  private final Executor executor;
  private final Duration replyTimeout;

  @Autowired
  public TelegramMessageHandler(
      OutboundDispatcher dispatcher,
      CorrelationTable table,
      KnownChatRegistry knownChats,
      SenderAccessPolicy accessPolicy,
      ReplySender replySender,
      @Qualifier("relayExecutor") Executor executor,
      CortexProperties properties) {
    this(
        dispatcher,
        table,
        knownChats,
        accessPolicy,
        replySender,
        executor,
        properties.replyTimeout());
  }

  public TelegramMessageHandler(
      OutboundDispatcher dispatcher,
      CorrelationTable table,
      KnownChatRegistry knownChats,
      SenderAccessPolicy accessPolicy,
      ReplySender replySender,
      Executor executor,
      Duration replyTimeout) {
    this.dispatcher = dispatcher;
    this.table = table;
    this.knownChats = knownChats;
    this.accessPolicy = accessPolicy;
    this.replySender = replySender;
    this.executor = executor;
    this.replyTimeout = replyTimeout;
  }

  /**
   * @return completes once the chat has been answered (or the message was ignored)
   */
  public CompletableFuture<Void> handle(InboundChatMessage message) {
    String chatId = message.chatId();
    knownChats.remember(chatId);

    String text = message.text() == null ? "" : message.text().trim();
    if (text.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }

    if (!accessPolicy.isAllowed(message.senderId(), message.senderUsername())) {
      log.warn(
          "Unauthorized access attempt from user {} ({})",
          message.senderId(),
          message.senderUsername());
      return CompletableFuture.completedFuture(null);
    }

    String conversationId = chatId;
    PendingRequest request = dispatcher.submit(conversationId, chatId, text);

    return request
        .reply()
        .orTimeout(replyTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .handleAsync(
            (reply, error) -> {
              if (error == null) {
                answer(chatId, reply);
              } else {
                giveUp(request, unwrap(error));
              }
              return null;
            },
            executor);
  }

  private void answer(String chatId, String reply) {
    try {
      replySender.deliver(chatId, reply == null ? "" : reply);
    } catch (RuntimeException e) {
      log.warn("Failed to deliver reply to chat {}: {}", chatId, e.getMessage());
    }
  }

  private void giveUp(PendingRequest request, Throwable error) {
    table.cancel(request);
    String chatId = request.conversationId();
    if (error instanceof TimeoutException) {
      log.warn("No reply for chat {} within {}s", chatId, replyTimeout.toSeconds());
    } else {
      log.warn("Reply for chat {} abandoned: {}", chatId, error.toString());
    }
    try {
      replySender.deliverPlain(chatId, TIMEOUT_NOTICE);
    } catch (RuntimeException e) {
      log.warn("Failed to send timeout notice to chat {}: {}", chatId, e.getMessage());
    }
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
