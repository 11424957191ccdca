package com.logicsignalprotector.cortexconnector.relay;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** Chats that have written to the bot since startup. Used only for broadcast fan-out. */
@Component
public class KnownChatRegistry {

  private final Set<String> chats = ConcurrentHashMap.newKeySet();

  public void remember(String chatId) {
    if (chatId != null && !chatId.isBlank()) {
      chats.add(chatId);
    }
  }

  public List<String> snapshot() {
    return List.copyOf(chats);
  }

  public int size() {
    return chats.size();
  }
}
