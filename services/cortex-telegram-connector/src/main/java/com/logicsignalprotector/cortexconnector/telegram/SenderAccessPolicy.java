package com.logicsignalprotector.cortexconnector.telegram;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Allowlist of Telegram user ids and usernames. An empty list lets everyone in, which is logged
 * loudly at startup.
 */
@Component
@Slf4j
public class SenderAccessPolicy {

  private final Set<String> allowed;

  public SenderAccessPolicy(@Value("${telegram.allowlist:}") String allowlist) {
    this.allowed =
        allowlist == null
            ? Set.of()
            : Arrays.stream(allowlist.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    if (allowed.isEmpty()) {
      log.warn("WARNING: TELEGRAM_ALLOWLIST is not set, the bot is open to EVERYONE!");
      log.warn("Set TELEGRAM_ALLOWLIST to a comma-separated list of allowed user IDs or usernames.");
    }
  }

  boolean isOpen() {
    return allowed.isEmpty();
  }

  public boolean isAllowed(String senderId, String username) {
    if (allowed.isEmpty()) {
      return true;
    }
    if (senderId != null && allowed.contains(senderId)) {
      return true;
    }
    return username != null && !username.isBlank() && allowed.contains(username);
  }
}
