package com.logicsignalprotector.cortexconnector.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

/**
 * Cortex-M backend settings.
 *
 * <p>{@code baseUrl} is the REST root (for example {@code http://cortex-m:8080/api/cortex-m/v1});
 * the WebSocket endpoint is derived from it.
 */
@ConfigurationProperties(prefix = "cortex")
public record CortexProperties(
    String baseUrl,
    @DefaultValue("telegram-1") String connectorId,
    @DefaultValue("180s") Duration replyTimeout,
    @DefaultValue("10s") Duration sessionTimeout,
    @DefaultValue("1MB") DataSize maxFrameSize,
    @DefaultValue Backoff backoff) {

  public CortexProperties {
    baseUrl = stripTrailingSlash(baseUrl);
    connectorId = connectorId == null || connectorId.isBlank() ? "telegram-1" : connectorId.trim();
  }

  public record Backoff(
      @DefaultValue("2s") Duration initial, @DefaultValue("60s") Duration max) {}

  private static String stripTrailingSlash(String url) {
    if (url == null) {
      return null;
    }
    String out = url.trim();
    while (out.endsWith("/")) {
      out = out.substring(0, out.length() - 1);
    }
    return out;
  }
}
