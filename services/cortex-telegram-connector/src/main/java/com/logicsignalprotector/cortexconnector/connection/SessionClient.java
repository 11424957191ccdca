package com.logicsignalprotector.cortexconnector.connection;

import com.logicsignalprotector.cortexconnector.config.CortexProperties;
import java.net.URI;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Connector session handshake: {@code GET {base}/connector} returns a plain-text session id, and
 * the WebSocket lives at {@code {base}/connector/{sessionId}} with the scheme switched to ws/wss.
 */
@Service
public class SessionClient {

  private final RestClient rest;
  private final String baseUrl;

  public SessionClient(RestClient.Builder builder, CortexProperties properties) {
    if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
      throw new IllegalStateException("cortex.base-url (CORTEX_M_URL) is not configured");
    }
    this.baseUrl = properties.baseUrl();

    int timeoutMs = Math.toIntExact(properties.sessionTimeout().toMillis());
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(timeoutMs);
    requestFactory.setReadTimeout(timeoutMs);
    this.rest = builder.baseUrl(baseUrl).requestFactory(requestFactory).build();
  }

  public String acquireSession() {
    String body;
    try {
      body = rest.get().uri("/connector").retrieve().body(String.class);
    } catch (RestClientException e) {
      throw new BackendUnavailableException("Session request failed: " + e.getMessage(), e);
    }
    String sessionId = body == null ? "" : body.trim();
    if (sessionId.isEmpty()) {
      throw new BackendUnavailableException("Session request returned an empty session id");
    }
    return sessionId;
  }

  public URI connectionUri(String sessionId) {
    return URI.create(toWebSocketBase(baseUrl) + "/connector/" + sessionId);
  }

  static String toWebSocketBase(String httpBase) {
    if (httpBase.startsWith("https://")) {
      return "wss://" + httpBase.substring("https://".length());
    }
    if (httpBase.startsWith("http://")) {
      return "ws://" + httpBase.substring("http://".length());
    }
    return httpBase;
  }
}
