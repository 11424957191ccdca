package com.logicsignalprotector.cortexconnector.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.logicsignalprotector.cortexconnector.config.CortexProperties;
import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;
import org.springframework.web.client.RestClient;

class SessionClientTest {

  @Test
  void switchesSchemeToWebSocket() {
    assertThat(SessionClient.toWebSocketBase("https://cortex.example/api"))
        .isEqualTo("wss://cortex.example/api");
    assertThat(SessionClient.toWebSocketBase("http://cortex-m:8080/api/cortex-m/v1"))
        .isEqualTo("ws://cortex-m:8080/api/cortex-m/v1");
    assertThat(SessionClient.toWebSocketBase("ws://already")).isEqualTo("ws://already");
  }

  @Test
  void connectionUriAppendsSessionId() {
    SessionClient client =
        new SessionClient(RestClient.builder(), properties("http://cortex-m:8080/api/cortex-m/v1/"));

    assertThat(client.connectionUri("abc-123"))
        .isEqualTo(URI.create("ws://cortex-m:8080/api/cortex-m/v1/connector/abc-123"));
  }

  @Test
  void missingBaseUrlFailsFast() {
    assertThatThrownBy(() -> new SessionClient(RestClient.builder(), properties(" ")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("CORTEX_M_URL");
  }

  private static CortexProperties properties(String baseUrl) {
    return new CortexProperties(
        baseUrl,
        "telegram-1",
        Duration.ofSeconds(180),
        Duration.ofSeconds(10),
        DataSize.ofMegabytes(1),
        new CortexProperties.Backoff(Duration.ofSeconds(2), Duration.ofSeconds(60)));
  }
}
