package com.logicsignalprotector.cortexconnector.config;

import com.logicsignalprotector.cortexconnector.connection.BackendTransport;
import com.logicsignalprotector.cortexconnector.connection.SpringWebSocketTransport;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

@Configuration
public class RelayConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Runs reply/timeout continuations so Telegram calls never block the connection reader. */
  @Bean
  public ThreadPoolTaskExecutor relayExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("relay-");
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(10_000);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    return executor;
  }

  @Bean
  public WebSocketClient cortexWebSocketClient(CortexProperties properties) {
    WebSocketContainer container = ContainerProvider.getWebSocketContainer();
    int maxFrame = Math.toIntExact(properties.maxFrameSize().toBytes());
    container.setDefaultMaxTextMessageBufferSize(maxFrame);
    return new StandardWebSocketClient(container);
  }

  @Bean
  public BackendTransport backendTransport(
      WebSocketClient cortexWebSocketClient, CortexProperties properties) {
    return new SpringWebSocketTransport(cortexWebSocketClient, properties.sessionTimeout());
  }
}
