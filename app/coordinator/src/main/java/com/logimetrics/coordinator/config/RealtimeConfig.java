/*
 * Where: Coordinator configuration
 * What: Registers the realtime WebSocket endpoint and the bus that fans events out to rooms
 * Why: All socket writes go through one dispatcher thread so rooms never need shared locks
 */
package com.logimetrics.coordinator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.logimetrics.coordinator.realtime.RealtimeBus;
import com.logimetrics.coordinator.realtime.RealtimeHandshakeInterceptor;
import com.logimetrics.coordinator.realtime.RealtimeWebSocketHandler;
import java.time.Clock;
import java.util.concurrent.Executors;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class RealtimeConfig implements WebSocketConfigurer {

  private final RealtimeWebSocketHandler handler;
  private final RealtimeHandshakeInterceptor handshakeInterceptor;
  private final RealtimeProperties properties;

  // static: the bus must exist before this configurer, whose handler depends on it
  @Bean(destroyMethod = "shutdown")
  static RealtimeBus realtimeBus(ObjectMapper objectMapper, Clock clock) {
    return new RealtimeBus(
        objectMapper,
        clock,
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("realtime-bus-%d").setDaemon(true).build()));
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(handler, properties.path())
        .addInterceptors(handshakeInterceptor)
        .setAllowedOriginPatterns(properties.allowedOrigins().toArray(String[]::new));
  }
}
