/*
 * Where: Coordinator configuration binding
 * What: Provider settings of the outbound email, SMS and push channels
 * Why: A channel whose provider is not configured is disabled without failing delivery
 */
package com.logimetrics.coordinator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "coordinator.channels")
public record ChannelProperties(Email email, Sms sms, Push push) {

  public ChannelProperties {
    email = email == null ? new Email(null, null) : email;
    sms = sms == null ? new Sms(null, null, null, null) : sms;
    push = push == null ? new Push(null, null, null) : push;
  }

  public record Email(String from, String appUrl) {
    public Email {
      from = from == null || from.isBlank() ? "LogiMetrics <noreply@logimetrics.app>" : from;
      appUrl = appUrl == null ? "" : appUrl;
    }
  }

  public record Sms(String baseUrl, String apiKey, String sender, String sendPath) {
    public Sms {
      baseUrl = baseUrl == null ? "" : baseUrl.trim();
      apiKey = apiKey == null ? "" : apiKey;
      sender = sender == null || sender.isBlank() ? "LOGIMT" : sender;
      sendPath = sendPath == null || sendPath.isBlank() ? "/v1/messages" : sendPath;
    }

    public boolean configured() {
      return !baseUrl.isEmpty();
    }
  }

  public record Push(String gatewayUrl, String apiKey, Duration ttl) {
    public Push {
      gatewayUrl = gatewayUrl == null ? "" : gatewayUrl.trim();
      apiKey = apiKey == null ? "" : apiKey;
      ttl = ttl == null ? Duration.ofHours(24) : ttl;
    }

    public boolean configured() {
      return !gatewayUrl.isEmpty();
    }
  }
}
