/*
 * Where: Notification channels
 * What: HTTP client of the web push relay that signs and forwards payloads to browser endpoints
 * Why: The relay reports endpoints that no longer exist so subscriptions can be pruned
 */
package com.logimetrics.coordinator.notification.channel;

import com.logimetrics.coordinator.config.ChannelProperties;
import com.logimetrics.coordinator.notification.NotificationChannel;
import com.logimetrics.coordinator.notification.PushSubscription;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class PushGatewayClient {

  public enum Delivery {
    DELIVERED,
    GONE
  }

  private final RestClient restClient;
  private final ChannelProperties.Push properties;

  public PushGatewayClient(
      @Qualifier("pushRestClient") RestClient restClient, ChannelProperties channelProperties) {
    this.restClient = restClient;
    this.properties = channelProperties.push();
  }

  public boolean isConfigured() {
    return properties.configured();
  }

  public Delivery send(PushSubscription subscription, Map<String, Object> payload) {
    try {
      restClient
          .post()
          .uri("/v1/push")
          .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey())
          .contentType(MediaType.APPLICATION_JSON)
          .body(
              Map.of(
                  "subscription", subscription,
                  "payload", payload,
                  "ttl", properties.ttl().toSeconds()))
          .retrieve()
          .toBodilessEntity();
      return Delivery.DELIVERED;
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)
          || ex.getStatusCode().isSameCodeAs(HttpStatus.GONE)) {
        return Delivery.GONE;
      }
      throw new ChannelFailedException(NotificationChannel.PUSH, "push relay rejected", ex);
    } catch (RestClientException ex) {
      throw new ChannelFailedException(NotificationChannel.PUSH, "push relay call failed", ex);
    }
  }
}
