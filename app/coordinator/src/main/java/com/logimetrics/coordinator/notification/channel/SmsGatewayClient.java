/*
 * Where: Notification channels
 * What: HTTP client of the SMS provider
 * Why: Keeps provider wire details out of the channel sink
 */
package com.logimetrics.coordinator.notification.channel;

import com.logimetrics.coordinator.config.ChannelProperties;
import com.logimetrics.coordinator.notification.NotificationChannel;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class SmsGatewayClient {

  private final RestClient restClient;
  private final ChannelProperties.Sms properties;

  public SmsGatewayClient(
      @Qualifier("smsRestClient") RestClient restClient, ChannelProperties channelProperties) {
    this.restClient = restClient;
    this.properties = channelProperties.sms();
  }

  public boolean isConfigured() {
    return properties.configured();
  }

  public void send(String phone, String text) {
    try {
      restClient
          .post()
          .uri(properties.sendPath())
          .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey())
          .contentType(MediaType.APPLICATION_JSON)
          .body(Map.of("to", phone, "from", properties.sender(), "text", text))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientException ex) {
      throw new ChannelFailedException(NotificationChannel.SMS, "sms provider call failed", ex);
    }
  }
}
