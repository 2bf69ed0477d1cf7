package com.logimetrics.coordinator.integration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logimetrics.coordinator.config.IntegrationProperties;
import com.logimetrics.coordinator.domain.PaymentTransaction;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Locale;
import java.util.Set;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/** Reads the settlement status of a payment from the gateway. */
@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ObjectMapper is a shared Spring-managed component")
public class PaymentGatewayClient {

  private static final Set<String> COMPLETED_STATUSES =
      Set.of("completed", "captured", "succeeded");
  private static final Set<String> FAILED_STATUSES = Set.of("failed", "declined", "cancelled");

  private final RestClient restClient;
  private final IntegrationProperties properties;
  private final ObjectMapper objectMapper;

  public record GatewayStatus(String status, String rawResponse) {}

  public PaymentGatewayClient(
      @Qualifier("paymentRestClient") RestClient restClient,
      IntegrationProperties properties,
      ObjectMapper objectMapper) {
    this.restClient = restClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  public boolean isConfigured() {
    return !properties.paymentGatewayUrl().isEmpty();
  }

  /** Gateway status mapped onto {@link PaymentTransaction} status values. */
  public GatewayStatus status(String gatewayReference) {
    if (!isConfigured()) {
      throw new IntegrationCallException(
          IntegrationCallException.Reason.NOT_CONFIGURED, "payment gateway url is not set");
    }
    if (gatewayReference == null || gatewayReference.isBlank()) {
      throw new IllegalArgumentException("gatewayReference is required");
    }
    final String body;
    try {
      body =
          restClient
              .get()
              .uri(properties.paymentStatusPath(), gatewayReference)
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.paymentGatewayApiKey())
              .retrieve()
              .body(String.class);
    } catch (RestClientResponseException ex) {
      throw HttpFailures.fromResponse("payment gateway", ex);
    } catch (ResourceAccessException ex) {
      throw HttpFailures.fromResource("payment gateway", ex);
    } catch (RestClientException ex) {
      throw new IntegrationCallException(
          IntegrationCallException.Reason.BAD_GATEWAY, "payment gateway request failed", ex);
    }
    return new GatewayStatus(normalize(readStatus(body)), body);
  }

  private String readStatus(String body) {
    try {
      final JsonNode node = body == null ? null : objectMapper.readTree(body);
      if (node == null || !node.hasNonNull("status")) {
        throw new IntegrationCallException(
            IntegrationCallException.Reason.INVALID_RESPONSE, "payment status missing");
      }
      return node.get("status").asText();
    } catch (JsonProcessingException ex) {
      throw new IntegrationCallException(
          IntegrationCallException.Reason.INVALID_RESPONSE, "payment response parse failed", ex);
    }
  }

  static String normalize(String gatewayStatus) {
    final String status = gatewayStatus.trim().toLowerCase(Locale.ROOT);
    if (COMPLETED_STATUSES.contains(status)) {
      return PaymentTransaction.COMPLETED;
    }
    if (FAILED_STATUSES.contains(status)) {
      return PaymentTransaction.FAILED;
    }
    if (PaymentTransaction.PROCESSING.equals(status)) {
      return PaymentTransaction.PROCESSING;
    }
    return PaymentTransaction.PENDING;
  }
}
