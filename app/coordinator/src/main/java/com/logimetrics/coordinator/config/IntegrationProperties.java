/*
 * Where: Coordinator configuration binding
 * What: Endpoints and timeouts of outbound HTTP collaborators
 * Why: The ML service and payment gateway differ per environment and may be absent
 */
package com.logimetrics.coordinator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "coordinator.integrations")
public record IntegrationProperties(
    Duration connectTimeout,
    Duration readTimeout,
    String mlPredictPath,
    String paymentGatewayUrl,
    String paymentGatewayApiKey,
    String paymentStatusPath) {

  public IntegrationProperties {
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
    mlPredictPath =
        mlPredictPath == null || mlPredictPath.isBlank() ? "/predict/eta" : mlPredictPath;
    paymentGatewayUrl = paymentGatewayUrl == null ? "" : paymentGatewayUrl.trim();
    paymentGatewayApiKey = paymentGatewayApiKey == null ? "" : paymentGatewayApiKey;
    paymentStatusPath =
        paymentStatusPath == null || paymentStatusPath.isBlank()
            ? "/v1/payments/{reference}"
            : paymentStatusPath;
  }
}
