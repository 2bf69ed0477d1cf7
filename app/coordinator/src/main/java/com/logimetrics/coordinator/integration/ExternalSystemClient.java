/*
 * Where: Outbound integrations
 * What: Asks a tenant's ERP, TMS or WMS to sync changes since the last successful run
 * Why: Each tenant configures its own endpoint and key, so calls go to absolute URLs
 */
package com.logimetrics.coordinator.integration;

import com.logimetrics.coordinator.domain.Integration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class ExternalSystemClient {

  static final String SYNC_PATH = "/sync";

  private final RestClient restClient;

  public ExternalSystemClient(@Qualifier("integrationRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  public void requestSync(Integration integration, Instant since) {
    if (integration.baseUrl() == null || integration.baseUrl().isBlank()) {
      throw new IntegrationCallException(
          IntegrationCallException.Reason.NOT_CONFIGURED, "integration has no base url");
    }
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("companyId", integration.companyId().toString());
    body.put("system", integration.type());
    body.put("since", since == null ? null : since.toString());
    final String target = integration.type() + " integration";
    try {
      final RestClient.RequestBodySpec spec =
          restClient
              .post()
              .uri(stripTrailingSlash(integration.baseUrl()) + SYNC_PATH)
              .contentType(MediaType.APPLICATION_JSON);
      if (integration.apiKey() != null && !integration.apiKey().isBlank()) {
        spec.header(HttpHeaders.AUTHORIZATION, "Bearer " + integration.apiKey());
      }
      spec.body(body).retrieve().toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw HttpFailures.fromResponse(target, ex);
    } catch (ResourceAccessException ex) {
      throw HttpFailures.fromResource(target, ex);
    } catch (RestClientException ex) {
      throw new IntegrationCallException(
          IntegrationCallException.Reason.BAD_GATEWAY, target + " request failed", ex);
    }
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
