/*
 * Where: Outbound integrations
 * What: Batch ETA predictions from the ML service
 * Why: The service is optional; results with unusable ids or timestamps are skipped, not fatal
 */
package com.logimetrics.coordinator.integration;

import com.logimetrics.coordinator.config.IntegrationProperties;
import com.logimetrics.coordinator.domain.ShipmentRepository.EtaCandidate;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class MlPredictionClient {

  private static final Logger logger = LoggerFactory.getLogger(MlPredictionClient.class);

  private final RestClient restClient;
  private final IntegrationProperties properties;

  record PredictionRequest(List<Map<String, Object>> shipments) {}

  record PredictionResponse(List<Map<String, Object>> results) {}

  public MlPredictionClient(
      @Qualifier("mlRestClient") RestClient restClient, IntegrationProperties properties) {
    this.restClient = restClient;
    this.properties = properties;
  }

  public List<EtaPrediction> predictEta(List<EtaCandidate> shipments) {
    if (shipments.isEmpty()) {
      return List.of();
    }
    final List<Map<String, Object>> payload = new ArrayList<>(shipments.size());
    for (EtaCandidate shipment : shipments) {
      payload.add(toPayload(shipment));
    }
    final PredictionResponse response;
    try {
      response =
          restClient
              .post()
              .uri(properties.mlPredictPath())
              .contentType(MediaType.APPLICATION_JSON)
              .body(new PredictionRequest(payload))
              .retrieve()
              .body(PredictionResponse.class);
    } catch (RestClientResponseException ex) {
      throw HttpFailures.fromResponse("ml service", ex);
    } catch (ResourceAccessException ex) {
      throw HttpFailures.fromResource("ml service", ex);
    } catch (RestClientException ex) {
      throw new IntegrationCallException(
          IntegrationCallException.Reason.INVALID_RESPONSE, "ml service response unreadable", ex);
    }
    if (response == null || response.results() == null) {
      return List.of();
    }
    final List<EtaPrediction> predictions = new ArrayList<>(response.results().size());
    for (Map<String, Object> result : response.results()) {
      try {
        predictions.add(
            new EtaPrediction(
                UUID.fromString(String.valueOf(result.get("shipmentId"))),
                Instant.parse(String.valueOf(result.get("eta"))),
                result));
      } catch (IllegalArgumentException | DateTimeParseException ex) {
        logger.warn(
            "ml prediction ignored shipmentId={} eta={}",
            result.get("shipmentId"),
            result.get("eta"));
      }
    }
    return predictions;
  }

  private static Map<String, Object> toPayload(EtaCandidate shipment) {
    final Map<String, Object> origin = new LinkedHashMap<>();
    origin.put("lat", shipment.originLat());
    origin.put("lng", shipment.originLng());
    final Map<String, Object> destination = new LinkedHashMap<>();
    destination.put("lat", shipment.destinationLat());
    destination.put("lng", shipment.destinationLng());
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("id", shipment.id().toString());
    payload.put("origin", origin);
    payload.put("destination", destination);
    payload.put("vehicleType", shipment.vehicleType());
    payload.put("distance", shipment.distanceKm());
    payload.put("weight", shipment.weightKg());
    return payload;
  }
}
