package com.logimetrics.coordinator.integration;

import java.net.SocketTimeoutException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/** Maps RestClient failures of outbound collaborators to {@link IntegrationCallException}. */
final class HttpFailures {

  private HttpFailures() {}

  static IntegrationCallException fromResponse(String target, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    if (status == 401 || status == 403) {
      return new IntegrationCallException(
          IntegrationCallException.Reason.UNAUTHORIZED, target + " rejected credentials", ex);
    }
    return new IntegrationCallException(
        IntegrationCallException.Reason.BAD_GATEWAY, target + " answered " + status, ex);
  }

  static IntegrationCallException fromResource(String target, ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return new IntegrationCallException(
            IntegrationCallException.Reason.TIMEOUT, target + " request timeout", ex);
      }
      current = current.getCause();
    }
    return new IntegrationCallException(
        IntegrationCallException.Reason.BAD_GATEWAY, target + " connection failed", ex);
  }
}
