package com.logimetrics.coordinator.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logimetrics.coordinator.config.IntegrationProperties;
import com.logimetrics.coordinator.domain.PaymentTransaction;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class PaymentGatewayClientTest {

  private static final String BASE_URL = "http://payments.test";

  @Test
  void statusReadsGatewayAndNormalizesCapturedToCompleted() {
    final ClientFixture fixture = newFixture(BASE_URL);
    fixture
        .server
        .expect(requestTo(BASE_URL + "/v1/payments/pay_1"))
        .andExpect(method(GET))
        .andExpect(header("Authorization", "Bearer secret"))
        .andRespond(
            withSuccess(
                """
                {"id":"pay_1","status":"Captured"}
                """,
                MediaType.APPLICATION_JSON));

    final PaymentGatewayClient.GatewayStatus status = fixture.client.status("pay_1");

    assertThat(status.status()).isEqualTo(PaymentTransaction.COMPLETED);
    assertThat(status.rawResponse()).contains("\"id\":\"pay_1\"");
    fixture.server.verify();
  }

  @Test
  void unknownGatewayStatusStaysPending() {
    assertThat(PaymentGatewayClient.normalize("requires_action"))
        .isEqualTo(PaymentTransaction.PENDING);
    assertThat(PaymentGatewayClient.normalize(" DECLINED ")).isEqualTo(PaymentTransaction.FAILED);
    assertThat(PaymentGatewayClient.normalize("processing"))
        .isEqualTo(PaymentTransaction.PROCESSING);
  }

  @Test
  void unconfiguredGatewayIsRejectedWithoutCall() {
    final ClientFixture fixture = newFixture("");

    assertThat(fixture.client.isConfigured()).isFalse();
    assertThatThrownBy(() -> fixture.client.status("pay_1"))
        .isInstanceOf(IntegrationCallException.class)
        .extracting(ex -> ((IntegrationCallException) ex).reason())
        .isEqualTo(IntegrationCallException.Reason.NOT_CONFIGURED);
  }

  @Test
  void rejectedCredentialsMapToUnauthorized() {
    final ClientFixture fixture = newFixture(BASE_URL);
    fixture
        .server
        .expect(requestTo(BASE_URL + "/v1/payments/pay_1"))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> fixture.client.status("pay_1"))
        .isInstanceOf(IntegrationCallException.class)
        .extracting(ex -> ((IntegrationCallException) ex).reason())
        .isEqualTo(IntegrationCallException.Reason.UNAUTHORIZED);
  }

  @Test
  void missingStatusFieldMapsToInvalidResponse() {
    final ClientFixture fixture = newFixture(BASE_URL);
    fixture
        .server
        .expect(requestTo(BASE_URL + "/v1/payments/pay_1"))
        .andRespond(withSuccess("{\"id\":\"pay_1\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.status("pay_1"))
        .isInstanceOf(IntegrationCallException.class)
        .extracting(ex -> ((IntegrationCallException) ex).reason())
        .isEqualTo(IntegrationCallException.Reason.INVALID_RESPONSE);
  }

  @Test
  void readTimeoutMapsToTimeout() {
    final ClientFixture fixture = newFixture(BASE_URL);
    fixture
        .server
        .expect(requestTo(BASE_URL + "/v1/payments/pay_1"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.client.status("pay_1"))
        .isInstanceOf(IntegrationCallException.class)
        .extracting(ex -> ((IntegrationCallException) ex).reason())
        .isEqualTo(IntegrationCallException.Reason.TIMEOUT);
  }

  @Test
  void blankReferenceIsRejected() {
    final ClientFixture fixture = newFixture(BASE_URL);

    assertThatThrownBy(() -> fixture.client.status(" "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("gatewayReference is required");
  }

  private ClientFixture newFixture(String baseUrl) {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl(BASE_URL).build();
    final IntegrationProperties properties =
        new IntegrationProperties(null, null, null, baseUrl, "secret", null);
    return new ClientFixture(
        new PaymentGatewayClient(restClient, properties, new ObjectMapper()), server);
  }

  private record ClientFixture(PaymentGatewayClient client, MockRestServiceServer server) {}
}
