/*
 * Where: Coordinator configuration
 * What: One RestClient per outbound HTTP collaborator, all with bounded timeouts
 * Why: A slow provider must time out inside its own job instead of holding a worker forever
 */
package com.logimetrics.coordinator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class IntegrationClientConfig {

  @Bean
  RestClient smsRestClient(
      RestClient.Builder builder,
      ChannelProperties channels,
      IntegrationProperties integrations) {
    return withBaseUrl(timed(builder, integrations), channels.sms().baseUrl()).build();
  }

  @Bean
  RestClient pushRestClient(
      RestClient.Builder builder,
      ChannelProperties channels,
      IntegrationProperties integrations) {
    return withBaseUrl(timed(builder, integrations), channels.push().gatewayUrl()).build();
  }

  @Bean
  RestClient mlRestClient(
      RestClient.Builder builder, FeatureProperties features, IntegrationProperties integrations) {
    return withBaseUrl(timed(builder, integrations), features.mlServiceUrl()).build();
  }

  @Bean
  RestClient paymentRestClient(RestClient.Builder builder, IntegrationProperties integrations) {
    return withBaseUrl(timed(builder, integrations), integrations.paymentGatewayUrl()).build();
  }

  // tenant integrations carry their own base urls
  @Bean
  RestClient integrationRestClient(
      RestClient.Builder builder, IntegrationProperties integrations) {
    return timed(builder, integrations).build();
  }

  @Bean
  RestClient healthRestClient(RestClient.Builder builder, IntegrationProperties integrations) {
    return timed(builder, integrations).build();
  }

  private static RestClient.Builder timed(
      RestClient.Builder builder, IntegrationProperties integrations) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(integrations.connectTimeout());
    requestFactory.setReadTimeout(integrations.readTimeout());
    return builder.clone().requestFactory(requestFactory);
  }

  private static RestClient.Builder withBaseUrl(RestClient.Builder builder, String baseUrl) {
    return baseUrl == null || baseUrl.isBlank() ? builder : builder.baseUrl(baseUrl);
  }
}
