package com.logimetrics.coordinator.health;

import org.springframework.web.client.RestClient;

/** GETs a health URL; any non-2xx answer or transport error is unhealthy. */
public class HttpServiceProbe implements StoreProbe {

  private final String name;
  private final String url;
  private final RestClient restClient;

  public HttpServiceProbe(String name, String url, RestClient restClient) {
    this.name = name;
    this.url = url;
    this.restClient = restClient;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void probe() {
    restClient.get().uri(url).retrieve().toBodilessEntity();
  }
}
