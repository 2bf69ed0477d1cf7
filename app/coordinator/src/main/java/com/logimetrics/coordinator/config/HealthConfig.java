package com.logimetrics.coordinator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logimetrics.coordinator.health.HealthMonitor;
import com.logimetrics.coordinator.health.HttpServiceProbe;
import com.logimetrics.coordinator.health.StoreProbe;
import com.logimetrics.coordinator.realtime.RealtimeBus;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.client.RestClient;

/** Store probes are components; HTTP probes come from configuration. */
@Configuration
public class HealthConfig {

  static final String ML_SERVICE_PROBE = "ml-service";

  @Bean
  HealthMonitor healthMonitor(
      List<StoreProbe> storeProbes,
      HealthProperties healthProperties,
      FeatureProperties features,
      @Qualifier("healthRestClient") RestClient healthRestClient,
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      RealtimeBus realtimeBus,
      MeterRegistry meterRegistry,
      Clock clock) {
    final List<StoreProbe> probes = new ArrayList<>(storeProbes);
    probes.addAll(httpProbes(healthProperties, features, healthRestClient));
    return new HealthMonitor(
        probes,
        redisTemplate,
        objectMapper,
        realtimeBus,
        meterRegistry,
        healthProperties.snapshotTtl(),
        clock);
  }

  static List<StoreProbe> httpProbes(
      HealthProperties healthProperties, FeatureProperties features, RestClient restClient) {
    final Map<String, String> urls = new TreeMap<>(healthProperties.externalServices());
    if (features.mlPredictionsEnabled()) {
      urls.putIfAbsent(ML_SERVICE_PROBE, stripTrailingSlash(features.mlServiceUrl()) + "/health");
    }
    final List<StoreProbe> probes = new ArrayList<>(urls.size());
    urls.forEach((name, url) -> probes.add(new HttpServiceProbe(name, url, restClient)));
    return probes;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
