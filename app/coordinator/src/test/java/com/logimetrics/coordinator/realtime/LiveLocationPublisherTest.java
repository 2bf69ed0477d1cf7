package com.logimetrics.coordinator.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logimetrics.coordinator.config.RealtimeProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

class LiveLocationPublisherTest {

  private static final UUID COMPANY = UUID.randomUUID();
  private static final UUID VEHICLE = UUID.randomUUID();
  private static final UUID SHIPMENT = UUID.randomUUID();
  private static final RealtimePrincipal DRIVER =
      new RealtimePrincipal(UUID.randomUUID(), COMPANY, UUID.randomUUID(), Set.of("driver"));

  private final RealtimeBus bus = mock(RealtimeBus.class);
  private final RoomOwnershipResolver resolver = mock(RoomOwnershipResolver.class);
  private final StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
  private final MongoTemplate mongoTemplate = mock(MongoTemplate.class);
  @SuppressWarnings("unchecked")
  private final ValueOperations<String, String> values = mock(ValueOperations.class);
  private LiveLocationPublisher publisher;

  @BeforeEach
  void setUp() {
    when(redisTemplate.opsForValue()).thenReturn(values);
    when(resolver.companyOfVehicle(VEHICLE)).thenReturn(Optional.of(COMPANY));
    publisher =
        new LiveLocationPublisher(
            bus,
            resolver,
            redisTemplate,
            mongoTemplate,
            new ObjectMapper(),
            new RealtimeProperties(null, null, Duration.ofMinutes(10), null, 0),
            Clock.fixed(Instant.parse("2026-10-18T08:15:00Z"), ZoneOffset.UTC));
  }

  @Test
  void driverPingIsCachedStoredAndFannedOut() {
    publisher.publish(DRIVER, new DriverLocation(VEHICLE, SHIPMENT, 12.97, 77.59, 42.0, 90.0));

    verify(values)
        .set(eq("tracking:vehicle:" + VEHICLE), anyString(), eq(Duration.ofMinutes(10)));
    verify(values).set(eq("tracking:latest:" + VEHICLE), anyString(), eq(Duration.ofMinutes(10)));
    final ArgumentCaptor<Document> stored = ArgumentCaptor.forClass(Document.class);
    verify(mongoTemplate).insert(stored.capture(), eq("live_tracking"));
    final Document location = stored.getValue().get("location", Document.class);
    assertThat(location.getList("coordinates", Double.class)).containsExactly(77.59, 12.97);
    final ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
    verify(bus).emitToTracking(eq(SHIPMENT.toString()), eq("location:update"), payload.capture());
    @SuppressWarnings("unchecked")
    final Map<String, Object> sent = (Map<String, Object>) payload.getValue();
    assertThat(sent)
        .containsEntry("timestamp", "2026-10-18T08:15:00Z")
        .containsEntry("driverId", DRIVER.driverId());
    verify(bus).emitToVehicle(eq(VEHICLE), eq("vehicle:location"), any());
  }

  @Test
  void cacheOutageDoesNotBlockTheBroadcast() {
    doThrow(new QueryTimeoutException("redis timeout"))
        .when(values)
        .set(anyString(), anyString(), any(Duration.class));

    publisher.publish(DRIVER, new DriverLocation(VEHICLE, null, 12.97, 77.59, null, null));

    verify(bus).emitToVehicle(eq(VEHICLE), eq("vehicle:location"), any());
  }

  @Test
  void nonDriversAndForeignVehiclesAreRejected() {
    final RealtimePrincipal manager =
        new RealtimePrincipal(UUID.randomUUID(), COMPANY, null, Set.of("fleet_manager"));
    final UUID foreign = UUID.randomUUID();
    when(resolver.companyOfVehicle(foreign)).thenReturn(Optional.of(UUID.randomUUID()));

    assertThatThrownBy(
            () -> publisher.publish(manager, new DriverLocation(VEHICLE, null, 1, 1, null, null)))
        .isInstanceOf(RealtimeAccessDeniedException.class);
    assertThatThrownBy(
            () -> publisher.publish(DRIVER, new DriverLocation(foreign, null, 1, 1, null, null)))
        .isInstanceOf(RealtimeAccessDeniedException.class)
        .hasMessageContaining("vehicle not in driver's company");
    verifyNoInteractions(bus, mongoTemplate);
  }

  @Test
  void outOfRangeCoordinatesAreRejected() {
    assertThatThrownBy(
            () -> publisher.publish(DRIVER, new DriverLocation(VEHICLE, null, 91, 10, null, null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("coordinates out of range");
  }
}
