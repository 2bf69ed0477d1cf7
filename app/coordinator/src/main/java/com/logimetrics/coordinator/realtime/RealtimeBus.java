/*
 * Where: Realtime bus
 * What: Server-side fan-out of events to rooms of live connections
 * Why: All membership changes and sends run on one dispatcher, so per-room order follows producer order
 */
package com.logimetrics.coordinator.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ObjectMapper and the dispatcher executor are shared Spring-managed components")
public class RealtimeBus {

  private static final Logger logger = LoggerFactory.getLogger(RealtimeBus.class);

  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ExecutorService dispatcher;
  private final RoomRegistry registry = new RoomRegistry();

  public RealtimeBus(ObjectMapper objectMapper, Clock clock, ExecutorService dispatcher) {
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.dispatcher = dispatcher;
  }

  public void connect(RealtimeConnection connection) {
    submit(() -> registry.register(connection));
  }

  public void join(String connectionId, RoomKey room) {
    submit(() -> registry.join(connectionId, room));
  }

  public void leave(String connectionId, RoomKey room) {
    submit(() -> registry.leave(connectionId, room));
  }

  public void disconnect(String connectionId) {
    submit(
        () -> {
          final Set<RoomKey> rooms = registry.remove(connectionId);
          logger.debug("realtime connection removed id={} rooms={}", connectionId, rooms.size());
        });
  }

  public void emitToUser(UUID userId, String event, Object payload) {
    emitToRoom(RoomKey.of(RoomScope.USER, userId), event, payload);
  }

  public void emitToCompany(UUID companyId, String event, Object payload) {
    emitToRoom(RoomKey.of(RoomScope.COMPANY, companyId), event, payload);
  }

  public void emitToTracking(String trackingId, String event, Object payload) {
    emitToRoom(RoomKey.of(RoomScope.TRACKING, trackingId), event, payload);
  }

  public void emitToVehicle(UUID vehicleId, String event, Object payload) {
    emitToRoom(RoomKey.of(RoomScope.VEHICLE, vehicleId), event, payload);
  }

  public void emitToRoom(RoomKey room, String event, Object payload) {
    final String text = envelope(event, room.value(), payload);
    submit(() -> deliver(registry.members(room), text));
  }

  /** Sends to every room of the scope, e.g. all alert rooms. */
  public void emitToScope(RoomScope scope, String event, Object payload) {
    submit(
        () -> {
          for (RoomKey room : registry.rooms(scope)) {
            deliver(registry.members(room), envelope(event, room.value(), payload));
          }
        });
  }

  public void broadcast(String event, Object payload) {
    final String text = envelope(event, null, payload);
    submit(() -> deliver(registry.connections(), text));
  }

  /** Rooms held by a connection, as seen after every earlier command has run. */
  @VisibleForTesting
  Set<RoomKey> roomsOf(String connectionId) {
    return registry.roomsOf(connectionId);
  }

  @VisibleForTesting
  int memberCount(RoomKey room) {
    return registry.members(room).size();
  }

  public void shutdown() {
    dispatcher.shutdown();
  }

  private void deliver(List<RealtimeConnection> targets, String text) {
    for (RealtimeConnection connection : targets) {
      if (!connection.isOpen()) {
        registry.remove(connection.id());
        continue;
      }
      try {
        connection.send(text);
      } catch (IOException | IllegalStateException ex) {
        logger.debug("realtime send dropped connectionId={}", connection.id(), ex);
      }
    }
  }

  private void submit(Runnable command) {
    try {
      dispatcher.execute(
          () -> {
            try {
              command.run();
            } catch (RuntimeException ex) {
              logger.warn("realtime command failed", ex);
            }
          });
    } catch (RejectedExecutionException ex) {
      logger.debug("realtime bus stopped, command dropped", ex);
    }
  }

  private String envelope(String event, String room, Object payload) {
    final Map<String, Object> message = new LinkedHashMap<>();
    message.put("event", event);
    if (room != null) {
      message.put("room", room);
    }
    message.put("data", payload);
    message.put("timestamp", Instant.now(clock).toString());
    try {
      return objectMapper.writeValueAsString(message);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("realtime payload is not serializable event=" + event, ex);
    }
  }
}
