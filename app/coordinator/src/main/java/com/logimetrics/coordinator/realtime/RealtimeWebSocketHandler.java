/*
 * Where: Realtime bus
 * What: WebSocket endpoint for room joins, leaves and driver location pings
 * Why: Clients subscribe to rooms over one connection while all fan-out stays on the server side
 */
package com.logimetrics.coordinator.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logimetrics.coordinator.config.RealtimeProperties;
import com.logimetrics.coordinator.dashboard.DashboardProjection;
import com.logimetrics.coordinator.dashboard.DashboardSnapshot;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Bus, policy and ObjectMapper are shared Spring-managed components")
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

  static final String TYPE_JOIN = "join";
  static final String TYPE_LEAVE = "leave";
  static final String TYPE_DRIVER_LOCATION = "driver:location";

  static final String MDC_CONNECTION_ID = "connection_id";
  static final String MDC_USER_ID = "user_id";
  static final String MDC_COMPANY_ID = "company_id";

  private static final Logger logger = LoggerFactory.getLogger(RealtimeWebSocketHandler.class);

  private final RealtimeBus realtimeBus;
  private final RoomAccessPolicy accessPolicy;
  private final LiveLocationPublisher locationPublisher;
  private final DashboardProjection dashboardProjection;
  private final ObjectMapper objectMapper;
  private final RealtimeProperties properties;
  private final ConcurrentMap<String, RealtimeConnection> connections = new ConcurrentHashMap<>();

  public RealtimeWebSocketHandler(
      RealtimeBus realtimeBus,
      RoomAccessPolicy accessPolicy,
      LiveLocationPublisher locationPublisher,
      DashboardProjection dashboardProjection,
      ObjectMapper objectMapper,
      RealtimeProperties properties) {
    this.realtimeBus = realtimeBus;
    this.accessPolicy = accessPolicy;
    this.locationPublisher = locationPublisher;
    this.dashboardProjection = dashboardProjection;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    final RealtimePrincipal principal = principalOf(session);
    putSessionContext(session.getId(), principal);
    try {
      final RealtimeConnection connection =
          new WebSocketRealtimeConnection(
              session,
              principal,
              (int) properties.sendTimeLimit().toMillis(),
              properties.sendBufferSizeLimit());
      connections.put(session.getId(), connection);
      realtimeBus.connect(connection);
      if (principal.isAuthenticated()) {
        realtimeBus.join(session.getId(), RoomKey.of(RoomScope.USER, principal.userId()));
        if (principal.companyId() != null) {
          realtimeBus.join(session.getId(), RoomKey.of(RoomScope.COMPANY, principal.companyId()));
        }
      }
      logger.debug("realtime connected authenticated={}", principal.isAuthenticated());
    } finally {
      clearSessionContext();
    }
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message)
      throws IOException {
    final RealtimeConnection connection = connections.get(session.getId());
    if (connection == null) {
      return;
    }
    putSessionContext(connection.id(), connection.principal());
    try {
      handleRequest(connection, message);
    } finally {
      clearSessionContext();
    }
  }

  private void handleRequest(RealtimeConnection connection, TextMessage message)
      throws IOException {
    final JsonNode request;
    try {
      request = objectMapper.readTree(message.getPayload());
    } catch (IOException ex) {
      reply(connection, "error", Map.of("message", "malformed message"));
      return;
    }
    final String type = request.path("type").asText("");
    try {
      switch (type) {
        case TYPE_JOIN -> {
          final RoomKey room = RoomKey.parse(request.path("room").asText(null));
          accessPolicy.check(connection.principal(), room);
          realtimeBus.join(connection.id(), room);
          reply(connection, "room:joined", Map.of("room", room.value()));
          if (room.scope() == RoomScope.DASHBOARD) {
            sendDashboardSnapshot(connection, room);
          }
        }
        case TYPE_LEAVE -> {
          final RoomKey room = RoomKey.parse(request.path("room").asText(null));
          realtimeBus.leave(connection.id(), room);
          reply(connection, "room:left", Map.of("room", room.value()));
        }
        case TYPE_DRIVER_LOCATION -> locationPublisher.publish(
            connection.principal(),
            objectMapper.treeToValue(request.path("data"), DriverLocation.class));
        default -> reply(connection, "error", Map.of("message", "unsupported type: " + type));
      }
    } catch (RealtimeAccessDeniedException ex) {
      logger.info("realtime request denied type={} reason={}", type, ex.getMessage());
      reply(connection, "error", Map.of("message", "forbidden", "room", ex.room().value()));
    } catch (IllegalArgumentException | IOException ex) {
      reply(connection, "error", Map.of("message", String.valueOf(ex.getMessage())));
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    logger.debug("realtime transport error id={}", session.getId(), exception);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    connections.remove(session.getId());
    realtimeBus.disconnect(session.getId());
  }

  private void sendDashboardSnapshot(RealtimeConnection connection, RoomKey room)
      throws IOException {
    final DashboardSnapshot snapshot;
    try {
      snapshot = dashboardProjection.snapshot(UUID.fromString(room.id()));
    } catch (DataAccessException ex) {
      logger.warn("dashboard snapshot unavailable room={}", room.value(), ex);
      return;
    }
    final Map<String, Object> message = new LinkedHashMap<>();
    message.put("event", "dashboard:snapshot");
    message.put("room", room.value());
    message.put("data", snapshot);
    connection.send(objectMapper.writeValueAsString(message));
  }

  private static void putSessionContext(String connectionId, RealtimePrincipal principal) {
    MDC.put(MDC_CONNECTION_ID, connectionId);
    if (principal.userId() != null) {
      MDC.put(MDC_USER_ID, principal.userId().toString());
    }
    if (principal.companyId() != null) {
      MDC.put(MDC_COMPANY_ID, principal.companyId().toString());
    }
  }

  private static void clearSessionContext() {
    MDC.remove(MDC_CONNECTION_ID);
    MDC.remove(MDC_USER_ID);
    MDC.remove(MDC_COMPANY_ID);
  }

  private RealtimePrincipal principalOf(WebSocketSession session) {
    final Object principal =
        session.getAttributes().get(RealtimeHandshakeInterceptor.PRINCIPAL_ATTRIBUTE);
    return principal instanceof RealtimePrincipal realtimePrincipal
        ? realtimePrincipal
        : RealtimePrincipal.anonymous();
  }

  private void reply(RealtimeConnection connection, String event, Map<String, Object> data)
      throws IOException {
    final Map<String, Object> message = new LinkedHashMap<>();
    message.put("event", event);
    message.put("data", data);
    connection.send(objectMapper.writeValueAsString(message));
  }
}
