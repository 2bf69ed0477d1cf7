/*
 * Where: Realtime bus
 * What: Resolves the connection principal from identity headers forwarded by the API gateway
 * Why: Only the gateway may vouch for a user; without its token the connection stays anonymous
 */
package com.logimetrics.coordinator.realtime;

import com.logimetrics.coordinator.config.InternalApiProperties;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

@Component
@RequiredArgsConstructor
public class RealtimeHandshakeInterceptor implements HandshakeInterceptor {

  public static final String PRINCIPAL_ATTRIBUTE = "realtimePrincipal";

  private static final Logger logger = LoggerFactory.getLogger(RealtimeHandshakeInterceptor.class);

  private final InternalApiProperties properties;

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    final HttpHeaders headers = request.getHeaders();
    final String token = headers.getFirst(properties.headerName());
    if (token == null || token.isBlank()) {
      attributes.put(PRINCIPAL_ATTRIBUTE, RealtimePrincipal.anonymous());
      return true;
    }
    if (!properties.isValidToken(token)) {
      logger.warn("realtime handshake rejected: invalid internal token");
      response.setStatusCode(HttpStatus.UNAUTHORIZED);
      return false;
    }
    final UUID userId = parseUuid(headers.getFirst(properties.userIdHeaderName()));
    if (userId == null) {
      response.setStatusCode(HttpStatus.UNAUTHORIZED);
      return false;
    }
    final RealtimePrincipal principal =
        new RealtimePrincipal(
            userId,
            parseUuid(headers.getFirst(properties.companyIdHeaderName())),
            parseUuid(headers.getFirst(properties.driverIdHeaderName())),
            parseRoles(headers.getFirst(properties.userRolesHeaderName())));
    attributes.put(PRINCIPAL_ATTRIBUTE, principal);
    return true;
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Exception exception) {
    // no-op
  }

  static Set<String> parseRoles(String raw) {
    if (raw == null || raw.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(raw.split(","))
        .map(String::trim)
        .filter(role -> !role.isEmpty())
        .map(role -> role.toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
  }

  private static UUID parseUuid(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return UUID.fromString(raw.trim());
    } catch (IllegalArgumentException ex) {
      logger.debug("ignoring malformed identity header value", ex);
      return null;
    }
  }
}
