package com.logimetrics.coordinator.realtime;

import java.util.Set;
import java.util.UUID;

/** Identity attached to a realtime connection. userId is null for anonymous connections. */
public record RealtimePrincipal(UUID userId, UUID companyId, UUID driverId, Set<String> roles) {

  public static final String ROLE_DRIVER = "driver";

  private static final RealtimePrincipal ANONYMOUS =
      new RealtimePrincipal(null, null, null, Set.of());

  public RealtimePrincipal {
    roles = roles == null ? Set.of() : Set.copyOf(roles);
  }

  public static RealtimePrincipal anonymous() {
    return ANONYMOUS;
  }

  public boolean isAuthenticated() {
    return userId != null;
  }

  public boolean hasRole(String role) {
    return roles.contains(role);
  }
}
