/*
 * Where: Realtime bus
 * What: Decides whether a principal may join a room
 * Why: Anonymous clients only follow public tracking rooms; everything else is scoped to the caller's user or company
 */
package com.logimetrics.coordinator.realtime;

import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RoomAccessPolicy {

  private final RoomOwnershipResolver ownershipResolver;

  public void check(RealtimePrincipal principal, RoomKey room) {
    if (room.scope() == RoomScope.TRACKING) {
      return;
    }
    if (!principal.isAuthenticated()) {
      throw new RealtimeAccessDeniedException(room, "authentication required");
    }
    final boolean allowed =
        switch (room.scope()) {
          case TRACKING -> true;
          case USER, NOTIFICATIONS -> matches(principal.userId(), room);
          case COMPANY, DASHBOARD, ALERTS, SHIPMENTS_COMPANY ->
              matches(principal.companyId(), room);
          case SHIPMENTS_DRIVER -> matches(principal.driverId(), room)
              || sameCompany(principal, parseId(room).flatMap(ownershipResolver::companyOfDriver));
          case VEHICLE -> sameCompany(
              principal, parseId(room).flatMap(ownershipResolver::companyOfVehicle));
          case SHIPMENT -> sameCompany(
              principal, parseId(room).flatMap(ownershipResolver::companyOfShipment));
        };
    if (!allowed) {
      throw new RealtimeAccessDeniedException(room, "room not permitted");
    }
  }

  private static boolean matches(UUID expected, RoomKey room) {
    return expected != null && expected.toString().equalsIgnoreCase(room.id());
  }

  private static boolean sameCompany(RealtimePrincipal principal, Optional<UUID> owner) {
    return principal.companyId() != null && owner.map(principal.companyId()::equals).orElse(false);
  }

  private static Optional<UUID> parseId(RoomKey room) {
    try {
      return Optional.of(UUID.fromString(room.id()));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }
}
