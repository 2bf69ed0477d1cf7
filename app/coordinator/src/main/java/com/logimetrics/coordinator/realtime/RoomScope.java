package com.logimetrics.coordinator.realtime;

/** Room namespaces. The prefix is the wire form before the ":{id}" suffix. */
public enum RoomScope {
  USER("user"),
  COMPANY("company"),
  TRACKING("tracking"),
  VEHICLE("vehicle"),
  DASHBOARD("dashboard"),
  ALERTS("alerts"),
  NOTIFICATIONS("notifications"),
  SHIPMENT("shipment"),
  SHIPMENTS_COMPANY("shipments:company"),
  SHIPMENTS_DRIVER("shipments:driver");

  private final String prefix;

  RoomScope(String prefix) {
    this.prefix = prefix;
  }

  public String prefix() {
    return prefix;
  }
}
