package com.logimetrics.coordinator.realtime;

import java.util.UUID;

public record DriverLocation(
    UUID vehicleId,
    UUID shipmentId,
    double latitude,
    double longitude,
    Double speed,
    Double heading) {

  public boolean hasValidCoordinates() {
    return latitude >= -90 && latitude <= 90 && longitude >= -180 && longitude <= 180;
  }
}
