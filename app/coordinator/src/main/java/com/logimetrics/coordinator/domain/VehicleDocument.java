package com.logimetrics.coordinator.domain;

import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

public record VehicleDocument(
    UUID id,
    UUID companyId,
    UUID vehicleId,
    String registrationNumber,
    String documentType,
    boolean mandatory,
    LocalDate expiryDate) {

  /** Vehicle papers whose expiry is tracked. */
  public static final Set<String> TRACKED_TYPES =
      Set.of("insurance", "fitness", "permit", "puc", "registration");
}
