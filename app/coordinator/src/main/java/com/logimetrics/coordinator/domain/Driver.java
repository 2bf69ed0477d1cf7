package com.logimetrics.coordinator.domain;

import java.time.LocalDate;
import java.util.UUID;

public record Driver(
    UUID id,
    UUID companyId,
    UUID userId,
    String name,
    String licenseNumber,
    LocalDate licenseExpiry,
    String status) {

  public String displayName() {
    return name == null || name.isBlank() ? "Driver " + licenseNumber : name;
  }
}
