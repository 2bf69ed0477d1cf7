package com.logimetrics.coordinator.domain;

import java.time.LocalDate;
import java.util.UUID;

public record Vehicle(
    UUID id,
    UUID companyId,
    String registrationNumber,
    String make,
    String model,
    String status,
    LocalDate nextServiceDate) {

  public String label() {
    return registrationNumber + " (" + make + " " + model + ")";
  }
}
