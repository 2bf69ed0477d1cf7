package com.logimetrics.coordinator.dashboard;

import java.util.UUID;

public record VehicleStatusChanged(
    UUID companyId, UUID vehicleId, String previousStatus, String newStatus, String reason) {}
