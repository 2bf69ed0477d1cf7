package com.logimetrics.coordinator.dashboard;

import java.util.UUID;

public record ShipmentStatusChanged(
    UUID companyId, UUID shipmentId, String previousStatus, String newStatus) {}
