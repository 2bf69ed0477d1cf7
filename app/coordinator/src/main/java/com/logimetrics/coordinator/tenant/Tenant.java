package com.logimetrics.coordinator.tenant;

import java.util.UUID;

/** A company that partitions platform data. */
public record Tenant(UUID id, String name, String status) {}
