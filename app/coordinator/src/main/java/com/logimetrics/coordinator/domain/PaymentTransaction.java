package com.logimetrics.coordinator.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record PaymentTransaction(
    UUID id,
    UUID companyId,
    UUID invoiceId,
    String gatewayReference,
    BigDecimal amount,
    String status,
    Instant createdAt) {

  public static final String PENDING = "pending";
  public static final String PROCESSING = "processing";
  public static final String COMPLETED = "completed";
  public static final String FAILED = "failed";
}
