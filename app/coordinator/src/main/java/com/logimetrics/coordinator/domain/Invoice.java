package com.logimetrics.coordinator.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record Invoice(
    UUID id,
    UUID companyId,
    UUID customerId,
    String invoiceNumber,
    String status,
    BigDecimal totalAmount,
    String currency,
    LocalDate issueDate,
    LocalDate dueDate,
    String recurringFrequency,
    LocalDate nextRecurringDate,
    Instant lastReminderSentAt) {}
