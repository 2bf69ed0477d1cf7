package com.logimetrics.coordinator.domain;

import java.time.LocalDate;
import java.util.Locale;

public enum RecurringFrequency {
  WEEKLY,
  BIWEEKLY,
  MONTHLY,
  QUARTERLY,
  YEARLY;

  public LocalDate advance(LocalDate from) {
    return switch (this) {
      case WEEKLY -> from.plusDays(7);
      case BIWEEKLY -> from.plusDays(14);
      case MONTHLY -> from.plusMonths(1);
      case QUARTERLY -> from.plusMonths(3);
      case YEARLY -> from.plusYears(1);
    };
  }

  /** Unknown or missing frequencies recur monthly. */
  public static RecurringFrequency fromValue(String value) {
    if (value == null || value.isBlank()) {
      return MONTHLY;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return MONTHLY;
    }
  }
}
