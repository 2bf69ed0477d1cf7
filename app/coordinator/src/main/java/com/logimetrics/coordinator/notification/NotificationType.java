/*
 * Where: Notification model
 * What: Closed set of notification types produced by the platform
 * Why: Templates and routing match exhaustively on the type instead of on free-form strings
 */
package com.logimetrics.coordinator.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
  SHIPMENT_CREATED("shipment_created"),
  SHIPMENT_PICKED_UP("shipment_picked_up"),
  SHIPMENT_IN_TRANSIT("shipment_in_transit"),
  SHIPMENT_OUT_FOR_DELIVERY("shipment_out_for_delivery"),
  SHIPMENT_DELIVERED("shipment_delivered"),
  SHIPMENT_DELAYED("shipment_delayed"),
  PAYMENT_RECEIVED("payment_received"),
  PAYMENT_FAILED("payment_failed"),
  PAYMENT_REMINDER("payment_reminder"),
  INVOICE_GENERATED("invoice_generated"),
  INVOICE_OVERDUE("invoice_overdue"),
  DRIVER_ASSIGNED("driver_assigned"),
  VEHICLE_MAINTENANCE("vehicle_maintenance"),
  LICENSE_EXPIRY("license_expiry"),
  DOCUMENT_EXPIRY("document_expiry"),
  ALERT("alert"),
  SYSTEM("system"),
  DIGEST("digest");

  private final String value;

  NotificationType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static NotificationType fromValue(String type) {
    for (NotificationType candidate : values()) {
      if (candidate.value.equalsIgnoreCase(type)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("unsupported notification type: " + type);
  }
}
