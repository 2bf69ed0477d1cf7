package com.logimetrics.coordinator.notification;

import java.util.UUID;

/** Contact details of a user. email and phone are null when not on file. */
public record Recipient(
    UUID id, UUID companyId, String name, String email, String phone, String role) {

  public boolean hasEmail() {
    return email != null && !email.isBlank();
  }

  public boolean hasPhone() {
    return phone != null && !phone.isBlank();
  }
}
