package com.logimetrics.coordinator.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;

public record PushSubscriptionRequest(
    @NotBlank @Size(max = 2048) String endpoint, Map<String, String> keys) {}
