package com.logimetrics.coordinator.api;

public record ApiErrorResponse(String code, String message) {}
