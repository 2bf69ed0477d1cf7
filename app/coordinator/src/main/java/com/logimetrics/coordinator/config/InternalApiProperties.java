package com.logimetrics.coordinator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Identity headers forwarded by the API gateway and the shared token that vouches for them. */
@ConfigurationProperties(prefix = "coordinator.internal-api")
public record InternalApiProperties(
    String headerName,
    String token,
    String userIdHeaderName,
    String userRolesHeaderName,
    String companyIdHeaderName,
    String driverIdHeaderName) {

  public InternalApiProperties {
    headerName = headerName == null || headerName.isBlank() ? "X-Internal-Token" : headerName;
    token = token == null ? "" : token;
    userIdHeaderName =
        userIdHeaderName == null || userIdHeaderName.isBlank() ? "X-User-Id" : userIdHeaderName;
    userRolesHeaderName =
        userRolesHeaderName == null || userRolesHeaderName.isBlank()
            ? "X-User-Roles"
            : userRolesHeaderName;
    companyIdHeaderName =
        companyIdHeaderName == null || companyIdHeaderName.isBlank()
            ? "X-Company-Id"
            : companyIdHeaderName;
    driverIdHeaderName =
        driverIdHeaderName == null || driverIdHeaderName.isBlank()
            ? "X-Driver-Id"
            : driverIdHeaderName;
  }

  public boolean isValidToken(String actualToken) {
    return actualToken != null && !token.isBlank() && actualToken.equals(token);
  }
}
