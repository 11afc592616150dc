package com.flock.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "flock.admin-api")
public record FlockAdminApiProperties(String headerName, String token) {

  public FlockAdminApiProperties {
    headerName = headerName == null || headerName.isBlank() ? "X-Admin-Token" : headerName;
    token = token == null ? "" : token;
  }
}
