package com.nomen.profile.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "profile.internal-api")
public record ProfileInternalApiProperties(String headerName, String token) {

  public static final String ACCOUNT_ID_HEADER = "X-Account-Id";

  public ProfileInternalApiProperties {
    headerName = headerName == null || headerName.isBlank() ? "X-Internal-Token" : headerName;
    token = token == null ? "" : token;
  }
}
