package com.nomen.profile.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "profile.auth-directory")
public record AuthDirectoryClientProperties(
    String baseUrl,
    String deletePrincipalPath,
    String internalApiHeaderName,
    String internalApiToken) {

  public AuthDirectoryClientProperties {
    baseUrl = baseUrl == null ? "http://auth-directory:80" : baseUrl;
    deletePrincipalPath =
        deletePrincipalPath == null || deletePrincipalPath.isBlank()
            ? "/principals/{principalId}"
            : deletePrincipalPath;
    internalApiHeaderName =
        internalApiHeaderName == null || internalApiHeaderName.isBlank()
            ? "X-Internal-Token"
            : internalApiHeaderName;
    internalApiToken = internalApiToken == null ? "" : internalApiToken;
  }
}
