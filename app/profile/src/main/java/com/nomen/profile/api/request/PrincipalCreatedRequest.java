package com.nomen.profile.api.request;

public record PrincipalCreatedRequest(String principalId) {
}
