package com.nomen.profile.api.response;

public record IdentitySyncResponse(String accountId, String profileId, String identityId) {
}
