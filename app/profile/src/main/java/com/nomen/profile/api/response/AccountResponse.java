package com.nomen.profile.api.response;

public record AccountResponse(String accountId, String profileId) {
}
