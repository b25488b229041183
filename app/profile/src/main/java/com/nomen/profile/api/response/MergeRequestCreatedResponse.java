package com.nomen.profile.api.response;

import java.time.Instant;

public record MergeRequestCreatedResponse(String token, Instant expiresAt) {
}
