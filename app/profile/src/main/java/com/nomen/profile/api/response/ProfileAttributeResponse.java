package com.nomen.profile.api.response;

import java.time.Instant;

public record ProfileAttributeResponse(
    String attributeId,
    String attributeKey,
    String attributeValue,
    String sourceProvider,
    String identityId,
    boolean preferred,
    Instant createdAt) {}
