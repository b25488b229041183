package com.nomen.profile.api.response;

public record MergeCandidateResponse(
    boolean canMerge,
    String otherAccountId,
    String otherProfileId,
    String otherDisplayName,
    String otherEmail) {}
