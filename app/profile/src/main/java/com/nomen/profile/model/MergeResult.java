package com.nomen.profile.model;

public record MergeResult(
        String targetAccountId,
        String sourceAccountId,
        String targetProfileId,
        String sourceProfileId,
        int attributesMerged,
        int identitiesMoved) {
}
