/*
 * どこで: app/profile/src/main/java/com/nomen/profile/model/MergeRequestRecord.java
 * 何を: merge_requests テーブル相当のドメインレコード
 * なぜ: 短命な統合トークンの有効期限判定を一か所にまとめるため
 */
package com.nomen.profile.model;

import java.time.Instant;

public record MergeRequestRecord(
        String mergeRequestId,
        String requesterAccountId,
        String token,
        Instant createdAt,
        Instant expiresAt) {

    // expires_at ちょうどは期限切れとして扱う。
    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
