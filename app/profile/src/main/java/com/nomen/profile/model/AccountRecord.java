/*
 * どこで: app/profile/src/main/java/com/nomen/profile/model/AccountRecord.java
 * 何を: accounts テーブル相当のドメインレコード
 * なぜ: 外部認証基盤の principal と profile の対応を明確にするため
 */
package com.nomen.profile.model;

import java.time.Instant;

public record AccountRecord(
        String accountId,
        String profileId,
        Instant createdAt,
        Instant updatedAt) {

    public boolean hasProfile() {
        return profileId != null;
    }
}
