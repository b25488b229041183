/*
 * どこで: app/profile/src/main/java/com/nomen/profile/model/ProfileRecord.java
 * 何を: profiles テーブル相当のドメインレコード
 * なぜ: preferred 属性から導出した表示用の集約値を高速に参照するため
 */
package com.nomen.profile.model;

import java.time.Instant;
import java.util.List;

public record ProfileRecord(
        String profileId,
        String displayName,
        String primaryEmail,
        List<String> mergedAccountIds,
        Instant createdAt,
        Instant updatedAt) {

    public ProfileRecord {
        mergedAccountIds = mergedAccountIds == null ? List.of() : List.copyOf(mergedAccountIds);
    }
}
