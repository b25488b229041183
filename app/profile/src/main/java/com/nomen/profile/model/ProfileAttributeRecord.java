/*
 * どこで: app/profile/src/main/java/com/nomen/profile/model/ProfileAttributeRecord.java
 * 何を: profile_attributes テーブル相当のドメインレコード
 * なぜ: 1 つの候補値がどの identity / provider 由来かを保持したまま扱うため
 */
package com.nomen.profile.model;

import java.time.Instant;

public record ProfileAttributeRecord(
        String attributeId,
        String profileId,
        String identityId,
        AttributeKey attributeKey,
        String attributeValue,
        String sourceProvider,
        boolean preferred,
        Instant createdAt,
        Instant updatedAt) {
}
