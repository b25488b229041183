/*
 * どこで: app/profile/src/main/java/com/nomen/profile/model/ExternalIdentityRecord.java
 * 何を: external_identities テーブル相当のドメインレコード
 * なぜ: provider + provider_user_id による同定情報と claims を正規化して扱うため
 */
package com.nomen.profile.model;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

public record ExternalIdentityRecord(
        String identityId,
        String accountId,
        String provider,
        String providerUserId,
        Map<String, String> claims,
        Instant createdAt,
        Instant updatedAt) {

    public ExternalIdentityRecord {
        // provider が null 値の claim を返すことがあるため、値のあるものだけ保持する。
        claims = claims == null
                ? Map.of()
                : claims.entrySet().stream()
                        .filter(entry -> entry.getKey() != null && entry.getValue() != null)
                        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }
}
