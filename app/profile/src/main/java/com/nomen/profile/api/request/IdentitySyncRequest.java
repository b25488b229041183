/*
 * どこで: app/profile/src/main/java/com/nomen/profile/api/request/IdentitySyncRequest.java
 * 何を: POST /internal/identities:sync の入力 DTO
 * なぜ: 外部認証基盤から届く identity 作成/更新イベントを API 境界で明示するため
 */
package com.nomen.profile.api.request;

import java.util.Map;

public record IdentitySyncRequest(
        String identityId,
        String accountId,
        String provider,
        String providerUserId,
        Map<String, String> claims) {
}
