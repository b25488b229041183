/*
 * どこで: app/profile/src/main/java/com/nomen/profile/api/response/ProfileResponse.java
 * 何を: GET /me/profile の出力 DTO
 * なぜ: 表示用の集約値と統合済みアカウントの履歴を安定した契約として返すため
 */
package com.nomen.profile.api.response;

import java.util.List;

public record ProfileResponse(
        String profileId,
        String displayName,
        String primaryEmail,
        List<String> mergedAccountIds) {

    public ProfileResponse {
        mergedAccountIds = mergedAccountIds == null ? List.of() : List.copyOf(mergedAccountIds);
    }
}
