/*
 * どこで: app/profile/src/main/java/com/nomen/profile/api/response/MergeExecutionResponse.java
 * 何を: POST /merge-requests:execute の出力 DTO
 * なぜ: 統合の完了と、呼び出し元セッションの再認証が必要なことを曖昧さなく伝えるため
 */
package com.nomen.profile.api.response;

public record MergeExecutionResponse(
        boolean success,
        String targetProfileId,
        String sourceProfileId,
        int attributesMerged,
        int identitiesMoved,
        boolean sourceAccountDeleted,
        String sourceAccountId,
        boolean reauthenticationRequired) {
}
