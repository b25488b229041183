/*
 * どこで: Profile API
 * 何を: API エラー応答の共通 DTO
 * なぜ: エラー形式を統一し、ゲートウェイ側で機械的に処理できるようにするため
 */
package com.nomen.profile.api;

public record ApiErrorResponse(
        ApiErrorCode code,
        String message) {
}
