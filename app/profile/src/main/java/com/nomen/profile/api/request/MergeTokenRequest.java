/*
 * どこで: app/profile/src/main/java/com/nomen/profile/api/request/MergeTokenRequest.java
 * 何を: merge-requests の lookup/cancel/execute で共通の入力 DTO
 * なぜ: トークンを URL ではなく body で受け取り、アクセスログに残さないため
 */
package com.nomen.profile.api.request;

import jakarta.validation.constraints.NotBlank;

public record MergeTokenRequest(@NotBlank(message = "token is required") String token) {
}
