/*
 * どこで: Profile API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因 (期限切れ/同一アカウント/統合不可) を区別できるようにするため
 */
package com.nomen.profile.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    NOT_AUTHENTICATED,
    UNAUTHORIZED,
    NOT_FOUND,
    EXPIRED,
    SAME_ACCOUNT,
    ALREADY_OWNED,
    INVALID_MERGE,
    NO_PROFILE,
    ALREADY_MERGED,
    CONFLICT,
    BAD_GATEWAY,
    TIMEOUT,
    INTERNAL_ERROR
}
