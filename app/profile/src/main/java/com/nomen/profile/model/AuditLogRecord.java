/*
 * どこで: app/profile/src/main/java/com/nomen/profile/model/AuditLogRecord.java
 * 何を: audit_logs テーブル相当のドメインレコード
 * なぜ: アカウント統合のような破壊的操作を後から追跡できるようにするため
 */
package com.nomen.profile.model;

import java.time.Instant;

public record AuditLogRecord(
        String id,
        String actorAccountId,
        String action,
        String targetAccountId,
        String metadataJson,
        Instant createdAt) {
}
