package com.nomen.profile.repository;

import static com.nomen.common.JdbcTimestampUtils.toInstant;
import static com.nomen.common.JdbcTimestampUtils.toTimestamp;

import com.nomen.profile.model.AuditLogRecord;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class AuditLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(AuditLogRecord auditLogRecord) {
    final String sql =
        """
        INSERT INTO audit_logs (
          id, actor_account_id, action, target_account_id, metadata_json, created_at
        ) VALUES (
          :id, :actorAccountId, :action, :targetAccountId, CAST(:metadataJson AS jsonb), :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", auditLogRecord.id())
            .addValue("actorAccountId", auditLogRecord.actorAccountId())
            .addValue("action", auditLogRecord.action())
            .addValue("targetAccountId", auditLogRecord.targetAccountId())
            .addValue("metadataJson", auditLogRecord.metadataJson())
            .addValue("createdAt", toTimestamp(auditLogRecord.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<AuditLogRecord> findByTargetAccountId(String targetAccountId) {
    final String sql =
        """
        SELECT id, actor_account_id, action, target_account_id, metadata_json::text AS metadata_text,
               created_at
        FROM audit_logs
        WHERE target_account_id = :targetAccountId
        ORDER BY created_at ASC, id ASC
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("targetAccountId", targetAccountId),
        (rs, rowNum) ->
            new AuditLogRecord(
                rs.getString("id"),
                rs.getString("actor_account_id"),
                rs.getString("action"),
                rs.getString("target_account_id"),
                rs.getString("metadata_text"),
                toInstant(rs, "created_at")));
  }
}
