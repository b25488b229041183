/*
 * どこで: Profile データアクセス
 * 何を: merge_requests の登録/参照/消費/削除を担う
 * なぜ: 統合トークンを単回利用に限定し、期限切れを遅延評価で扱うため
 */
package com.nomen.profile.repository;

import static com.nomen.common.JdbcTimestampUtils.toInstant;
import static com.nomen.common.JdbcTimestampUtils.toTimestamp;

import com.nomen.profile.model.MergeRequestRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class MergeRequestRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public MergeRequestRecord insert(MergeRequestRecord request) {
    final String sql =
        """
        INSERT INTO merge_requests (
          merge_request_id, requester_account_id, token, created_at, expires_at
        ) VALUES (
          :mergeRequestId, :requesterAccountId, :token, :createdAt, :expiresAt
        )
        RETURNING merge_request_id, requester_account_id, token, created_at, expires_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("mergeRequestId", request.mergeRequestId())
            .addValue("requesterAccountId", request.requesterAccountId())
            .addValue("token", request.token())
            .addValue("createdAt", toTimestamp(request.createdAt()))
            .addValue("expiresAt", toTimestamp(request.expiresAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  /** 期限切れも含めて返す。期限判定は呼び出し側で行う。 */
  public Optional<MergeRequestRecord> findByToken(String token) {
    final String sql =
        """
        SELECT merge_request_id, requester_account_id, token, created_at, expires_at
        FROM merge_requests
        WHERE token = :token
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("token", token);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * token の行を削除し、削除できた行を返す。
   *
   * <p>同一 token の同時消費では片方だけが行を受け取る。後続の統合が失敗しても消費は取り消されない
   * よう、独立したトランザクションでコミットする。
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Optional<MergeRequestRecord> consumeByToken(String token) {
    final String sql =
        """
        DELETE FROM merge_requests
        WHERE token = :token
        RETURNING merge_request_id, requester_account_id, token, created_at, expires_at
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("token", token);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int deleteByToken(String token) {
    final String sql = "DELETE FROM merge_requests WHERE token = :token";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("token", token));
  }

  public int deleteByRequester(String requesterAccountId) {
    final String sql =
        "DELETE FROM merge_requests WHERE requester_account_id = :requesterAccountId";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("requesterAccountId", requesterAccountId));
  }

  public int deleteExpired(Instant now) {
    final String sql =
        """
        DELETE FROM merge_requests
        WHERE expires_at <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private MergeRequestRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MergeRequestRecord(
        rs.getString("merge_request_id"),
        rs.getString("requester_account_id"),
        rs.getString("token"),
        toInstant(rs, "created_at"),
        toInstant(rs, "expires_at"));
  }
}
