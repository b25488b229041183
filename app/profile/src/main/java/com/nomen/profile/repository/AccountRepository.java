package com.nomen.profile.repository;

import static com.nomen.common.JdbcTimestampUtils.toInstant;
import static com.nomen.common.JdbcTimestampUtils.toTimestamp;

import com.nomen.profile.model.AccountRecord;
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
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class AccountRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<AccountRecord> findByAccountId(String accountId) {
    final String sql =
        """
        SELECT account_id, profile_id, created_at, updated_at
        FROM accounts
        WHERE account_id = :accountId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("accountId", accountId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<AccountRecord> findByAccountIdForUpdate(String accountId) {
    // 同一アカウントに対する consolidation / merge をトランザクション内で直列化する。
    final String sql =
        """
        SELECT account_id, profile_id, created_at, updated_at
        FROM accounts
        WHERE account_id = :accountId
        FOR UPDATE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("accountId", accountId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int insertIfAbsent(String accountId, Instant now) {
    final String sql =
        """
        INSERT INTO accounts (account_id, profile_id, created_at, updated_at)
        VALUES (:accountId, NULL, :now, :now)
        ON CONFLICT (account_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("accountId", accountId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int updateProfileId(String accountId, String profileId, Instant now) {
    final String sql =
        """
        UPDATE accounts
        SET profile_id = :profileId,
            updated_at = :now
        WHERE account_id = :accountId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("accountId", accountId)
            .addValue("profileId", profileId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int delete(String accountId) {
    final String sql = "DELETE FROM accounts WHERE account_id = :accountId";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("accountId", accountId));
  }

  private AccountRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AccountRecord(
        rs.getString("account_id"),
        rs.getString("profile_id"),
        toInstant(rs, "created_at"),
        toInstant(rs, "updated_at"));
  }
}
