package com.nomen.profile.repository;

import static com.nomen.common.JdbcTimestampUtils.toInstant;
import static com.nomen.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nomen.profile.model.ExternalIdentityRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class ExternalIdentityRepository {

  private static final TypeReference<Map<String, String>> CLAIMS_TYPE = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public Optional<ExternalIdentityRecord> findByProviderAndProviderUserId(
      String provider, String providerUserId) {
    final String sql =
        """
        SELECT identity_id, account_id, provider, provider_user_id, claims::text AS claims_text,
               created_at, updated_at
        FROM external_identities
        WHERE provider = :provider AND provider_user_id = :providerUserId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("provider", provider)
            .addValue("providerUserId", providerUserId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * provider + provider_user_id をキーに identity を登録/更新する。
   *
   * <p>既存行では claims と updated_at のみ更新し、identity_id と account_id は維持する。 戻り値は DB
   * に保存されている最新の行。
   */
  public ExternalIdentityRecord upsert(ExternalIdentityRecord identity) {
    final String sql =
        """
        INSERT INTO external_identities (
          identity_id, account_id, provider, provider_user_id, claims, created_at, updated_at
        ) VALUES (
          :identityId, :accountId, :provider, :providerUserId, CAST(:claims AS jsonb),
          :createdAt, :updatedAt
        )
        ON CONFLICT (provider, provider_user_id) DO UPDATE
          SET claims = EXCLUDED.claims,
              updated_at = EXCLUDED.updated_at
        RETURNING identity_id, account_id, provider, provider_user_id, claims::text AS claims_text,
                  created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("identityId", identity.identityId())
            .addValue("accountId", identity.accountId())
            .addValue("provider", identity.provider())
            .addValue("providerUserId", identity.providerUserId())
            .addValue("claims", writeClaims(identity.claims()))
            .addValue("createdAt", toTimestamp(identity.createdAt()))
            .addValue("updatedAt", toTimestamp(identity.updatedAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public int reassignAccount(String sourceAccountId, String targetAccountId, Instant now) {
    final String sql =
        """
        UPDATE external_identities
        SET account_id = :targetAccountId,
            updated_at = :now
        WHERE account_id = :sourceAccountId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sourceAccountId", sourceAccountId)
            .addValue("targetAccountId", targetAccountId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /** provider 名 -> 紐付いている identity 数。provider 名の昇順。 */
  public Map<String, Long> countByProvider(String accountId) {
    final String sql =
        """
        SELECT provider, COUNT(*) AS linked
        FROM external_identities
        WHERE account_id = :accountId
        GROUP BY provider
        ORDER BY provider ASC
        """;
    final Map<String, Long> counts = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("accountId", accountId),
        (RowCallbackHandler) rs -> counts.put(rs.getString("provider"), rs.getLong("linked")));
    return counts;
  }

  private ExternalIdentityRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ExternalIdentityRecord(
        rs.getString("identity_id"),
        rs.getString("account_id"),
        rs.getString("provider"),
        rs.getString("provider_user_id"),
        readClaims(rs.getString("claims_text")),
        toInstant(rs, "created_at"),
        toInstant(rs, "updated_at"));
  }

  private String writeClaims(Map<String, String> claims) {
    try {
      return objectMapper.writeValueAsString(claims);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize identity claims", e);
    }
  }

  private Map<String, String> readClaims(String claimsJson) {
    if (claimsJson == null || claimsJson.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(claimsJson, CLAIMS_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to parse identity claims", e);
    }
  }
}
