package com.nomen.profile.repository;

import static com.nomen.common.JdbcTimestampUtils.toInstant;
import static com.nomen.common.JdbcTimestampUtils.toTimestamp;

import com.nomen.profile.model.AttributeKey;
import com.nomen.profile.model.ProfileRecord;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class ProfileRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<ProfileRecord> findByProfileId(String profileId) {
    final String sql =
        """
        SELECT profile_id, display_name, primary_email, merged_account_ids, created_at, updated_at
        FROM profiles
        WHERE profile_id = :profileId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("profileId", profileId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<ProfileRecord> findByAccountId(String accountId) {
    final String sql =
        """
        SELECT p.profile_id, p.display_name, p.primary_email, p.merged_account_ids,
               p.created_at, p.updated_at
        FROM accounts a
        JOIN profiles p ON p.profile_id = a.profile_id
        WHERE a.account_id = :accountId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("accountId", accountId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public ProfileRecord insert(ProfileRecord profile) {
    final String sql =
        """
        INSERT INTO profiles (profile_id, display_name, primary_email, created_at, updated_at)
        VALUES (:profileId, :displayName, :primaryEmail, :createdAt, :updatedAt)
        RETURNING profile_id, display_name, primary_email, merged_account_ids, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("profileId", profile.profileId())
            .addValue("displayName", profile.displayName())
            .addValue("primaryEmail", profile.primaryEmail())
            .addValue("createdAt", toTimestamp(profile.createdAt()))
            .addValue("updatedAt", toTimestamp(profile.updatedAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  /**
   * preferred 属性から display_name / primary_email を再計算する。
   *
   * <p>preferred が存在しないキーは既存値を維持する。
   */
  public int refreshAggregate(String profileId, Instant now) {
    final String sql =
        """
        UPDATE profiles
        SET display_name = COALESCE(
              (SELECT attribute_value
               FROM profile_attributes
               WHERE profile_id = :profileId
                 AND attribute_key = 'display_name'
                 AND is_preferred = TRUE),
              display_name),
            primary_email = COALESCE(
              (SELECT attribute_value
               FROM profile_attributes
               WHERE profile_id = :profileId
                 AND attribute_key = 'primary_email'
                 AND is_preferred = TRUE),
              primary_email),
            updated_at = :now
        WHERE profile_id = :profileId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("profileId", profileId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int writeAggregateValue(String profileId, AttributeKey key, String value, Instant now) {
    final String sql =
        switch (key) {
          case DISPLAY_NAME ->
              """
              UPDATE profiles
              SET display_name = :value, updated_at = :now
              WHERE profile_id = :profileId
              """;
          case PRIMARY_EMAIL ->
              """
              UPDATE profiles
              SET primary_email = :value, updated_at = :now
              WHERE profile_id = :profileId
              """;
          default -> throw new IllegalArgumentException("not an aggregated key: " + key);
        };
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("profileId", profileId)
            .addValue("value", value)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int appendMergedAccountId(String profileId, String accountId, Instant now) {
    // 同じ accountId を二重に積まない。
    final String sql =
        """
        UPDATE profiles
        SET merged_account_ids = CASE
              WHEN CAST(:accountId AS TEXT) = ANY (merged_account_ids) THEN merged_account_ids
              ELSE array_append(merged_account_ids, CAST(:accountId AS TEXT))
            END,
            updated_at = :now
        WHERE profile_id = :profileId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("profileId", profileId)
            .addValue("accountId", accountId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int delete(String profileId) {
    final String sql = "DELETE FROM profiles WHERE profile_id = :profileId";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("profileId", profileId));
  }

  private ProfileRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ProfileRecord(
        rs.getString("profile_id"),
        rs.getString("display_name"),
        rs.getString("primary_email"),
        toList(rs.getArray("merged_account_ids")),
        toInstant(rs, "created_at"),
        toInstant(rs, "updated_at"));
  }

  private List<String> toList(Array array) throws SQLException {
    if (array == null) {
      return List.of();
    }
    final Object[] values = (Object[]) array.getArray();
    return Arrays.stream(values).map(String::valueOf).toList();
  }
}
