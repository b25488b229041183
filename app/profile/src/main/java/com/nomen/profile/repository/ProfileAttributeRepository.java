package com.nomen.profile.repository;

import static com.nomen.common.JdbcTimestampUtils.toInstant;
import static com.nomen.common.JdbcTimestampUtils.toTimestamp;

import com.nomen.profile.model.AttributeKey;
import com.nomen.profile.model.ProfileAttributeRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class ProfileAttributeRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<ProfileAttributeRecord> findByAttributeId(String attributeId) {
    final String sql =
        """
        SELECT attribute_id, profile_id, identity_id, attribute_key, attribute_value,
               source_provider, is_preferred, created_at, updated_at
        FROM profile_attributes
        WHERE attribute_id = :attributeId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("attributeId", attributeId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<ProfileAttributeRecord> findByProfileId(String profileId) {
    final String sql =
        """
        SELECT attribute_id, profile_id, identity_id, attribute_key, attribute_value,
               source_provider, is_preferred, created_at, updated_at
        FROM profile_attributes
        WHERE profile_id = :profileId
        ORDER BY attribute_key ASC, created_at ASC, attribute_id ASC
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("profileId", profileId), this::mapRow);
  }

  /**
   * (identity_id, attribute_key) をキーに候補値を登録/更新する。
   *
   * <p>新規行は is_preferred = FALSE で作成し、既存行は値と updated_at のみ更新する。 preferred
   * の切り替えはここでは行わない。
   */
  public int upsertForIdentity(
      String attributeId,
      String profileId,
      String identityId,
      AttributeKey key,
      String value,
      String sourceProvider,
      Instant now) {
    final String sql =
        """
        INSERT INTO profile_attributes (
          attribute_id, profile_id, identity_id, attribute_key, attribute_value,
          source_provider, is_preferred, created_at, updated_at
        ) VALUES (
          :attributeId, :profileId, :identityId, :attributeKey, :attributeValue,
          :sourceProvider, FALSE, :now, :now
        )
        ON CONFLICT (identity_id, attribute_key) WHERE identity_id IS NOT NULL
        DO UPDATE SET
          attribute_value = EXCLUDED.attribute_value,
          updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attributeId", attributeId)
            .addValue("profileId", profileId)
            .addValue("identityId", identityId)
            .addValue("attributeKey", key.columnValue())
            .addValue("attributeValue", value)
            .addValue("sourceProvider", sourceProvider)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * preferred が 1 行もないキーについて、最も古い行 (同時刻は attribute_id の昇順) を preferred
   * にする。
   */
  public int bootstrapPreferred(String profileId, Instant now) {
    final String sql =
        """
        UPDATE profile_attributes
        SET is_preferred = TRUE,
            updated_at = :now
        WHERE attribute_id IN (
          SELECT DISTINCT ON (candidate.attribute_key) candidate.attribute_id
          FROM profile_attributes candidate
          WHERE candidate.profile_id = :profileId
            AND NOT EXISTS (
              SELECT 1
              FROM profile_attributes preferred
              WHERE preferred.profile_id = candidate.profile_id
                AND preferred.attribute_key = candidate.attribute_key
                AND preferred.is_preferred = TRUE)
          ORDER BY candidate.attribute_key ASC, candidate.created_at ASC, candidate.attribute_id ASC
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("profileId", profileId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int clearPreferred(String profileId, AttributeKey key, Instant now) {
    final String sql =
        """
        UPDATE profile_attributes
        SET is_preferred = FALSE,
            updated_at = :now
        WHERE profile_id = :profileId
          AND attribute_key = :attributeKey
          AND is_preferred = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("profileId", profileId)
            .addValue("attributeKey", key.columnValue())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markPreferred(String attributeId, Instant now) {
    final String sql =
        """
        UPDATE profile_attributes
        SET is_preferred = TRUE,
            updated_at = :now
        WHERE attribute_id = :attributeId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attributeId", attributeId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * 統合元 profile の legacy 行 (identity_id IS NULL) のうち、統合先に同じ key + provider
   * の legacy 行があるものを削除する。付け替え時の一意制約違反を避け、統合先の値を残す。
   */
  public int deleteLegacyConflicts(String sourceProfileId, String targetProfileId) {
    final String sql =
        """
        DELETE FROM profile_attributes absorbed
        WHERE absorbed.profile_id = :sourceProfileId
          AND absorbed.identity_id IS NULL
          AND EXISTS (
            SELECT 1
            FROM profile_attributes kept
            WHERE kept.profile_id = :targetProfileId
              AND kept.identity_id IS NULL
              AND kept.attribute_key = absorbed.attribute_key
              AND kept.source_provider = absorbed.source_provider)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sourceProfileId", sourceProfileId)
            .addValue("targetProfileId", targetProfileId);
    return jdbcTemplate.update(sql, params);
  }

  /** 付け替えた行は必ず非 preferred にし、統合先の選択を上書きしない。 */
  public int reparent(String sourceProfileId, String targetProfileId, Instant now) {
    final String sql =
        """
        UPDATE profile_attributes
        SET profile_id = :targetProfileId,
            is_preferred = FALSE,
            updated_at = :now
        WHERE profile_id = :sourceProfileId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sourceProfileId", sourceProfileId)
            .addValue("targetProfileId", targetProfileId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private ProfileAttributeRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ProfileAttributeRecord(
        rs.getString("attribute_id"),
        rs.getString("profile_id"),
        rs.getString("identity_id"),
        AttributeKey.fromColumnValue(rs.getString("attribute_key")),
        rs.getString("attribute_value"),
        rs.getString("source_provider"),
        rs.getBoolean("is_preferred"),
        toInstant(rs, "created_at"),
        toInstant(rs, "updated_at"));
  }
}
