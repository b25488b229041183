/*
 * どこで: Profile サービス層
 * 何を: 2 つの account を 1 つに統合する (source を target へ吸収し、source を削除する)
 * なぜ: 同一人物が複数 provider で作った account を、二段階の本人確認後に 1 つへまとめるため
 */
package com.nomen.profile.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nomen.profile.api.MergeRejectedException;
import com.nomen.profile.model.AccountRecord;
import com.nomen.profile.model.AuditLogRecord;
import com.nomen.profile.model.MergeResult;
import com.nomen.profile.repository.AccountRepository;
import com.nomen.profile.repository.AuditLogRepository;
import com.nomen.profile.repository.ExternalIdentityRepository;
import com.nomen.profile.repository.ProfileAttributeRepository;
import com.nomen.profile.repository.ProfileRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AccountMergeService {

  private static final Logger logger = LoggerFactory.getLogger(AccountMergeService.class);
  static final String AUDIT_ACTION = "MERGE_ACCOUNT";

  private final AccountRepository accountRepository;
  private final ProfileRepository profileRepository;
  private final ExternalIdentityRepository identityRepository;
  private final ProfileAttributeRepository attributeRepository;
  private final AuditLogRepository auditLogRepository;
  private final AuthDirectoryClient authDirectoryClient;
  private final ProfileMetrics profileMetrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * source account を target account へ統合する。
   *
   * <p>両 account 行を account_id の昇順でロックしてから前提条件を検証するため、同じ組に対する
   * 同時実行では後続が ALREADY_MERGED または NO_PROFILE で失敗する。外部認証基盤の principal
   * 削除は最後に行い、失敗すればトランザクション全体がロールバックされる。
   */
  @Transactional
  public MergeResult merge(String targetAccountId, String sourceAccountId, String actorAccountId) {
    if (isBlank(targetAccountId) || isBlank(sourceAccountId)) {
      throw new IllegalArgumentException("target and source account ids are required");
    }
    if (targetAccountId.equals(sourceAccountId)) {
      profileMetrics.recordMerge("invalid");
      throw new MergeRejectedException(
          MergeRejectedException.Reason.INVALID_MERGE, "cannot merge an account into itself");
    }

    final Map<String, AccountRecord> locked = lockInOrder(targetAccountId, sourceAccountId);
    final AccountRecord target = locked.get(targetAccountId);
    final AccountRecord source = locked.get(sourceAccountId);
    if (target == null || source == null || !target.hasProfile() || !source.hasProfile()) {
      profileMetrics.recordMerge("no_profile");
      throw new MergeRejectedException(
          MergeRejectedException.Reason.NO_PROFILE, "both accounts must have a profile");
    }
    if (target.profileId().equals(source.profileId())) {
      profileMetrics.recordMerge("already_merged");
      throw new MergeRejectedException(
          MergeRejectedException.Reason.ALREADY_MERGED, "accounts already share a profile");
    }

    final Instant now = Instant.now(clock);
    final String targetProfileId = target.profileId();
    final String sourceProfileId = source.profileId();

    final int identitiesMoved =
        identityRepository.reassignAccount(sourceAccountId, targetAccountId, now);
    final int legacyDropped =
        attributeRepository.deleteLegacyConflicts(sourceProfileId, targetProfileId);
    final int attributesMerged =
        attributeRepository.reparent(sourceProfileId, targetProfileId, now);
    attributeRepository.bootstrapPreferred(targetProfileId, now);
    profileRepository.refreshAggregate(targetProfileId, now);
    profileRepository.appendMergedAccountId(targetProfileId, sourceAccountId, now);

    // accounts.profile_id は ON DELETE SET NULL のため、profile より先に account を消す。
    accountRepository.delete(sourceAccountId);
    profileRepository.delete(sourceProfileId);

    final MergeResult result =
        new MergeResult(
            targetAccountId,
            sourceAccountId,
            targetProfileId,
            sourceProfileId,
            attributesMerged,
            identitiesMoved);
    auditLogRepository.insert(
        new AuditLogRecord(
            UUID.randomUUID().toString(),
            actorAccountId,
            AUDIT_ACTION,
            targetAccountId,
            createMetadataJson(result, legacyDropped),
            now));

    authDirectoryClient.deletePrincipal(sourceAccountId);

    profileMetrics.recordMerge("success");
    logger.info(
        "accounts merged targetAccountId={} sourceAccountId={} targetProfileId={}"
            + " identitiesMoved={} attributesMerged={} legacyDropped={}",
        targetAccountId,
        sourceAccountId,
        targetProfileId,
        identitiesMoved,
        attributesMerged,
        legacyDropped);
    return result;
  }

  private Map<String, AccountRecord> lockInOrder(String first, String second) {
    final String lower = first.compareTo(second) <= 0 ? first : second;
    final String higher = lower.equals(first) ? second : first;
    final Map<String, AccountRecord> locked = new LinkedHashMap<>();
    for (String accountId : new String[] {lower, higher}) {
      final Optional<AccountRecord> account = accountRepository.findByAccountIdForUpdate(accountId);
      account.ifPresent(record -> locked.put(accountId, record));
    }
    return locked;
  }

  private String createMetadataJson(MergeResult result, int legacyDropped) {
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("source_account_id", result.sourceAccountId());
    metadata.put("source_profile_id", result.sourceProfileId());
    metadata.put("target_profile_id", result.targetProfileId());
    metadata.put("identities_moved", result.identitiesMoved());
    metadata.put("attributes_merged", result.attributesMerged());
    metadata.put("legacy_attributes_dropped", legacyDropped);
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize audit metadata", e);
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
