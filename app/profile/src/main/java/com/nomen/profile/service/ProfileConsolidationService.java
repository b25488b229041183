package com.nomen.profile.service;

import com.nomen.profile.api.request.IdentitySyncRequest;
import com.nomen.profile.api.response.IdentitySyncResponse;
import com.nomen.profile.model.AccountRecord;
import com.nomen.profile.model.AttributeKey;
import com.nomen.profile.model.ExternalIdentityRecord;
import com.nomen.profile.model.ProfileRecord;
import com.nomen.profile.repository.AccountRepository;
import com.nomen.profile.repository.ExternalIdentityRepository;
import com.nomen.profile.repository.ProfileAttributeRepository;
import com.nomen.profile.repository.ProfileRepository;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * identity の作成/更新イベントを受け、claims を所有 account の profile へ集約する。
 *
 * <p>1 回の集約は 1 トランザクションで、identity の所有 account 行をロックしてから identity の
 * upsert・profile 作成・候補値 upsert・preferred の初期化・集約値の再計算を行う。同一 account
 * への同時イベントはこのロックで直列化される。
 */
@Service
@RequiredArgsConstructor
public class ProfileConsolidationService {

  private static final Logger logger = LoggerFactory.getLogger(ProfileConsolidationService.class);
  private static final int MAX_OWNER_LOCK_ATTEMPTS = 3;

  private final AccountBindingService accountBindingService;
  private final AccountRepository accountRepository;
  private final ProfileRepository profileRepository;
  private final ExternalIdentityRepository identityRepository;
  private final ProfileAttributeRepository attributeRepository;
  private final ClaimsAttributeExtractor claimsAttributeExtractor;
  private final ProfileMetrics profileMetrics;
  private final Clock clock;

  @Transactional
  public IdentitySyncResponse syncIdentity(@NonNull IdentitySyncRequest request) {
    validateRequest(request);
    final Instant now = Instant.now(clock);

    // external_identities へ書く前に所有 account 行をロックする。FK 検査の KEY SHARE と
    // FOR UPDATE の順序が逆転すると、同一 account へのイベント同士や統合処理とデッドロックする。
    final OwnedIdentity owned = lockOwner(request);
    if (owned.identity().isPresent()
        && !owned.identity().get().accountId().equals(request.accountId())) {
      // 統合済みなど、既に別 account に紐付いている identity は現在の所有者を正とする。
      logger.info(
          "identity already bound to another account provider={} boundAccountId={} eventAccountId={}",
          request.provider(),
          owned.accountId(),
          request.accountId());
    }

    final String identityId =
        owned
            .identity()
            .map(ExternalIdentityRecord::identityId)
            .orElseGet(() -> resolveIdentityId(request));
    final ExternalIdentityRecord stored =
        identityRepository.upsert(
            new ExternalIdentityRecord(
                identityId,
                owned.accountId(),
                request.provider(),
                request.providerUserId(),
                request.claims(),
                now,
                now));

    final String profileId = consolidate(stored, now);
    return new IdentitySyncResponse(stored.accountId(), profileId, stored.identityId());
  }

  /**
   * identity の所有 account をロックし、ロック後に identity を読み直して所有者が変わって
   * いないことを確かめる。
   *
   * <p>ロック待ちの間に統合で identity が別 account へ移った場合は、移動先を取り直す。
   */
  private OwnedIdentity lockOwner(IdentitySyncRequest request) {
    Optional<ExternalIdentityRecord> identity =
        identityRepository.findByProviderAndProviderUserId(
            request.provider(), request.providerUserId());
    for (int attempt = 1; attempt <= MAX_OWNER_LOCK_ATTEMPTS; attempt++) {
      final String ownerAccountId;
      if (identity.isEmpty()) {
        accountBindingService.ensureAccount(request.accountId());
        ownerAccountId = request.accountId();
      } else {
        ownerAccountId = identity.get().accountId();
      }
      final boolean locked = accountRepository.findByAccountIdForUpdate(ownerAccountId).isPresent();
      final Optional<ExternalIdentityRecord> reread =
          identityRepository.findByProviderAndProviderUserId(
              request.provider(), request.providerUserId());
      final boolean ownerUnchanged =
          reread.map(found -> found.accountId().equals(ownerAccountId)).orElse(true);
      if (locked && ownerUnchanged) {
        return new OwnedIdentity(ownerAccountId, reread);
      }
      identity = reread;
    }
    throw new ConcurrencyFailureException("identity owner kept changing while locking");
  }

  /**
   * identity の claims を所有 account の profile へ反映し、profile_id を返す。
   *
   * <p>account に profile がなければ候補値を初期値として新規作成する。候補値の再反映では
   * preferred は変更しない。
   */
  @Transactional
  public String consolidate(@NonNull ExternalIdentityRecord identity, @NonNull Instant now) {
    final AccountRecord account =
        accountRepository
            .findByAccountIdForUpdate(identity.accountId())
            .orElseThrow(() -> new IllegalStateException("identity owner account is missing"));
    final Map<AttributeKey, String> candidates =
        claimsAttributeExtractor.extract(identity.claims());

    final String profileId;
    if (account.hasProfile()) {
      profileId = account.profileId();
      profileMetrics.recordConsolidation("updated");
    } else {
      profileId = createProfile(account.accountId(), candidates, now);
      profileMetrics.recordConsolidation("created");
    }

    for (Map.Entry<AttributeKey, String> candidate : candidates.entrySet()) {
      attributeRepository.upsertForIdentity(
          UUID.randomUUID().toString(),
          profileId,
          identity.identityId(),
          candidate.getKey(),
          candidate.getValue(),
          identity.provider(),
          now);
    }
    final int bootstrapped = attributeRepository.bootstrapPreferred(profileId, now);
    profileRepository.refreshAggregate(profileId, now);

    logger.info(
        "identity consolidated accountId={} profileId={} provider={} candidates={} bootstrapped={}",
        account.accountId(),
        profileId,
        identity.provider(),
        candidates.keySet(),
        bootstrapped);
    return profileId;
  }

  private String createProfile(
      String accountId, Map<AttributeKey, String> candidates, Instant now) {
    final ProfileRecord profile =
        profileRepository.insert(
            new ProfileRecord(
                UUID.randomUUID().toString(),
                candidates.get(AttributeKey.DISPLAY_NAME),
                candidates.get(AttributeKey.PRIMARY_EMAIL),
                List.of(),
                now,
                now));
    accountRepository.updateProfileId(accountId, profile.profileId(), now);
    logger.info("profile created accountId={} profileId={}", accountId, profile.profileId());
    return profile.profileId();
  }

  private void validateRequest(IdentitySyncRequest request) {
    if (isBlank(request.accountId())) {
      throw new IllegalArgumentException("account_id is required");
    }
    if (isBlank(request.provider())) {
      throw new IllegalArgumentException("provider is required");
    }
    if (isBlank(request.providerUserId())) {
      throw new IllegalArgumentException("provider_user_id is required");
    }
  }

  private String resolveIdentityId(IdentitySyncRequest request) {
    if (!isBlank(request.identityId())) {
      return request.identityId();
    }
    final String key = request.provider() + ":" + request.providerUserId();
    return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private record OwnedIdentity(String accountId, Optional<ExternalIdentityRecord> identity) {}
}
