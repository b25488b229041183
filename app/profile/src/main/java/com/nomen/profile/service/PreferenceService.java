package com.nomen.profile.service;

import com.nomen.profile.api.ProfileAccessDeniedException;
import com.nomen.profile.api.ResourceNotFoundException;
import com.nomen.profile.model.AccountRecord;
import com.nomen.profile.model.ProfileAttributeRecord;
import com.nomen.profile.repository.AccountRepository;
import com.nomen.profile.repository.ProfileAttributeRepository;
import com.nomen.profile.repository.ProfileRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class PreferenceService {

  private static final Logger logger = LoggerFactory.getLogger(PreferenceService.class);

  private final AccountRepository accountRepository;
  private final ProfileRepository profileRepository;
  private final ProfileAttributeRepository attributeRepository;
  private final ProfileMetrics profileMetrics;
  private final Clock clock;

  /**
   * 指定属性を同じキーの唯一の preferred にし、集約対象キーなら profile へ書き戻す。
   *
   * <p>caller の account 行をロックしてから属性を読むため、同時に進む統合とは直列化される。
   */
  @Transactional
  public void setPreferredAttribute(String attributeId, String callerAccountId) {
    if (attributeId == null || attributeId.isBlank()) {
      throw new IllegalArgumentException("attribute_id is required");
    }
    if (callerAccountId == null || callerAccountId.isBlank()) {
      throw new IllegalArgumentException("account_id is required");
    }

    final AccountRecord caller =
        accountRepository
            .findByAccountIdForUpdate(callerAccountId)
            .orElseThrow(() -> new ResourceNotFoundException("account not found"));
    final ProfileAttributeRecord attribute =
        attributeRepository
            .findByAttributeId(attributeId)
            .orElseThrow(() -> new ResourceNotFoundException("attribute not found"));
    if (!caller.hasProfile() || !caller.profileId().equals(attribute.profileId())) {
      logger.warn(
          "preferred attribute change denied accountId={} attributeId={}",
          callerAccountId,
          attributeId);
      throw new ProfileAccessDeniedException("attribute does not belong to caller profile");
    }

    final Instant now = Instant.now(clock);
    attributeRepository.clearPreferred(attribute.profileId(), attribute.attributeKey(), now);
    attributeRepository.markPreferred(attribute.attributeId(), now);
    if (attribute.attributeKey().aggregated()) {
      profileRepository.writeAggregateValue(
          attribute.profileId(), attribute.attributeKey(), attribute.attributeValue(), now);
    }
    profileMetrics.recordPreferenceChange();
    logger.info(
        "preferred attribute changed profileId={} key={} attributeId={}",
        attribute.profileId(),
        attribute.attributeKey().columnValue(),
        attribute.attributeId());
  }
}
