package com.nomen.profile.service;

import com.nomen.profile.api.ResourceNotFoundException;
import com.nomen.profile.api.response.ProfileAttributeResponse;
import com.nomen.profile.api.response.ProfileAttributesResponse;
import com.nomen.profile.api.response.ProfileResponse;
import com.nomen.profile.api.response.ProviderLinksResponse;
import com.nomen.profile.model.AccountRecord;
import com.nomen.profile.model.ProfileAttributeRecord;
import com.nomen.profile.model.ProfileRecord;
import com.nomen.profile.repository.AccountRepository;
import com.nomen.profile.repository.ExternalIdentityRepository;
import com.nomen.profile.repository.ProfileAttributeRepository;
import com.nomen.profile.repository.ProfileRepository;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ProfileQueryService {

  private final AccountRepository accountRepository;
  private final ProfileRepository profileRepository;
  private final ProfileAttributeRepository attributeRepository;
  private final ExternalIdentityRepository identityRepository;

  @Transactional(readOnly = true)
  public ProfileResponse getProfile(String accountId) {
    final ProfileRecord profile = requireProfile(accountId);
    return new ProfileResponse(
        profile.profileId(),
        profile.displayName(),
        profile.primaryEmail(),
        profile.mergedAccountIds());
  }

  @Transactional(readOnly = true)
  public ProfileAttributesResponse getAttributes(String accountId) {
    final ProfileRecord profile = requireProfile(accountId);
    final List<ProfileAttributeResponse> attributes =
        attributeRepository.findByProfileId(profile.profileId()).stream()
            .map(this::toResponse)
            .toList();
    return new ProfileAttributesResponse(profile.profileId(), attributes);
  }

  /** 自 account に紐付く identity の provider 別件数。統合で移ってきた identity も含む。 */
  @Transactional(readOnly = true)
  public ProviderLinksResponse getProviderLinks(String accountId) {
    final AccountRecord account = requireAccount(accountId);
    final Map<String, Long> counts = identityRepository.countByProvider(account.accountId());
    final long total = counts.values().stream().mapToLong(Long::longValue).sum();
    return new ProviderLinksResponse(account.accountId(), counts, total);
  }

  private ProfileRecord requireProfile(String accountId) {
    final AccountRecord account = requireAccount(accountId);
    if (!account.hasProfile()) {
      throw new ResourceNotFoundException("profile not found");
    }
    return profileRepository
        .findByProfileId(account.profileId())
        .orElseThrow(() -> new ResourceNotFoundException("profile not found"));
  }

  private AccountRecord requireAccount(String accountId) {
    if (accountId == null || accountId.isBlank()) {
      throw new IllegalArgumentException("account_id is required");
    }
    return accountRepository
        .findByAccountId(accountId)
        .orElseThrow(() -> new ResourceNotFoundException("account not found"));
  }

  private ProfileAttributeResponse toResponse(ProfileAttributeRecord attribute) {
    return new ProfileAttributeResponse(
        attribute.attributeId(),
        attribute.attributeKey().columnValue(),
        attribute.attributeValue(),
        attribute.sourceProvider(),
        attribute.identityId(),
        attribute.preferred(),
        attribute.createdAt());
  }
}
