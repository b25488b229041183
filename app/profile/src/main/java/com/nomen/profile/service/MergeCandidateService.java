package com.nomen.profile.service;

import com.nomen.profile.api.IdentityAlreadyOwnedException;
import com.nomen.profile.api.ResourceNotFoundException;
import com.nomen.profile.api.response.MergeCandidateResponse;
import com.nomen.profile.model.ExternalIdentityRecord;
import com.nomen.profile.model.ProfileRecord;
import com.nomen.profile.repository.ExternalIdentityRepository;
import com.nomen.profile.repository.ProfileRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** 別の provider でログインした identity が、呼び出し元と統合できる account に属するかを判定する。 */
@Service
@RequiredArgsConstructor
public class MergeCandidateService {

  private final ExternalIdentityRepository identityRepository;
  private final ProfileRepository profileRepository;

  @Transactional(readOnly = true)
  public MergeCandidateResponse checkMergeCandidate(
      String provider, String providerUserId, String callerAccountId) {
    if (provider == null || provider.isBlank()) {
      throw new IllegalArgumentException("provider is required");
    }
    if (providerUserId == null || providerUserId.isBlank()) {
      throw new IllegalArgumentException("provider_user_id is required");
    }
    if (callerAccountId == null || callerAccountId.isBlank()) {
      throw new IllegalArgumentException("account_id is required");
    }

    final ExternalIdentityRecord identity =
        identityRepository
            .findByProviderAndProviderUserId(provider, providerUserId)
            .orElseThrow(() -> new ResourceNotFoundException("identity not found"));
    if (identity.accountId().equals(callerAccountId)) {
      throw new IdentityAlreadyOwnedException("identity already belongs to the caller");
    }

    final Optional<ProfileRecord> otherProfile =
        profileRepository.findByAccountId(identity.accountId());
    return new MergeCandidateResponse(
        true,
        identity.accountId(),
        otherProfile.map(ProfileRecord::profileId).orElse(null),
        otherProfile.map(ProfileRecord::displayName).orElse(null),
        otherProfile.map(ProfileRecord::primaryEmail).orElse(null));
  }
}
