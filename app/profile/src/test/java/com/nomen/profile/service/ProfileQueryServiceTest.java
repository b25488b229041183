package com.nomen.profile.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.nomen.profile.api.ResourceNotFoundException;
import com.nomen.profile.api.response.ProfileAttributesResponse;
import com.nomen.profile.api.response.ProfileResponse;
import com.nomen.profile.api.response.ProviderLinksResponse;
import com.nomen.profile.model.AccountRecord;
import com.nomen.profile.model.AttributeKey;
import com.nomen.profile.model.ProfileAttributeRecord;
import com.nomen.profile.model.ProfileRecord;
import com.nomen.profile.repository.AccountRepository;
import com.nomen.profile.repository.ExternalIdentityRepository;
import com.nomen.profile.repository.ProfileAttributeRepository;
import com.nomen.profile.repository.ProfileRepository;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProfileQueryServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Mock private AccountRepository accountRepository;
  @Mock private ProfileRepository profileRepository;
  @Mock private ProfileAttributeRepository attributeRepository;
  @Mock private ExternalIdentityRepository identityRepository;

  @InjectMocks private ProfileQueryService service;

  @Test
  void getProfileReturnsAggregateAndMergedAccounts() {
    when(accountRepository.findByAccountId("account-1"))
        .thenReturn(Optional.of(new AccountRecord("account-1", "profile-1", NOW, NOW)));
    when(profileRepository.findByProfileId("profile-1"))
        .thenReturn(
            Optional.of(
                new ProfileRecord(
                    "profile-1", "Alice", "a@example.com", List.of("account-old"), NOW, NOW)));

    final ProfileResponse response = service.getProfile("account-1");

    assertThat(response.displayName()).isEqualTo("Alice");
    assertThat(response.primaryEmail()).isEqualTo("a@example.com");
    assertThat(response.mergedAccountIds()).containsExactly("account-old");
  }

  @Test
  void getProfileFailsWhenAccountHasNoProfile() {
    when(accountRepository.findByAccountId("account-1"))
        .thenReturn(Optional.of(new AccountRecord("account-1", null, NOW, NOW)));

    assertThatThrownBy(() -> service.getProfile("account-1"))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessage("profile not found");
    verifyNoInteractions(profileRepository);
  }

  @Test
  void getAttributesMapsEveryCandidate() {
    when(accountRepository.findByAccountId("account-1"))
        .thenReturn(Optional.of(new AccountRecord("account-1", "profile-1", NOW, NOW)));
    when(profileRepository.findByProfileId("profile-1"))
        .thenReturn(Optional.of(new ProfileRecord("profile-1", "A", null, List.of(), NOW, NOW)));
    when(attributeRepository.findByProfileId("profile-1"))
        .thenReturn(
            List.of(
                new ProfileAttributeRecord(
                    "attr-1",
                    "profile-1",
                    "identity-1",
                    AttributeKey.DISPLAY_NAME,
                    "A",
                    "google",
                    true,
                    NOW,
                    NOW),
                new ProfileAttributeRecord(
                    "attr-2",
                    "profile-1",
                    "identity-2",
                    AttributeKey.DISPLAY_NAME,
                    "B",
                    "github",
                    false,
                    NOW,
                    NOW)));

    final ProfileAttributesResponse response = service.getAttributes("account-1");

    assertThat(response.profileId()).isEqualTo("profile-1");
    assertThat(response.attributes()).hasSize(2);
    assertThat(response.attributes().get(0).attributeKey()).isEqualTo("display_name");
    assertThat(response.attributes().get(0).preferred()).isTrue();
    assertThat(response.attributes().get(1).sourceProvider()).isEqualTo("github");
  }

  @Test
  void getProviderLinksSumsCounts() {
    final Map<String, Long> counts = new LinkedHashMap<>();
    counts.put("github", 1L);
    counts.put("google", 2L);
    when(accountRepository.findByAccountId("account-1"))
        .thenReturn(Optional.of(new AccountRecord("account-1", "profile-1", NOW, NOW)));
    when(identityRepository.countByProvider("account-1")).thenReturn(counts);

    final ProviderLinksResponse response = service.getProviderLinks("account-1");

    assertThat(response.providers()).containsExactly(Map.entry("github", 1L), Map.entry("google", 2L));
    assertThat(response.total()).isEqualTo(3L);
  }

  @Test
  void unknownAccountIsNotFound() {
    when(accountRepository.findByAccountId("ghost")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getProviderLinks("ghost"))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessage("account not found");
  }
}
