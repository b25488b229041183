package com.nomen.profile.api;

import com.nomen.profile.api.response.ProfileAttributesResponse;
import com.nomen.profile.api.response.ProfileResponse;
import com.nomen.profile.api.response.ProviderLinksResponse;
import com.nomen.profile.service.PreferenceService;
import com.nomen.profile.service.ProfileQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/me")
@RequiredArgsConstructor
public class ProfileController {

  private static final String HEADER_ACCOUNT_ID = "X-Account-Id";
  private final ProfileQueryService profileQueryService;
  private final PreferenceService preferenceService;

  @GetMapping("/profile")
  public ResponseEntity<ProfileResponse> getProfile(
      @RequestHeader(HEADER_ACCOUNT_ID) String accountId) {
    return ResponseEntity.ok(profileQueryService.getProfile(accountId));
  }

  @GetMapping("/profile/attributes")
  public ResponseEntity<ProfileAttributesResponse> getAttributes(
      @RequestHeader(HEADER_ACCOUNT_ID) String accountId) {
    return ResponseEntity.ok(profileQueryService.getAttributes(accountId));
  }

  @GetMapping("/providers")
  public ResponseEntity<ProviderLinksResponse> getProviderLinks(
      @RequestHeader(HEADER_ACCOUNT_ID) String accountId) {
    return ResponseEntity.ok(profileQueryService.getProviderLinks(accountId));
  }

  @PostMapping("/attributes/{attributeId}:prefer")
  public ResponseEntity<Void> preferAttribute(
      @PathVariable("attributeId") String attributeId,
      @RequestHeader(HEADER_ACCOUNT_ID) String accountId) {
    preferenceService.setPreferredAttribute(attributeId, accountId);
    return ResponseEntity.noContent().build();
  }
}
