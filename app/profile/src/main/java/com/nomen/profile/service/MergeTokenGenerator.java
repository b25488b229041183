package com.nomen.profile.service;

import com.nomen.profile.config.MergeRequestProperties;
import java.security.SecureRandom;
import java.util.Base64;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** 統合トークンを CSPRNG から生成し、URL 安全な Base64 (padding なし) で返す。 */
@Component
@RequiredArgsConstructor
public class MergeTokenGenerator {

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final MergeRequestProperties properties;

  public String newToken() {
    final byte[] bytes = new byte[properties.tokenBytes()];
    SECURE_RANDOM.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }
}
