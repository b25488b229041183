/*
 * どこで: Profile アプリの設定バインド
 * 何を: 統合トークンの TTL と乱数長を保持する
 * なぜ: 二段階認証フローの所要時間に合わせて運用で調整できるようにするため
 */
package com.nomen.profile.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "profile.merge")
public record MergeRequestProperties(Duration tokenTtl, Integer tokenBytes) {

  // 16byte 未満は推測耐性が不足するため下限を設ける。
  static final int MIN_TOKEN_BYTES = 16;

  public MergeRequestProperties {
    tokenTtl = tokenTtl == null ? Duration.ofMinutes(10) : tokenTtl;
    tokenBytes = tokenBytes == null ? 32 : tokenBytes;
    if (tokenTtl.isNegative() || tokenTtl.isZero()) {
      throw new IllegalArgumentException("profile.merge.token-ttl must be positive");
    }
    if (tokenBytes < MIN_TOKEN_BYTES) {
      throw new IllegalArgumentException(
          "profile.merge.token-bytes must be at least " + MIN_TOKEN_BYTES);
    }
  }
}
