/*
 * どこで: Profile API
 * 何を: 統合トークンの TTL 切れ (410) を表す例外
 * なぜ: 「無効なトークン」と「期限切れ」で利用者への案内を変えるため
 */
package com.nomen.profile.api;

public class MergeTokenExpiredException extends RuntimeException {

  public MergeTokenExpiredException(String message) {
    super(message);
  }
}
