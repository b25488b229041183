/*
 * どこで: Profile API
 * 何を: 認証済みだが対象リソースの所有者ではないことを表す例外 (403)
 * なぜ: 他人の profile への操作をストレージに触れる前に拒否するため
 */
package com.nomen.profile.api;

public class ProfileAccessDeniedException extends RuntimeException {

  public ProfileAccessDeniedException(String message) {
    super(message);
  }
}
