/*
 * どこで: Profile API
 * 何を: 統合候補として指定した identity が既に呼び出し元のものであることを表す例外
 * なぜ: 統合候補の探索で「既に連携済み」を独立した結果として返すため
 */
package com.nomen.profile.api;

public class IdentityAlreadyOwnedException extends RuntimeException {

  public IdentityAlreadyOwnedException(String message) {
    super(message);
  }
}
