/*
 * どこで: Profile API
 * 何を: 統合リクエストの発行者自身が戻ってきた (統合対象なし) ことを表す例外
 * なぜ: 確認画面で「同じアカウント」を専用の案内として出し分けるため
 */
package com.nomen.profile.api;

public class SameAccountException extends RuntimeException {

  public SameAccountException(String message) {
    super(message);
  }
}
