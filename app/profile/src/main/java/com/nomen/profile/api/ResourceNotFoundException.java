/*
 * どこで: Profile API
 * 何を: 対象 (属性/アカウント/トークン/identity) が存在しないことを表す例外
 * なぜ: 404 とそれ以外の失敗を呼び出し側で区別するため
 */
package com.nomen.profile.api;

public class ResourceNotFoundException extends RuntimeException {

  public ResourceNotFoundException(String message) {
    super(message);
  }
}
