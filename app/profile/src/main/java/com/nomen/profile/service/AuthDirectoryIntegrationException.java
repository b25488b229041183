package com.nomen.profile.service;

/** 外部認証基盤の呼び出し失敗。統合トランザクションをロールバックさせるため非検査例外にする。 */
public class AuthDirectoryIntegrationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    FORBIDDEN,
    BAD_GATEWAY,
    TIMEOUT
  }

  private final Reason reason;

  public AuthDirectoryIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public AuthDirectoryIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  /** 404 以外の HTTP エラー応答を理由へ振り分ける。404 は呼び出し側で成功扱いにする。 */
  static AuthDirectoryIntegrationException forHttpStatus(int status, Throwable cause) {
    return switch (status) {
      case 401 ->
          new AuthDirectoryIntegrationException(
              Reason.UNAUTHORIZED, "auth directory rejected internal auth", cause);
      case 403 ->
          new AuthDirectoryIntegrationException(
              Reason.FORBIDDEN, "auth directory denied access", cause);
      default ->
          new AuthDirectoryIntegrationException(
              Reason.BAD_GATEWAY, "auth directory request failed status=" + status, cause);
    };
  }

  public Reason reason() {
    return reason;
  }
}
