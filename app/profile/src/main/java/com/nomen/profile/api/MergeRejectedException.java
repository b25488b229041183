/*
 * どこで: Profile API
 * 何を: アカウント統合の事前条件違反 (409) を表す例外
 * なぜ: 自己統合/profile なし/統合済みを理由コードで区別し、部分的な変更を残さずに中断するため
 */
package com.nomen.profile.api;

public class MergeRejectedException extends RuntimeException {

  public enum Reason {
    INVALID_MERGE,
    NO_PROFILE,
    ALREADY_MERGED
  }

  private final Reason reason;

  public MergeRejectedException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
