/*
 * どこで: app/profile/src/main/java/com/nomen/profile/api/InternalEventController.java
 * 何を: 外部認証基盤からの principal/identity イベントを受けるコントローラー
 * なぜ: account の作成と claims の profile への集約をイベント駆動で行う入口を明確化するため
 */
package com.nomen.profile.api;

import com.nomen.profile.api.request.IdentitySyncRequest;
import com.nomen.profile.api.request.PrincipalCreatedRequest;
import com.nomen.profile.api.response.AccountResponse;
import com.nomen.profile.api.response.IdentitySyncResponse;
import com.nomen.profile.model.AccountRecord;
import com.nomen.profile.service.AccountBindingService;
import com.nomen.profile.service.ProfileConsolidationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal")
@RequiredArgsConstructor
public class InternalEventController {

  private final AccountBindingService accountBindingService;
  private final ProfileConsolidationService profileConsolidationService;

  /**
   * principal 作成イベント。account を冪等に作成し、profile は未割り当てのまま返す。
   *
   * <p>新規作成なら 201、再送などで既に存在していれば 200。
   */
  @PostMapping("/principals")
  public ResponseEntity<AccountResponse> principalCreated(
      @RequestBody PrincipalCreatedRequest request) {
    final AccountBindingService.Binding binding =
        accountBindingService.bindPrincipal(request.principalId());
    final AccountRecord account = binding.account();
    final HttpStatus status = binding.created() ? HttpStatus.CREATED : HttpStatus.OK;
    return ResponseEntity.status(status)
        .body(new AccountResponse(account.accountId(), account.profileId()));
  }

  /**
   * identity 作成/更新イベント。
   *
   * <p>応答の accountId は identity の現在の所有者で、統合済みならイベントの accountId と異なる。
   */
  @PostMapping("/identities:sync")
  public ResponseEntity<IdentitySyncResponse> syncIdentity(
      @RequestBody IdentitySyncRequest request) {
    return ResponseEntity.ok(profileConsolidationService.syncIdentity(request));
  }
}
