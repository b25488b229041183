/*
 * どこで: Profile API
 * 何を: 統合トークンの発行/照会/取消/実行と統合候補の確認エンドポイントを公開する
 * なぜ: 二段階の本人確認を経たアカウント統合フローの入口を提供するため
 */
package com.nomen.profile.api;

import com.nomen.profile.api.request.MergeTokenRequest;
import com.nomen.profile.api.response.MergeCandidateResponse;
import com.nomen.profile.api.response.MergeExecutionResponse;
import com.nomen.profile.api.response.MergeRequestCreatedResponse;
import com.nomen.profile.api.response.MergeRequesterInfoResponse;
import com.nomen.profile.service.MergeCandidateService;
import com.nomen.profile.service.MergeRequestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class MergeController {

  private static final String HEADER_ACCOUNT_ID = "X-Account-Id";
  private final MergeRequestService mergeRequestService;
  private final MergeCandidateService mergeCandidateService;

  @PostMapping("/me/merge-requests")
  public ResponseEntity<MergeRequestCreatedResponse> createMergeRequest(
      @RequestHeader(HEADER_ACCOUNT_ID) String accountId) {
    return ResponseEntity.ok(mergeRequestService.createMergeRequest(accountId));
  }

  @PostMapping("/merge-requests:lookup")
  public ResponseEntity<MergeRequesterInfoResponse> lookupMergeRequest(
      @RequestHeader(HEADER_ACCOUNT_ID) String accountId,
      @Valid @RequestBody MergeTokenRequest request) {
    return ResponseEntity.ok(mergeRequestService.getRequesterInfo(request.token(), accountId));
  }

  @PostMapping("/merge-requests:cancel")
  public ResponseEntity<Void> cancelMergeRequest(
      @RequestHeader(HEADER_ACCOUNT_ID) String accountId,
      @Valid @RequestBody MergeTokenRequest request) {
    mergeRequestService.cancelMergeRequest(request.token());
    return ResponseEntity.noContent().build();
  }

  /** 成功時は呼び出し元 account が削除されるため、クライアントは再認証が必要になる。 */
  @PostMapping("/merge-requests:execute")
  public ResponseEntity<MergeExecutionResponse> executeMerge(
      @RequestHeader(HEADER_ACCOUNT_ID) String accountId,
      @Valid @RequestBody MergeTokenRequest request) {
    return ResponseEntity.ok(mergeRequestService.executeMerge(request.token(), accountId));
  }

  @GetMapping("/me/merge-candidates")
  public ResponseEntity<MergeCandidateResponse> checkMergeCandidate(
      @RequestHeader(HEADER_ACCOUNT_ID) String accountId,
      @RequestParam("provider") String provider,
      @RequestParam("providerUserId") String providerUserId) {
    return ResponseEntity.ok(
        mergeCandidateService.checkMergeCandidate(provider, providerUserId, accountId));
  }
}
