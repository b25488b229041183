/*
 * どこで: Profile サービス層
 * 何を: 統合トークンの発行/照会/取消/実行を扱う
 * なぜ: 両 account の所有者が順にログインしたことを、単回利用・短命のトークンで証明させるため
 */
package com.nomen.profile.service;

import com.nomen.profile.api.MergeRejectedException;
import com.nomen.profile.api.MergeTokenExpiredException;
import com.nomen.profile.api.ResourceNotFoundException;
import com.nomen.profile.api.SameAccountException;
import com.nomen.profile.api.response.MergeExecutionResponse;
import com.nomen.profile.api.response.MergeRequestCreatedResponse;
import com.nomen.profile.api.response.MergeRequesterInfoResponse;
import com.nomen.profile.config.MergeRequestProperties;
import com.nomen.profile.model.MergeRequestRecord;
import com.nomen.profile.model.MergeResult;
import com.nomen.profile.model.ProfileRecord;
import com.nomen.profile.repository.AccountRepository;
import com.nomen.profile.repository.MergeRequestRepository;
import com.nomen.profile.repository.ProfileRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class MergeRequestService {

  private static final Logger logger = LoggerFactory.getLogger(MergeRequestService.class);

  private final AccountRepository accountRepository;
  private final ProfileRepository profileRepository;
  private final MergeRequestRepository mergeRequestRepository;
  private final AccountMergeService accountMergeService;
  private final MergeTokenGenerator tokenGenerator;
  private final MergeRequestProperties properties;
  private final ProfileMetrics profileMetrics;
  private final Clock clock;

  /**
   * requester の新しい統合トークンを発行する。未使用の古いトークンは無効化する。
   *
   * <p>requester の account 行をロックするため、同時発行でも有効なトークンは 1 つに保たれる。
   */
  @Transactional
  public MergeRequestCreatedResponse createMergeRequest(String requesterAccountId) {
    requireText(requesterAccountId, "account_id is required");
    accountRepository
        .findByAccountIdForUpdate(requesterAccountId)
        .orElseThrow(() -> new ResourceNotFoundException("account not found"));

    final int superseded = mergeRequestRepository.deleteByRequester(requesterAccountId);
    final Instant now = Instant.now(clock);
    final MergeRequestRecord created =
        mergeRequestRepository.insert(
            new MergeRequestRecord(
                UUID.randomUUID().toString(),
                requesterAccountId,
                tokenGenerator.newToken(),
                now,
                now.plus(properties.tokenTtl())));

    profileMetrics.recordMergeRequest("created");
    logger.info(
        "merge request created requesterAccountId={} superseded={} expiresAt={}",
        requesterAccountId,
        superseded,
        created.expiresAt());
    return new MergeRequestCreatedResponse(created.token(), created.expiresAt());
  }

  /** 実行前の確認画面用に、トークン発行者の表示名とメールを返す。トークンは消費しない。 */
  @Transactional(readOnly = true)
  public MergeRequesterInfoResponse getRequesterInfo(String token, String callerAccountId) {
    requireText(token, "token is required");
    requireText(callerAccountId, "account_id is required");

    final MergeRequestRecord request =
        mergeRequestRepository
            .findByToken(token)
            .orElseThrow(() -> new ResourceNotFoundException("merge token not found"));
    if (request.isExpiredAt(Instant.now(clock))) {
      profileMetrics.recordMergeRequest("expired");
      throw new MergeTokenExpiredException("merge token expired");
    }
    if (request.requesterAccountId().equals(callerAccountId)) {
      throw new SameAccountException("merge token was issued by the caller");
    }

    final Optional<ProfileRecord> profile =
        profileRepository.findByAccountId(request.requesterAccountId());
    return new MergeRequesterInfoResponse(
        profile.map(ProfileRecord::displayName).orElse(null),
        profile.map(ProfileRecord::primaryEmail).orElse(null));
  }

  /** トークンを取り消す。存在しない/使用済みのトークンでも成功扱い。 */
  @Transactional
  public void cancelMergeRequest(String token) {
    requireText(token, "token is required");
    final int deleted = mergeRequestRepository.deleteByToken(token);
    if (deleted > 0) {
      profileMetrics.recordMergeRequest("cancelled");
    }
    logger.info("merge request cancelled deleted={}", deleted);
  }

  /**
   * トークンを消費し、発行者の account を target、呼び出し元の account を source として統合する。
   *
   * <p>トークンは検証より先に削除され、統合が失敗しても再利用できない。
   */
  public MergeExecutionResponse executeMerge(String token, String callerAccountId) {
    requireText(token, "token is required");
    requireText(callerAccountId, "account_id is required");

    final MergeRequestRecord request =
        mergeRequestRepository
            .consumeByToken(token)
            .orElseThrow(() -> new ResourceNotFoundException("merge token not found"));
    profileMetrics.recordMergeRequest("consumed");
    if (request.isExpiredAt(Instant.now(clock))) {
      profileMetrics.recordMergeRequest("expired");
      throw new MergeTokenExpiredException("merge token expired");
    }
    if (request.requesterAccountId().equals(callerAccountId)) {
      profileMetrics.recordMerge("invalid");
      throw new MergeRejectedException(
          MergeRejectedException.Reason.INVALID_MERGE, "cannot merge an account into itself");
    }

    final Instant startedAt = Instant.now(clock);
    final MergeResult result;
    try {
      result =
          accountMergeService.merge(
              request.requesterAccountId(), callerAccountId, callerAccountId);
    } catch (RuntimeException ex) {
      if (!(ex instanceof MergeRejectedException)) {
        profileMetrics.recordMerge("failed");
      }
      throw ex;
    } finally {
      profileMetrics.recordMergeDuration(Duration.between(startedAt, Instant.now(clock)));
    }

    return new MergeExecutionResponse(
        true,
        result.targetProfileId(),
        result.sourceProfileId(),
        result.attributesMerged(),
        result.identitiesMoved(),
        true,
        result.sourceAccountId(),
        true);
  }

  private void requireText(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(message);
    }
  }
}
