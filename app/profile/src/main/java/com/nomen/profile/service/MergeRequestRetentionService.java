/*
 * どこで: Profile サービス層
 * 何を: 期限切れの merge_requests を削除する
 * なぜ: 期限判定は参照時に行うため正しさには影響しないが、テーブルの肥大化を防ぐため
 */
package com.nomen.profile.service;

import com.nomen.profile.repository.MergeRequestRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class MergeRequestRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(MergeRequestRetentionService.class);

  private final MergeRequestRepository mergeRequestRepository;
  private final Clock clock;

  @Transactional
  public int cleanup() {
    final Instant now = Instant.now(clock);
    final int deleted = mergeRequestRepository.deleteExpired(now);
    logger.info("merge request retention cleanup deleted={} threshold={}", deleted, now);
    return deleted;
  }
}
