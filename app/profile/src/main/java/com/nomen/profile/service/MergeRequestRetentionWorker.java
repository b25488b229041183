/*
 * どこで: merge_requests の定期掃除
 * 何を: 期限切れトークンの削除を一定間隔で起動する
 * なぜ: 手動運用なしで掃除を回すため
 */
package com.nomen.profile.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "profile.retention.enabled", havingValue = "true")
public class MergeRequestRetentionWorker {

  private final MergeRequestRetentionService retentionService;

  @Scheduled(fixedDelayString = "${profile.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
