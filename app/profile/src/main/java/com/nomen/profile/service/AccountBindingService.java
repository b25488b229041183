package com.nomen.profile.service;

import com.nomen.profile.model.AccountRecord;
import com.nomen.profile.repository.AccountRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** 外部認証基盤の principal を 1:1 で accounts 行に対応付ける。 */
@Service
@RequiredArgsConstructor
public class AccountBindingService {

  private static final Logger logger = LoggerFactory.getLogger(AccountBindingService.class);

  private final AccountRepository accountRepository;
  private final Clock clock;

  /** principal に対応する account を返す。存在しなければ profile 未割り当てで作成する。 */
  @Transactional
  public AccountRecord ensureAccount(String principalId) {
    return bindPrincipal(principalId).account();
  }

  /**
   * {@link #ensureAccount} と同じだが、この呼び出しで行を作成したかどうかも返す。
   *
   * <p>同一 principal の同時呼び出しでも行は 1 つだけ作られ、created が true になるのは 1 回だけ。
   */
  @Transactional
  public Binding bindPrincipal(String principalId) {
    if (principalId == null || principalId.isBlank()) {
      throw new IllegalArgumentException("principal_id is required");
    }
    final int inserted = accountRepository.insertIfAbsent(principalId, Instant.now(clock));
    if (inserted > 0) {
      logger.info("account created accountId={}", principalId);
    }
    final AccountRecord account =
        accountRepository
            .findByAccountId(principalId)
            .orElseThrow(() -> new IllegalStateException("ensured account is missing"));
    return new Binding(account, inserted > 0);
  }

  public record Binding(AccountRecord account, boolean created) {}
}
