package com.nomen.profile.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.nomen.profile.AbstractPostgresContainerTest;
import com.nomen.profile.model.MergeRequestRecord;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class MergeRequestRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T00:00:00Z");

  @Autowired private MergeRequestRepository mergeRequestRepository;
  @Autowired private AccountRepository accountRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    final MapSqlParameterSource none = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM merge_requests", none);
    jdbcTemplate.update("DELETE FROM accounts", none);
    jdbcTemplate.update("DELETE FROM profiles", none);
    accountRepository.insertIfAbsent("account-a", BASE_TIME);
  }

  @Test
  void consumeReturnsRowOnlyOnce() {
    mergeRequestRepository.insert(request("mr-1", "token-1", BASE_TIME.plusSeconds(600)));

    assertThat(mergeRequestRepository.consumeByToken("token-1"))
        .get()
        .satisfies(consumed -> assertThat(consumed.requesterAccountId()).isEqualTo("account-a"));
    assertThat(mergeRequestRepository.consumeByToken("token-1")).isEmpty();
  }

  @Test
  void findByTokenStillReturnsExpiredRows() {
    mergeRequestRepository.insert(request("mr-1", "token-1", BASE_TIME));

    assertThat(mergeRequestRepository.findByToken("token-1"))
        .get()
        .satisfies(found -> assertThat(found.isExpiredAt(BASE_TIME)).isTrue());
  }

  @Test
  void deleteExpiredKeepsLiveRequests() {
    mergeRequestRepository.insert(request("mr-old", "token-old", BASE_TIME.minusSeconds(1)));
    mergeRequestRepository.insert(request("mr-live", "token-live", BASE_TIME.plusSeconds(600)));

    assertThat(mergeRequestRepository.deleteExpired(BASE_TIME)).isEqualTo(1);
    assertThat(mergeRequestRepository.findByToken("token-old")).isEmpty();
    assertThat(mergeRequestRepository.findByToken("token-live")).isPresent();
  }

  @Test
  void requesterDeletionCascadesToRequests() {
    mergeRequestRepository.insert(request("mr-1", "token-1", BASE_TIME.plusSeconds(600)));

    accountRepository.delete("account-a");

    assertThat(mergeRequestRepository.findByToken("token-1")).isEmpty();
  }

  private MergeRequestRecord request(String id, String token, Instant expiresAt) {
    return new MergeRequestRecord(id, "account-a", token, BASE_TIME.minusSeconds(60), expiresAt);
  }
}
