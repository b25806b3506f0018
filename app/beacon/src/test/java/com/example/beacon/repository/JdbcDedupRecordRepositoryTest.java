package com.example.beacon.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.beacon.AbstractPostgresContainerTest;
import com.example.beacon.dedup.AdmitResult;
import com.example.beacon.dedup.Deduplicator;
import com.example.beacon.model.Alert;
import com.example.beacon.model.DedupRecord;
import com.example.beacon.model.Severity;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class JdbcDedupRecordRepositoryTest extends AbstractPostgresContainerTest {

  private static final String KEY = "0123456789abcdef";

  @Autowired private DedupRecordRepository dedupRecordRepository;
  @Autowired private Deduplicator deduplicator;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private Instant now;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM dedup_records", new MapSqlParameterSource());
    now = Instant.now().truncatedTo(ChronoUnit.MICROS);
  }

  @Test
  void firstClaimWinsUntilWindowExpires() {
    final UUID first = UUID.randomUUID();
    final Instant expiresAt = now.plus(Duration.ofMinutes(30));

    assertThat(dedupRecordRepository.tryClaim(KEY, first, now, expiresAt))
        .get()
        .extracting(DedupRecord::firstAlertId)
        .isEqualTo(first);
    assertThat(dedupRecordRepository.tryClaim(KEY, UUID.randomUUID(), now, expiresAt)).isEmpty();
    assertThat(dedupRecordRepository.find(KEY).orElseThrow().windowExpiresAt())
        .isEqualTo(expiresAt);
  }

  @Test
  void expiredRecordIsOverwrittenByNextClaim() {
    dedupRecordRepository.tryClaim(KEY, UUID.randomUUID(), now, now.plusSeconds(60));
    dedupRecordRepository.registerDuplicate(KEY, now.plusSeconds(60), false);

    final UUID next = UUID.randomUUID();
    final Instant later = now.plusSeconds(60);
    final DedupRecord record =
        dedupRecordRepository.tryClaim(KEY, next, later, later.plusSeconds(60)).orElseThrow();

    assertThat(record.firstAlertId()).isEqualTo(next);
    assertThat(record.duplicateCount()).isZero();
    assertThat(record.windowExpiresAt()).isEqualTo(later.plusSeconds(60));
  }

  @Test
  void registerDuplicateCountsAndOptionallyExtendsWindow() {
    dedupRecordRepository.tryClaim(KEY, UUID.randomUUID(), now, now.plusSeconds(60));

    dedupRecordRepository.registerDuplicate(KEY, now.plusSeconds(90), false);
    assertThat(dedupRecordRepository.find(KEY).orElseThrow().windowExpiresAt())
        .isEqualTo(now.plusSeconds(60));

    dedupRecordRepository.registerDuplicate(KEY, now.plusSeconds(90), true);
    // 窓は縮まない
    dedupRecordRepository.registerDuplicate(KEY, now.plusSeconds(30), true);

    final DedupRecord record = dedupRecordRepository.find(KEY).orElseThrow();
    assertThat(record.duplicateCount()).isEqualTo(3);
    assertThat(record.windowExpiresAt()).isEqualTo(now.plusSeconds(90));
  }

  @Test
  void deleteExpiredRemovesOnlyClosedWindows() {
    dedupRecordRepository.tryClaim("expired-key", UUID.randomUUID(), now, now.minusSeconds(1));
    dedupRecordRepository.tryClaim(KEY, UUID.randomUUID(), now, now.plusSeconds(60));

    assertThat(dedupRecordRepository.deleteExpired(now)).isEqualTo(1);
    assertThat(dedupRecordRepository.find("expired-key")).isEmpty();
    assertThat(dedupRecordRepository.find(KEY)).isPresent();
  }

  @Test
  void concurrentAdmitsOfSameKeyAdmitExactlyOne() throws Exception {
    final int callers = 8;
    final CountDownLatch start = new CountDownLatch(1);
    final ExecutorService executor = Executors.newFixedThreadPool(callers);
    try {
      final List<Callable<AdmitResult>> admits = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        final Alert alert = alert(UUID.randomUUID());
        admits.add(
            () -> {
              start.await();
              return deduplicator.admit(alert);
            });
      }
      final List<Future<AdmitResult>> futures = new ArrayList<>();
      for (Callable<AdmitResult> admit : admits) {
        futures.add(executor.submit(admit));
      }
      start.countDown();

      int admitted = 0;
      UUID winner = null;
      final List<AdmitResult> results = new ArrayList<>();
      for (Future<AdmitResult> future : futures) {
        final AdmitResult result = future.get();
        results.add(result);
        if (result.isAdmitted()) {
          admitted++;
          winner = result.firstAlertId();
        }
      }
      assertThat(admitted).isEqualTo(1);
      assertThat(results).extracting(AdmitResult::firstAlertId).containsOnly(winner);
      assertThat(dedupRecordRepository.find(KEY).orElseThrow().duplicateCount())
          .isEqualTo(callers - 1);
    } finally {
      executor.shutdownNow();
    }
  }

  private Alert alert(UUID alertId) {
    return new Alert(
        alertId, "bushfire", "R1", Severity.HIGH, now, KEY, "rfs-feed", null, now);
  }
}
