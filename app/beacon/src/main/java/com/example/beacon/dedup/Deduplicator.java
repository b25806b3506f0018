/*
 * どこで: Beacon dedup 層
 * 何を: dedup キーごとに窓内の最初の Alert だけを admit し、以降を重複として抑止する
 * なぜ: 同一事象の報告バーストで購読者へ通知が殺到しないようにするため
 */
package com.example.beacon.dedup;

import com.example.beacon.config.BeaconDedupProperties;
import com.example.beacon.config.BeaconIntakeProperties;
import com.example.beacon.intake.DedupKeys;
import com.example.beacon.model.Alert;
import com.example.beacon.model.DedupRecord;
import com.example.beacon.repository.DedupRecordRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class Deduplicator {

  private static final Logger logger = LoggerFactory.getLogger(Deduplicator.class);
  private static final int MAX_CLAIM_ATTEMPTS = 3;

  private final DedupRecordRepository dedupRecordRepository;
  private final BeaconDedupProperties properties;
  private final BeaconIntakeProperties intakeProperties;
  private final Clock clock;

  /**
   * 役割:
   * - Alert を admit するか重複として抑止するかを決める。
   *
   * 期待動作:
   * - 隣接する時間バケットに有効なレコードがあれば、その先行者の重複とする (バケット境界をまたぐ連続報告)。
   * - 同一キーの claim は 1 文の原子操作なので、同時呼び出しでも ADMITTED は 1 件だけ。
   * - 重複時は抑止件数を加算し、sliding 設定なら窓を延ばす。
   */
  public AdmitResult admit(Alert alert) {
    final List<String> adjacentKeys =
        DedupKeys.adjacentDedupKeys(
            alert.hazardType(),
            alert.geographicRegion(),
            alert.reportedAt(),
            intakeProperties.timeBucket());
    for (int attempt = 1; attempt <= MAX_CLAIM_ATTEMPTS; attempt++) {
      final Instant now = Instant.now(clock);
      final Instant expiresAt = now.plus(properties.window());
      final Optional<DedupRecord> adjacent = findLive(adjacentKeys, now);
      if (adjacent.isPresent()) {
        return suppress(alert, adjacent.get(), expiresAt);
      }
      final Optional<DedupRecord> claimed =
          dedupRecordRepository.tryClaim(alert.dedupKey(), alert.alertId(), now, expiresAt);
      if (claimed.isPresent()) {
        logger.info(
            "alert admitted alertId={} dedupKey={} windowExpiresAt={}",
            alert.alertId(),
            alert.dedupKey(),
            expiresAt);
        return AdmitResult.admitted(alert.alertId());
      }
      final Optional<DedupRecord> existing = dedupRecordRepository.find(alert.dedupKey());
      if (existing.isPresent() && existing.get().isLive(now)) {
        return suppress(alert, existing.get(), expiresAt);
      }
      // claim と参照の間で期限切れ/掃除が挟まった。もう一度 claim から判定し直す
      logger.debug(
          "dedup record changed during admit dedupKey={} attempt={}", alert.dedupKey(), attempt);
    }
    throw new IllegalStateException("dedup admit did not converge for key " + alert.dedupKey());
  }

  public int sweepExpired() {
    final int deleted = dedupRecordRepository.deleteExpired(Instant.now(clock));
    if (deleted > 0) {
      logger.info("expired dedup records removed count={}", deleted);
    }
    return deleted;
  }

  private Optional<DedupRecord> findLive(List<String> dedupKeys, Instant now) {
    for (String dedupKey : dedupKeys) {
      final Optional<DedupRecord> record = dedupRecordRepository.find(dedupKey);
      if (record.isPresent() && record.get().isLive(now)) {
        return record;
      }
    }
    return Optional.empty();
  }

  private AdmitResult suppress(Alert alert, DedupRecord record, Instant expiresAt) {
    dedupRecordRepository.registerDuplicate(record.dedupKey(), expiresAt, properties.sliding());
    logger.info(
        "alert suppressed as duplicate alertId={} duplicateOf={} dedupKey={}",
        alert.alertId(),
        record.firstAlertId(),
        record.dedupKey());
    return AdmitResult.duplicate(record.firstAlertId());
  }
}
