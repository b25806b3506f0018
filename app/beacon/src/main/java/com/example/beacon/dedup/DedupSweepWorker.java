/*
 * どこで: Beacon dedup ワーカー
 * 何を: 期限切れの dedup レコードを定期的に削除する
 * なぜ: 窓を過ぎたキーがテーブルに溜まり続けないようにするため
 */
package com.example.beacon.dedup;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "beacon.dedup.sweep-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DedupSweepWorker {

  private final Deduplicator deduplicator;

  @Scheduled(fixedDelayString = "${beacon.dedup.sweep-interval}")
  public void run() {
    deduplicator.sweepExpired();
  }
}
