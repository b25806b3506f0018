/*
 * どこで: Beacon ドメインモデル
 * 何を: dedup_records テーブルのスナップショット
 * なぜ: 同一ハザードの重複報告を窓の間だけ抑止するため
 */
package com.example.beacon.model;

import java.time.Instant;
import java.util.UUID;

public record DedupRecord(
    String dedupKey,
    UUID firstAlertId,
    Instant windowExpiresAt,
    int duplicateCount,
    Instant createdAt) {

  public boolean isLive(Instant now) {
    return windowExpiresAt.isAfter(now);
  }
}
