/*
 * どこで: Beacon Repository 層
 * 何を: dedup レコードの原子的な claim と期限切れ掃除を抽象化する
 * なぜ: 同一キーへの同時 admit で Admitted を 1 件に限定するため
 */
package com.example.beacon.repository;

import com.example.beacon.model.DedupRecord;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface DedupRecordRepository {

  /**
   * 役割:
   * - dedup キーの先行者になることを試みる。
   *
   * 期待動作:
   * - レコードが無いか期限切れなら alertId を先行者として原子的に書き込み、そのレコードを返す。
   * - 有効なレコードが存在すれば empty を返す。
   */
  Optional<DedupRecord> tryClaim(String dedupKey, UUID alertId, Instant now, Instant expiresAt);

  Optional<DedupRecord> find(String dedupKey);

  /**
   * 役割:
   * - 抑止した重複を数える。
   *
   * 期待動作:
   * - extendWindow のとき窓の終端を max(現在値, expiresAt) へ延ばす。
   */
  void registerDuplicate(String dedupKey, Instant expiresAt, boolean extendWindow);

  int deleteExpired(Instant now);
}
