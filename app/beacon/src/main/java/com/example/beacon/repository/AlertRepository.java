/*
 * どこで: Beacon Repository 層
 * 何を: Alert 本体と重複リンク/取り下げ記録の永続化を抽象化する
 * なぜ: Alert を不変に保ちつつ監査用の付帯情報を別レコードで扱うため
 */
package com.example.beacon.repository;

import com.example.beacon.model.Alert;
import com.example.beacon.model.AlertWithdrawal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface AlertRepository {

  void insert(Alert alert);

  Optional<Alert> findById(UUID alertId);

  void recordDuplicate(UUID alertId, UUID duplicateOf, Instant recordedAt);

  Optional<UUID> findDuplicateOf(UUID alertId);

  /**
   * 役割:
   * - 取り下げを記録する。
   *
   * 期待動作:
   * - 既に記録済みなら何もせず false を返す。
   */
  boolean insertWithdrawal(AlertWithdrawal withdrawal);

  Optional<AlertWithdrawal> findWithdrawal(UUID alertId);

  default boolean isWithdrawn(UUID alertId) {
    return findWithdrawal(alertId).isPresent();
  }

  /**
   * 役割:
   * - 保持期限を過ぎ、未完了の配信が残っていない Alert を付帯レコードごと削除する。
   */
  int deleteSettledOlderThan(Instant threshold);
}
