/*
 * どこで: Beacon Repository 層
 * 何を: DeliveryTarget の登録/claim/状態遷移を抽象化する
 * なぜ: 状態遷移をすべて compare-and-set で表現し、終端状態からの遷移を防ぐため
 */
package com.example.beacon.repository;

import com.example.beacon.model.Channel;
import com.example.beacon.model.DeliveryTarget;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface DeliveryTargetRepository {

  /**
   * 役割:
   * - fan-out 結果を登録する。
   *
   * 期待動作:
   * - (alert, subscriber, channel) が既存なら読み飛ばし、登録件数を返す。
   */
  int insertIfAbsent(List<DeliveryTarget> targets);

  /**
   * 役割:
   * - チャネルの配信期限到来分を claim する。
   *
   * 期待動作:
   * - PENDING で next_attempt_at 到来済みのもの、または lease 切れの IN_FLIGHT を IN_FLIGHT に更新し lease を付与して返す。
   * - 同時 claim でも同じ target を二重に返さない。
   */
  List<DeliveryTarget> claimDue(
      Channel channel, int limit, Instant now, Instant leaseUntil, String lockedBy);

  // 以下の遷移はすべて status = IN_FLIGHT かつ locked_by 一致のときだけ成立し、更新件数を返す

  int markSent(UUID targetId, Instant sentAt, String lockedBy);

  int markRetry(
      UUID targetId, int attemptCount, Instant nextAttemptAt, String lastError, String lockedBy);

  int markExhausted(UUID targetId, int attemptCount, String lastError, String lockedBy);

  int markWithdrawn(UUID targetId, String lockedBy);

  /** レート制限などで未送信のまま PENDING に戻す。attempt_count は変えない。 */
  int release(UUID targetId, Instant nextAttemptAt, String lockedBy);

  /** 取り下げられた Alert の PENDING target を WITHDRAWN にする。 */
  int withdrawPending(UUID alertId);

  List<DeliveryTarget> findByAlertId(UUID alertId);

  /** PENDING + IN_FLIGHT の件数。 */
  int countActive();

  int countStaleActive(Instant threshold);
}
