/*
 * どこで: Beacon サービス層
 * 何を: Alert の取り下げを記録し、未送信の target を止める
 * なぜ: 誤報訂正後に新たな通知が出ないようにするため (送信済みは回収しない)
 */
package com.example.beacon.service;

import com.example.beacon.model.AlertWithdrawal;
import com.example.beacon.repository.AlertRepository;
import com.example.beacon.repository.DeliveryTargetRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AlertWithdrawalService {

  private static final Logger logger = LoggerFactory.getLogger(AlertWithdrawalService.class);

  private final AlertRepository alertRepository;
  private final DeliveryTargetRepository deliveryTargetRepository;
  private final Clock clock;

  /**
   * 役割:
   * - Alert を取り下げる。
   *
   * 期待動作:
   * - 取り下げ記録は初回だけ残し、2 回目以降は初回の時刻を返す。
   * - PENDING の target は WITHDRAWN にし、IN_FLIGHT の target は dispatcher が送信後に判定する。
   * - 未知の alertId は AlertNotFoundException を送出する。
   */
  @Transactional
  public WithdrawalResult withdraw(UUID alertId, String reason) {
    if (alertRepository.findById(alertId).isEmpty()) {
      throw new AlertNotFoundException(alertId);
    }
    final AlertWithdrawal requested = new AlertWithdrawal(alertId, reason, Instant.now(clock));
    final boolean recorded = alertRepository.insertWithdrawal(requested);
    final AlertWithdrawal withdrawal =
        recorded ? requested : alertRepository.findWithdrawal(alertId).orElse(requested);
    final int withdrawnTargets = deliveryTargetRepository.withdrawPending(alertId);
    logger.info(
        "alert withdrawn alertId={} firstRequest={} withdrawnTargets={}",
        alertId,
        recorded,
        withdrawnTargets);
    return new WithdrawalResult(alertId, withdrawal.withdrawnAt(), withdrawnTargets);
  }
}
