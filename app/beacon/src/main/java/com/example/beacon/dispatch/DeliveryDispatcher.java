/*
 * どこで: Beacon 配信層
 * 何を: claim 済みの配信 target を 1 回送信し、結果に応じて SENT/再試行/EXHAUSTED/WITHDRAWN へ遷移させる
 * なぜ: 一時失敗だけを再試行し、恒久失敗とリトライ上限到達を監査へ隔離するため
 */
package com.example.beacon.dispatch;

import com.example.beacon.channel.AlertMessage;
import com.example.beacon.channel.AlertMessageFormatter;
import com.example.beacon.channel.ChannelAdapterRegistry;
import com.example.beacon.channel.SendResult;
import com.example.beacon.config.BeaconDeliveryProperties;
import com.example.beacon.model.Alert;
import com.example.beacon.model.AuditReason;
import com.example.beacon.model.DeliveryTarget;
import com.example.beacon.repository.AlertRepository;
import com.example.beacon.repository.DeliveryAuditRepository;
import com.example.beacon.repository.DeliveryTargetRepository;
import com.example.beacon.service.BeaconMetrics;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class DeliveryDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryDispatcher.class);

  private final DeliveryTargetRepository deliveryTargetRepository;
  private final DeliveryAuditRepository deliveryAuditRepository;
  private final AlertRepository alertRepository;
  private final ChannelAdapterRegistry channelAdapterRegistry;
  private final AlertMessageFormatter messageFormatter;
  private final BackoffPolicy backoffPolicy;
  private final BeaconDeliveryProperties properties;
  private final BeaconMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * 役割:
   * - lockedBy が claim した target を 1 回だけ送信する。
   *
   * 期待動作:
   * - 遷移はすべて IN_FLIGHT かつ lockedBy 一致の CAS で行う。
   * - lease を失っていれば状態を変えずに LOCK_LOST を返す。
   * - 例外は投げず、1 件の失敗で兄弟 target を止めない。
   */
  public DispatchOutcome dispatch(DeliveryTarget target, String lockedBy) {
    if (target.status().isTerminal()) {
      // 終端状態は二度と遷移させない
      logger.warn(
          "terminal delivery target handed to dispatcher targetId={} status={}",
          target.targetId(),
          target.status());
      return DispatchOutcome.lockLost();
    }
    final Optional<Alert> alert = alertRepository.findById(target.alertId());
    if (alert.isEmpty() || alertRepository.isWithdrawn(target.alertId())) {
      return withdraw(target, lockedBy);
    }
    final AlertMessage message = messageFormatter.format(alert.get(), target.channel());
    final SendResult result = send(target, message);
    final Instant now = Instant.now(clock);
    return switch (result.kind()) {
      case OK -> markSent(target, alert.get(), now, lockedBy);
      case PERMANENT_ERROR ->
          exhaust(target, AuditReason.PERMANENT_FAILURE, result.detail(), now, lockedBy);
      case TRANSIENT_ERROR -> handleTransientFailure(target, result.detail(), now, lockedBy);
    };
  }

  private SendResult send(DeliveryTarget target, AlertMessage message) {
    try {
      return channelAdapterRegistry
          .adapter(target.channel())
          .send(target.destination(), message);
    } catch (RuntimeException ex) {
      // アダプタの想定外例外は経路障害とみなし再試行対象にする
      logger.warn(
          "channel adapter threw targetId={} channel={}", target.targetId(), target.channel(), ex);
      return SendResult.transientError(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }

  private DispatchOutcome markSent(
      DeliveryTarget target, Alert alert, Instant now, String lockedBy) {
    final int updated = deliveryTargetRepository.markSent(target.targetId(), now, lockedBy);
    if (updated == 0) {
      // 送信は済んだが lease を失った。別ワーカーの再送があり得るので記録だけ残す
      logger.warn(
          "delivery sent but lock was lost targetId={} alertId={}",
          target.targetId(),
          target.alertId());
      metrics.recordDelivery(target.channel(), "lock_lost");
      return DispatchOutcome.lockLost();
    }
    logger.info(
        "delivery sent targetId={} alertId={} channel={} failedAttempts={}",
        target.targetId(),
        target.alertId(),
        target.channel(),
        target.attemptCount());
    metrics.recordDelivery(target.channel(), "sent");
    metrics.recordDeliveryE2eDelay(alert.reportedAt(), now);
    return DispatchOutcome.sent();
  }

  private DispatchOutcome handleTransientFailure(
      DeliveryTarget target, String detail, Instant now, String lockedBy) {
    if (alertRepository.isWithdrawn(target.alertId())) {
      return withdraw(target, lockedBy);
    }
    final int nextAttempt = target.attemptCount() + 1;
    if (nextAttempt > properties.maxRetries()) {
      return exhaust(target, AuditReason.RETRIES_EXHAUSTED, detail, now, lockedBy);
    }
    final Duration backoff = backoffPolicy.delayFor(nextAttempt);
    final Instant retryAt = now.plus(backoff);
    final int updated =
        deliveryTargetRepository.markRetry(
            target.targetId(), nextAttempt, retryAt, truncateError(detail), lockedBy);
    if (updated == 0) {
      logger.warn(
          "delivery retry skipped because lock was lost targetId={} attempt={}",
          target.targetId(),
          nextAttempt);
      metrics.recordDelivery(target.channel(), "lock_lost");
      return DispatchOutcome.lockLost();
    }
    logger.warn(
        "delivery retry scheduled targetId={} channel={} attempt={} retryAt={} reason={}",
        target.targetId(),
        target.channel(),
        nextAttempt,
        retryAt,
        detail);
    metrics.recordDelivery(target.channel(), "retry");
    return DispatchOutcome.retry(retryAt);
  }

  private DispatchOutcome exhaust(
      DeliveryTarget target, AuditReason reason, String detail, Instant now, String lockedBy) {
    final int attempts = target.attemptCount() + 1;
    final String error = truncateError(detail);
    // 監査登録と EXHAUSTED 更新を同一トランザクションにまとめ、ロック喪失時の不整合を避ける
    final Boolean moved =
        transactionTemplate()
            .execute(
                status -> {
                  final int count =
                      deliveryTargetRepository.markExhausted(
                          target.targetId(), attempts, error, lockedBy);
                  if (count == 0) {
                    status.setRollbackOnly();
                    return false;
                  }
                  deliveryAuditRepository.insert(UUID.randomUUID(), target, reason, error, now);
                  return true;
                });
    if (!Boolean.TRUE.equals(moved)) {
      logger.warn(
          "delivery exhaustion skipped because lock was lost targetId={}", target.targetId());
      metrics.recordDelivery(target.channel(), "lock_lost");
      return DispatchOutcome.lockLost();
    }
    logger.error(
        "delivery exhausted targetId={} alertId={} channel={} reason={} attempts={} error={}",
        target.targetId(),
        target.alertId(),
        target.channel(),
        reason,
        attempts,
        error);
    metrics.recordDelivery(target.channel(), "exhausted");
    metrics.recordExhausted(target.channel(), reason);
    return DispatchOutcome.exhausted();
  }

  @VisibleForTesting
  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }

  private DispatchOutcome withdraw(DeliveryTarget target, String lockedBy) {
    final int updated = deliveryTargetRepository.markWithdrawn(target.targetId(), lockedBy);
    if (updated == 0) {
      logger.warn(
          "delivery withdrawal skipped because lock was lost targetId={}", target.targetId());
      metrics.recordDelivery(target.channel(), "lock_lost");
      return DispatchOutcome.lockLost();
    }
    logger.info(
        "delivery withdrawn targetId={} alertId={} channel={}",
        target.targetId(),
        target.alertId(),
        target.channel());
    metrics.recordDelivery(target.channel(), "withdrawn");
    return DispatchOutcome.withdrawn();
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
