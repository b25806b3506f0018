/*
 * どこで: Beacon 配信層
 * 何を: チャネルごとに期限到来の target を claim し、レート上限を確認してから送信プールへ流す
 * なぜ: 送信 IO を DB トランザクションやスケジューラスレッドに載せず、背圧を PENDING の滞留で表すため
 */
package com.example.beacon.dispatch;

import com.example.beacon.config.BeaconDeliveryProperties;
import com.example.beacon.model.Channel;
import com.example.beacon.model.DeliveryTarget;
import com.example.beacon.repository.DeliveryTargetRepository;
import com.example.beacon.service.BeaconMetrics;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class DeliveryPump {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryPump.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final DeliveryTargetRepository deliveryTargetRepository;
  private final DeliveryDispatcher dispatcher;
  private final ChannelDispatchPool dispatchPool;
  private final ChannelRateLimiters rateLimiters;
  private final BeaconDeliveryProperties properties;
  private final BeaconMetrics metrics;
  private final Clock clock;
  private final String workerId;

  public DeliveryPump(
      DeliveryTargetRepository deliveryTargetRepository,
      DeliveryDispatcher dispatcher,
      ChannelDispatchPool dispatchPool,
      ChannelRateLimiters rateLimiters,
      BeaconDeliveryProperties properties,
      BeaconMetrics metrics,
      Clock clock) {
    this.deliveryTargetRepository = deliveryTargetRepository;
    this.dispatcher = dispatcher;
    this.dispatchPool = dispatchPool;
    this.rateLimiters = rateLimiters;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.workerId = resolveWorkerId();
  }

  public void pumpAll() {
    for (Channel channel : Channel.values()) {
      try {
        pumpChannel(channel);
      } catch (DataAccessException ex) {
        // 1 チャネルの claim 失敗で他チャネルを止めない
        logger.error("delivery claim failed channel={}", channel, ex);
      }
    }
    try {
      metrics.updateBacklogCurrent(deliveryTargetRepository.countActive());
    } catch (DataAccessException ex) {
      logger.warn("delivery backlog count failed", ex);
    }
  }

  /**
   * 役割:
   * - 1 チャネル分の claim と投入を行い、プールへ投入した件数を返す。
   *
   * 期待動作:
   * - プールの空き枠を超えて claim しない。空きが無ければ何もしない。
   */
  public int pumpChannel(Channel channel) {
    final int free = dispatchPool.freeSlots(channel);
    if (free <= 0) {
      logger.debug("dispatch pool saturated channel={}", channel);
      return 0;
    }
    final Instant now = Instant.now(clock);
    // claim ごとに lockedBy を変え、lease 切れで拾い直された target の古い結果を CAS で弾く
    final String lockedBy = workerId + "#" + UUID.randomUUID();
    final List<DeliveryTarget> claimed =
        deliveryTargetRepository.claimDue(
            channel,
            Math.min(properties.batchSize(), free),
            now,
            now.plus(properties.lease()),
            lockedBy);
    int submitted = 0;
    for (DeliveryTarget target : claimed) {
      try {
        dispatchPool.submit(channel, () -> runTask(target, lockedBy));
        submitted++;
      } catch (RejectedExecutionException ex) {
        logger.warn(
            "dispatch pool rejected target targetId={} channel={}", target.targetId(), channel);
        requeue(target, lockedBy);
      }
    }
    if (!claimed.isEmpty()) {
      logger.debug(
          "delivery targets claimed channel={} claimed={} submitted={}",
          channel,
          claimed.size(),
          submitted);
    }
    return submitted;
  }

  @VisibleForTesting
  void runTask(DeliveryTarget target, String lockedBy) {
    try {
      final Instant now = Instant.now(clock);
      if (target.leaseUntil() != null && !target.leaseUntil().isAfter(now)) {
        // 待機中に lease が切れた。別ワーカーが拾い直すので送らない
        logger.warn("delivery lease expired before send targetId={}", target.targetId());
        return;
      }
      if (!rateLimiters.tryAcquire(target.channel())) {
        metrics.recordRateLimited(target.channel());
        requeue(target, lockedBy);
        return;
      }
      dispatcher.dispatch(target, lockedBy);
    } catch (RuntimeException ex) {
      // 1 件の失敗でワーカースレッドを落とさない。lease 切れ後に再 claim される
      logger.error(
          "delivery task failed targetId={} channel={}", target.targetId(), target.channel(), ex);
    }
  }

  private void requeue(DeliveryTarget target, String lockedBy) {
    final Instant nextAttemptAt = Instant.now(clock).plus(properties.rateLimitRequeueDelay());
    final int updated =
        deliveryTargetRepository.release(target.targetId(), nextAttemptAt, lockedBy);
    if (updated == 0) {
      logger.warn(
          "delivery requeue skipped because lock was lost targetId={}", target.targetId());
    }
  }

  @VisibleForTesting
  String workerId() {
    return workerId;
  }

  private static String resolveWorkerId() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
