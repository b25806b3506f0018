/*
 * どこで: Beacon 配信ワーカー
 * 何を: スケジュールで全チャネルの配信 pump を起動する
 * なぜ: 期限到来の PENDING target と再試行を一定間隔で拾うため
 */
package com.example.beacon.dispatch;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "beacon.delivery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DeliveryWorker {

  private final DeliveryPump deliveryPump;

  @Scheduled(fixedDelayString = "${beacon.delivery.poll-interval}")
  public void run() {
    deliveryPump.pumpAll();
  }
}
