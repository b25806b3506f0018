/*
 * どこで: Beacon ドメインモデル
 * 何を: delivery_targets テーブルのスナップショット (購読者 x チャネル単位の配信義務)
 * なぜ: fan-out・dispatcher・ステータス照会で共通化するため
 */
package com.example.beacon.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

public record DeliveryTarget(
    UUID targetId,
    UUID alertId,
    String subscriberId,
    Channel channel,
    String destination,
    DeliveryStatus status,
    int attemptCount,
    Instant nextAttemptAt,
    String lockedBy,
    Instant leaseUntil,
    String lastError,
    Instant createdAt,
    Instant sentAt) {

  /** (alert, subscriber, channel) から決定的に導く ID。再 resolve しても同じ値になる。 */
  public static UUID targetIdOf(UUID alertId, String subscriberId, Channel channel) {
    final String name = alertId + "|" + subscriberId + "|" + channel.name();
    return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
  }

  public static DeliveryTarget pending(
      UUID alertId, String subscriberId, Channel channel, String destination, Instant createdAt) {
    return new DeliveryTarget(
        targetIdOf(alertId, subscriberId, channel),
        alertId,
        subscriberId,
        channel,
        destination,
        DeliveryStatus.PENDING,
        0,
        null,
        null,
        null,
        null,
        createdAt,
        null);
  }
}
