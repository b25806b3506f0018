package com.example.beacon.api;

import com.example.beacon.model.Channel;
import com.example.beacon.model.DeliveryStatus;
import com.example.beacon.model.DeliveryTarget;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

/** 宛先そのものは返さない。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryTargetSummary(
    UUID targetId,
    String subscriberId,
    Channel channel,
    DeliveryStatus status,
    int attemptCount,
    Instant nextAttemptAt,
    String lastError,
    Instant sentAt) {

  public static DeliveryTargetSummary from(DeliveryTarget target) {
    return new DeliveryTargetSummary(
        target.targetId(),
        target.subscriberId(),
        target.channel(),
        target.status(),
        target.attemptCount(),
        target.nextAttemptAt(),
        target.lastError(),
        target.sentAt());
  }
}
