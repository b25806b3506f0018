package com.example.beacon.api;

import com.example.beacon.service.WithdrawalResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WithdrawalResponse(UUID alertId, Instant withdrawnAt, int withdrawnTargets) {

  public static WithdrawalResponse from(WithdrawalResult result) {
    return new WithdrawalResponse(
        result.alertId(), result.withdrawnAt(), result.withdrawnTargets());
  }
}
