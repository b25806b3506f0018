package com.example.beacon.api;

import com.example.beacon.dedup.AdmitResult;
import com.example.beacon.service.IntakeResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AlertIntakeResponse(
    UUID alertId, AdmitResult.Decision outcome, UUID duplicateOf, int targetCount) {

  public static AlertIntakeResponse from(IntakeResult result) {
    return new AlertIntakeResponse(
        result.alertId(), result.outcome(), result.duplicateOf(), result.targetCount());
  }
}
