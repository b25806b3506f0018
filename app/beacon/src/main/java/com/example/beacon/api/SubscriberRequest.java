package com.example.beacon.api;

import com.example.beacon.model.Severity;
import com.example.beacon.model.Subscriber;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotEmpty;
import java.util.Set;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscriberRequest(
    String email,
    String phone,
    @NotEmpty(message = "regions is required") Set<String> regions,
    Set<String> hazardTypes,
    boolean emailOptIn,
    boolean smsOptIn,
    Severity minimumSeverity,
    Boolean active) {

  public SubscriberRequest {
    regions = regions == null ? Set.of() : Set.copyOf(regions);
    hazardTypes = hazardTypes == null ? Set.of() : Set.copyOf(hazardTypes);
  }

  public Subscriber toSubscriber(String subscriberId) {
    return new Subscriber(
        subscriberId,
        email,
        phone,
        regions,
        hazardTypes,
        emailOptIn,
        smsOptIn,
        minimumSeverity,
        active == null || active);
  }
}
