package com.example.beacon.api;

import com.example.beacon.model.Severity;
import com.example.beacon.model.Subscriber;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscriberResponse(
    String subscriberId,
    String email,
    String phone,
    List<String> regions,
    List<String> hazardTypes,
    boolean emailOptIn,
    boolean smsOptIn,
    Severity minimumSeverity,
    boolean active) {

  public SubscriberResponse {
    regions = regions == null ? List.of() : List.copyOf(regions);
    hazardTypes = hazardTypes == null ? List.of() : List.copyOf(hazardTypes);
  }

  public static SubscriberResponse from(Subscriber subscriber) {
    return new SubscriberResponse(
        subscriber.subscriberId(),
        subscriber.email(),
        subscriber.phone(),
        subscriber.regions().stream().sorted().toList(),
        subscriber.hazardTypes().stream().sorted().toList(),
        subscriber.emailOptIn(),
        subscriber.smsOptIn(),
        subscriber.minimumSeverity(),
        subscriber.active());
  }
}
