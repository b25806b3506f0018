/*
 * どこで: Beacon ドメインモデル
 * 何を: 購読者の連絡先・関心地域・オプトイン設定
 * なぜ: fan-out がチャネルごとの配信可否を判断するため
 */
package com.example.beacon.model;

import java.util.Set;

public record Subscriber(
    String subscriberId,
    String email,
    String phone,
    Set<String> regions,
    Set<String> hazardTypes,
    boolean emailOptIn,
    boolean smsOptIn,
    Severity minimumSeverity,
    boolean active) {

  public Subscriber {
    regions = regions == null ? Set.of() : Set.copyOf(regions);
    hazardTypes = hazardTypes == null ? Set.of() : Set.copyOf(hazardTypes);
    minimumSeverity = minimumSeverity == null ? Severity.LOW : minimumSeverity;
  }

  /** hazardTypes が空の購読者は全種別を受け取る。 */
  public boolean wantsHazardType(String hazardType) {
    return hazardTypes.isEmpty() || hazardTypes.contains(hazardType);
  }

  public boolean isOptedIn(Channel channel) {
    return switch (channel) {
      case EMAIL -> emailOptIn;
      case SMS -> smsOptIn;
    };
  }

  public String destination(Channel channel) {
    return switch (channel) {
      case EMAIL -> email;
      case SMS -> phone;
    };
  }
}
