/*
 * どこで: Beacon サービス層
 * 何を: Alert 1 件の配信状況 (取り下げ/重複元/target 一覧/状態別件数) のスナップショット
 * なぜ: 「届いた」と「諦めた」を呼び出し側が区別できるようにするため
 */
package com.example.beacon.service;

import com.example.beacon.model.Alert;
import com.example.beacon.model.AlertWithdrawal;
import com.example.beacon.model.DeliveryStatus;
import com.example.beacon.model.DeliveryTarget;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record AlertDispatchStatus(
    Alert alert,
    AlertWithdrawal withdrawal,
    UUID duplicateOf,
    List<DeliveryTarget> targets,
    Map<DeliveryStatus, Integer> counts) {

  public AlertDispatchStatus {
    targets = targets == null ? List.of() : List.copyOf(targets);
    final Map<DeliveryStatus, Integer> copy = new EnumMap<>(DeliveryStatus.class);
    for (DeliveryStatus status : DeliveryStatus.values()) {
      copy.put(status, counts == null ? 0 : counts.getOrDefault(status, 0));
    }
    counts = Map.copyOf(copy);
  }

  public static AlertDispatchStatus of(
      Alert alert, AlertWithdrawal withdrawal, UUID duplicateOf, List<DeliveryTarget> targets) {
    final Map<DeliveryStatus, Integer> counts = new EnumMap<>(DeliveryStatus.class);
    for (DeliveryTarget target : targets) {
      counts.merge(target.status(), 1, Integer::sum);
    }
    return new AlertDispatchStatus(alert, withdrawal, duplicateOf, targets, counts);
  }
}
