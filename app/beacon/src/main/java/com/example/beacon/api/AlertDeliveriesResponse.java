/*
 * どこで: Beacon API
 * 何を: Alert の配信状況レスポンスを定義する
 * なぜ: EXHAUSTED を明示し、「届いた」と「諦めた」を区別して返すため
 */
package com.example.beacon.api;

import com.example.beacon.model.Alert;
import com.example.beacon.model.AlertWithdrawal;
import com.example.beacon.model.DeliveryStatus;
import com.example.beacon.model.Severity;
import com.example.beacon.service.AlertDispatchStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AlertDeliveriesResponse(
    UUID alertId,
    String hazardType,
    String geographicRegion,
    Severity severity,
    Instant reportedAt,
    UUID duplicateOf,
    boolean withdrawn,
    Instant withdrawnAt,
    String withdrawalReason,
    Map<DeliveryStatus, Integer> counts,
    List<DeliveryTargetSummary> targets) {

  public AlertDeliveriesResponse {
    // レスポンスが内部コレクションを共有しないよう防御的にコピーする
    counts = counts == null ? Map.of() : new TreeMap<>(counts);
    targets = targets == null ? List.of() : List.copyOf(targets);
  }

  public static AlertDeliveriesResponse from(AlertDispatchStatus status) {
    final Alert alert = status.alert();
    final AlertWithdrawal withdrawal = status.withdrawal();
    return new AlertDeliveriesResponse(
        alert.alertId(),
        alert.hazardType(),
        alert.geographicRegion(),
        alert.severity(),
        alert.reportedAt(),
        status.duplicateOf(),
        withdrawal != null,
        withdrawal == null ? null : withdrawal.withdrawnAt(),
        withdrawal == null ? null : withdrawal.reason(),
        status.counts(),
        status.targets().stream().map(DeliveryTargetSummary::from).toList());
  }
}
