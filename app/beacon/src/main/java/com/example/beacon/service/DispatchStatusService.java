/*
 * どこで: Beacon サービス層
 * 何を: Alert の配信状況を組み立てる
 * なぜ: 運用者と報告元が配信の進み具合と断念を確認できるようにするため
 */
package com.example.beacon.service;

import com.example.beacon.model.Alert;
import com.example.beacon.repository.AlertRepository;
import com.example.beacon.repository.DeliveryTargetRepository;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DispatchStatusService {

  private final AlertRepository alertRepository;
  private final DeliveryTargetRepository deliveryTargetRepository;

  public AlertDispatchStatus statusOf(UUID alertId) {
    final Alert alert =
        alertRepository.findById(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
    return AlertDispatchStatus.of(
        alert,
        alertRepository.findWithdrawal(alertId).orElse(null),
        alertRepository.findDuplicateOf(alertId).orElse(null),
        deliveryTargetRepository.findByAlertId(alertId));
  }
}
