/*
 * どこで: Beacon サービス層
 * 何を: 報告の正規化 → Alert 保存 → dedup 判定 → fan-out → target 登録を 1 トランザクションで行う
 * なぜ: ディレクトリ障害時に dedup claim ごと巻き戻し、再送を重複扱いにしないため
 */
package com.example.beacon.service;

import com.example.beacon.dedup.AdmitResult;
import com.example.beacon.dedup.Deduplicator;
import com.example.beacon.fanout.FanOutResolver;
import com.example.beacon.intake.EventIntake;
import com.example.beacon.intake.InvalidReportException;
import com.example.beacon.model.Alert;
import com.example.beacon.model.DeliveryTarget;
import com.example.beacon.model.HazardReport;
import com.example.beacon.repository.AlertRepository;
import com.example.beacon.repository.DeliveryTargetRepository;
import com.example.beacon.repository.DirectoryUnavailableException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AlertPipelineService {

  private static final Logger logger = LoggerFactory.getLogger(AlertPipelineService.class);

  private final EventIntake eventIntake;
  private final Deduplicator deduplicator;
  private final FanOutResolver fanOutResolver;
  private final AlertRepository alertRepository;
  private final DeliveryTargetRepository deliveryTargetRepository;
  private final BeaconMetrics metrics;

  @Transactional
  public IntakeResult submit(HazardReport report) {
    final Alert alert;
    try {
      alert = eventIntake.normalize(report);
    } catch (InvalidReportException ex) {
      metrics.recordIntake("invalid");
      logger.warn("hazard report rejected field={} reason={}", ex.field(), ex.getMessage());
      throw ex;
    }
    alertRepository.insert(alert);
    final AdmitResult admitResult = deduplicator.admit(alert);
    if (!admitResult.isAdmitted()) {
      alertRepository.recordDuplicate(
          alert.alertId(), admitResult.firstAlertId(), alert.createdAt());
      metrics.recordIntake("duplicate");
      return new IntakeResult(
          alert.alertId(), AdmitResult.Decision.DUPLICATE, admitResult.firstAlertId(), 0);
    }
    final List<DeliveryTarget> targets;
    try {
      targets = fanOutResolver.resolve(alert);
    } catch (DirectoryUnavailableException ex) {
      metrics.recordIntake("directory_unavailable");
      logger.error(
          "fan-out aborted alertId={} region={}", alert.alertId(), alert.geographicRegion(), ex);
      throw ex;
    }
    final int inserted = deliveryTargetRepository.insertIfAbsent(targets);
    metrics.recordIntake("admitted");
    logger.info(
        "alert accepted alertId={} hazardType={} region={} severity={} targets={}",
        alert.alertId(),
        alert.hazardType(),
        alert.geographicRegion(),
        alert.severity(),
        inserted);
    return new IntakeResult(alert.alertId(), AdmitResult.Decision.ADMITTED, null, inserted);
  }
}
