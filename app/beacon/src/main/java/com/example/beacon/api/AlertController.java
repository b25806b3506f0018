/*
 * どこで: Beacon API
 * 何を: ハザード報告の受付/取り下げ/配信状況照会のエンドポイントを提供する
 * なぜ: 報告元と運用者向けの公開インターフェースを明確にするため
 */
package com.example.beacon.api;

import com.example.beacon.model.HazardReport;
import com.example.beacon.service.AlertPipelineService;
import com.example.beacon.service.AlertWithdrawalService;
import com.example.beacon.service.DispatchStatusService;
import com.example.beacon.service.IntakeResult;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/alerts")
@RequiredArgsConstructor
public class AlertController {

  private final AlertPipelineService alertPipelineService;
  private final AlertWithdrawalService alertWithdrawalService;
  private final DispatchStatusService dispatchStatusService;

  /** 採用なら 201、窓内の重複なら 200 を返す。 */
  @PostMapping
  public ResponseEntity<AlertIntakeResponse> submit(@RequestBody HazardReport report) {
    final IntakeResult result = alertPipelineService.submit(report);
    final HttpStatus status = result.isAdmitted() ? HttpStatus.CREATED : HttpStatus.OK;
    return ResponseEntity.status(status).body(AlertIntakeResponse.from(result));
  }

  @PostMapping("/{alert_id}/withdrawal")
  public WithdrawalResponse withdraw(
      @PathVariable("alert_id") UUID alertId,
      @Valid @RequestBody(required = false) WithdrawalRequest request) {
    final String reason = request == null ? null : request.reason();
    return WithdrawalResponse.from(alertWithdrawalService.withdraw(alertId, reason));
  }

  @GetMapping("/{alert_id}/deliveries")
  public AlertDeliveriesResponse deliveries(@PathVariable("alert_id") UUID alertId) {
    return AlertDeliveriesResponse.from(dispatchStatusService.statusOf(alertId));
  }
}
