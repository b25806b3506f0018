/*
 * どこで: Beacon サービス層
 * 何を: 報告 1 件を受け付けた結果 (採用/重複, 重複元, 生成 target 数) を表す
 * なぜ: HTTP と NATS の両入口で同じ結果を返すため
 */
package com.example.beacon.service;

import com.example.beacon.dedup.AdmitResult;
import java.util.UUID;

public record IntakeResult(
    UUID alertId, AdmitResult.Decision outcome, UUID duplicateOf, int targetCount) {

  public boolean isAdmitted() {
    return outcome == AdmitResult.Decision.ADMITTED;
  }
}
