/*
 * どこで: Beacon dedup 層
 * 何を: admit の判定結果 (先行者として採用 / 既存 Alert の重複) を表す
 * なぜ: パイプラインが fan-out するかどうかを値で分岐できるようにするため
 */
package com.example.beacon.dedup;

import java.util.UUID;

/** ADMITTED のとき firstAlertId は admit した Alert 自身、DUPLICATE のときは先行 Alert。 */
public record AdmitResult(Decision decision, UUID firstAlertId) {

  public enum Decision {
    ADMITTED,
    DUPLICATE
  }

  public static AdmitResult admitted(UUID alertId) {
    return new AdmitResult(Decision.ADMITTED, alertId);
  }

  public static AdmitResult duplicate(UUID firstAlertId) {
    return new AdmitResult(Decision.DUPLICATE, firstAlertId);
  }

  public boolean isAdmitted() {
    return decision == Decision.ADMITTED;
  }
}
