/*
 * どこで: Beacon ドメインモデル
 * 何を: DeliveryTarget の状態を表す列挙
 * なぜ: DB と dispatcher の状態機械を一致させるため
 */
package com.example.beacon.model;

public enum DeliveryStatus {
  PENDING,
  IN_FLIGHT,
  SENT,
  EXHAUSTED,
  WITHDRAWN;

  public boolean isTerminal() {
    return this == SENT || this == EXHAUSTED || this == WITHDRAWN;
  }
}
