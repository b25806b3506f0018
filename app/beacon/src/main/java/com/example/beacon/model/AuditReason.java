/*
 * どこで: Beacon ドメインモデル
 * 何を: EXHAUSTED に至った理由
 * なぜ: 恒久失敗とリトライ上限到達を監査で区別するため
 */
package com.example.beacon.model;

public enum AuditReason {
  PERMANENT_FAILURE,
  RETRIES_EXHAUSTED
}
