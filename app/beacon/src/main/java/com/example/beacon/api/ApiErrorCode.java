/*
 * どこで: Beacon API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.beacon.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  INVALID_REPORT,
  ALERT_NOT_FOUND,
  SUBSCRIBER_NOT_FOUND,
  DIRECTORY_UNAVAILABLE
}
