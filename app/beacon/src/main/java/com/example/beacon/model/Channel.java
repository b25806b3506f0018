/*
 * どこで: Beacon ドメインモデル
 * 何を: 通知チャネル (email / SMS) を表す列挙
 * なぜ: チャネルごとのキュー・レート制限・アダプタを引き当てるキーにするため
 */
package com.example.beacon.model;

public enum Channel {
  EMAIL,
  SMS
}
