/*
 * どこで: Beacon ドメインモデル
 * 何を: ハザード報告の深刻度を表す列挙
 * なぜ: 購読者の最低深刻度フィルタと比較できる順序付きの値にするため
 */
package com.example.beacon.model;

import java.util.Locale;
import java.util.Optional;

public enum Severity {
  LOW,
  MODERATE,
  HIGH,
  EXTREME,
  CATASTROPHIC;

  public boolean isAtLeast(Severity other) {
    return compareTo(other) >= 0;
  }

  public static Optional<Severity> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }
}
