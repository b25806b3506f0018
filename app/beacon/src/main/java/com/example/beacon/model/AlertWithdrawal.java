/*
 * どこで: Beacon ドメインモデル
 * 何を: Alert の取り下げ (誤報訂正) 記録
 * なぜ: Alert 本体を不変に保ったまま配信停止を表現するため
 */
package com.example.beacon.model;

import java.time.Instant;
import java.util.UUID;

public record AlertWithdrawal(UUID alertId, String reason, Instant withdrawnAt) {}
