/*
 * どこで: Beacon ドメインモデル
 * 何を: 正規化済みハザードイベント (alerts テーブルのスナップショット)
 * なぜ: 作成後は不変とし、dedup と fan-out が同じ値を参照できるようにするため
 */
package com.example.beacon.model;

import java.time.Instant;
import java.util.UUID;

public record Alert(
    UUID alertId,
    String hazardType,
    String geographicRegion,
    Severity severity,
    Instant reportedAt,
    String dedupKey,
    String source,
    String description,
    Instant createdAt) {}
