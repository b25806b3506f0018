/*
 * どこで: Beacon ドメインモデル
 * 何を: 正規化前のハザード報告 (HTTP / NATS 共通の入力)
 * なぜ: 入口ごとの形式差を Event Intake の手前で吸収するため
 */
package com.example.beacon.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HazardReport(
    String hazardType,
    String region,
    Double latitude,
    Double longitude,
    String severity,
    String reportedAt,
    String source,
    String description) {}
