/*
 * どこで: Beacon アプリの設定バインド
 * 何を: 報告の正規化 (時間バケット/グリッド/許容時計ずれ/ハザード種別) 設定を保持する
 * なぜ: dedup キーの粒度を運用要件に合わせて調整するため
 */
package com.example.beacon.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "beacon.intake")
@Validated
public record BeaconIntakeProperties(
    @NotNull Duration timeBucket,
    @Positive double gridCellDegrees,
    @NotNull Duration maxClockSkew,
    List<String> allowedHazardTypes) {

  public BeaconIntakeProperties {
    allowedHazardTypes = allowedHazardTypes == null ? List.of() : List.copyOf(allowedHazardTypes);
  }

  @AssertTrue(message = "beacon.intake.time-bucket must be positive")
  public boolean isTimeBucketPositive() {
    return timeBucket != null && !timeBucket.isZero() && !timeBucket.isNegative();
  }
}
