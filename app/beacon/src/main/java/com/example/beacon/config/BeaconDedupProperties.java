/*
 * どこで: Beacon アプリの設定バインド
 * 何を: 重複抑止窓と期限切れレコード掃除の設定を保持する
 * なぜ: バースト時の抑止期間を環境ごとに調整するため
 */
package com.example.beacon.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "beacon.dedup")
@Validated
public record BeaconDedupProperties(
    @NotNull Duration window, boolean sliding, boolean sweepEnabled, Duration sweepInterval) {

  @AssertTrue(message = "beacon.dedup.window must be positive")
  public boolean isWindowPositive() {
    // Duration には @Positive が使えないため、ゼロ/負値を明示的に弾く。
    return window != null && !window.isZero() && !window.isNegative();
  }
}
