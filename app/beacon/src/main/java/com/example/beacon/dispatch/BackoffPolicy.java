/*
 * どこで: Beacon 配信層
 * 何を: 一時失敗後の再試行までの待ち時間を計算する
 * なぜ: 指数バックオフ + ジッタで、障害中のプロバイダへ再送が集中しないようにするため
 */
package com.example.beacon.dispatch;

import com.example.beacon.config.BeaconDeliveryProperties;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BackoffPolicy {

  private final BeaconDeliveryProperties properties;

  /** attempt は 1 始まりの失敗回数。 */
  public Duration delayFor(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp =
        baseMillis * Math.pow(properties.backoffExponentBase(), Math.max(attempt - 1, 0));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    final long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }
}
