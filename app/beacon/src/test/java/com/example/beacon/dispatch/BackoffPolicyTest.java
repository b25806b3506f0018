package com.example.beacon.dispatch;

import static com.example.beacon.support.BeaconFixtures.DELIVERY_PROPERTIES;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.beacon.config.BeaconDeliveryProperties;
import java.time.Duration;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

  private final BackoffPolicy policy = new BackoffPolicy(DELIVERY_PROPERTIES);

  @RepeatedTest(20)
  void delayGrowsExponentiallyWithinJitterRange() {
    // base=1s, exp=2.0, jitter=[0.5, 1.5]
    assertThat(policy.delayFor(1)).isBetween(Duration.ofSeconds(1), Duration.ofMillis(1500));
    assertThat(policy.delayFor(3)).isBetween(Duration.ofSeconds(2), Duration.ofSeconds(6));
    assertThat(policy.delayFor(5)).isBetween(Duration.ofSeconds(8), Duration.ofSeconds(24));
  }

  @RepeatedTest(20)
  void delayIsCappedBeforeJitter() {
    // 2^19 秒は上限 60s で頭打ちになり、ジッタ分だけ揺れる
    assertThat(policy.delayFor(20)).isBetween(Duration.ofSeconds(30), Duration.ofSeconds(90));
  }

  @Test
  void delayNeverFallsBelowMinimum() {
    final BeaconDeliveryProperties properties =
        new BeaconDeliveryProperties(
            true,
            Duration.ofSeconds(1),
            50,
            5,
            Duration.ofMillis(100),
            Duration.ofSeconds(60),
            2.0d,
            0.5d,
            0.5d,
            Duration.ofSeconds(1),
            Duration.ofSeconds(2),
            1000,
            Duration.ofSeconds(30));

    assertThat(new BackoffPolicy(properties).delayFor(1)).isEqualTo(Duration.ofSeconds(1));
  }
}
