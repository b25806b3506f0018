/*
 * どこで: Beacon 設定バインドのテスト
 * 何を: 配信/チャネル/dedup/保持期間の設定が Duration や入れ子構造へ正しくバインドされることを検証する
 * なぜ: 設定の表記ゆれで起動後に挙動が変わらないことを保証するため
 */
package com.example.beacon.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.beacon.model.Channel;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class BeaconPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "beacon.delivery.enabled=true",
              "beacon.delivery.poll-interval=500ms",
              "beacon.delivery.batch-size=50",
              "beacon.delivery.max-retries=5",
              "beacon.delivery.backoff-base=1s",
              "beacon.delivery.backoff-max=60s",
              "beacon.delivery.backoff-exponent-base=2.0",
              "beacon.delivery.backoff-jitter-min=0.5",
              "beacon.delivery.backoff-jitter-max=1.5",
              "beacon.delivery.backoff-min=1s",
              "beacon.delivery.rate-limit-requeue-delay=2s",
              "beacon.delivery.error-message-max-length=1000",
              "beacon.delivery.lease=30s",
              "beacon.channels.email.provider=smtp",
              "beacon.channels.email.rate-per-second=20",
              "beacon.channels.email.max-concurrency=4",
              "beacon.channels.email.queue-capacity=100",
              "beacon.channels.sms.provider=http",
              "beacon.channels.sms.rate-per-second=5",
              "beacon.channels.sms.max-concurrency=2",
              "beacon.channels.sms.queue-capacity=50",
              "beacon.dedup.window=30m",
              "beacon.dedup.sliding=true",
              "beacon.retention.enabled=true",
              "beacon.retention.retention-days=30",
              "beacon.retention.cleanup-interval=1h");

  @Test
  void contextStartsAndBindsAllSections() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final BeaconDeliveryProperties delivery = context.getBean(BeaconDeliveryProperties.class);
          final BeaconChannelProperties channels = context.getBean(BeaconChannelProperties.class);
          final BeaconDedupProperties dedup = context.getBean(BeaconDedupProperties.class);
          final BeaconRetentionProperties retention =
              context.getBean(BeaconRetentionProperties.class);

          assertThat(delivery.pollInterval()).isEqualTo(Duration.ofMillis(500));
          assertThat(delivery.maxRetries()).isEqualTo(5);
          assertThat(delivery.rateLimitRequeueDelay()).isEqualTo(Duration.ofSeconds(2));
          assertThat(delivery.lease()).isEqualTo(Duration.ofSeconds(30));
          assertThat(channels.settings(Channel.EMAIL).provider()).isEqualTo("smtp");
          assertThat(channels.settings(Channel.SMS).ratePerSecond()).isEqualTo(5.0d);
          assertThat(channels.settings(Channel.SMS).queueCapacity()).isEqualTo(50);
          assertThat(dedup.window()).isEqualTo(Duration.ofMinutes(30));
          assertThat(dedup.sliding()).isTrue();
          assertThat(retention.cleanupInterval()).isEqualTo(Duration.ofHours(1));
        });
  }

  @Test
  void contextFailsWhenDedupWindowIsZero() {
    contextRunner
        .withPropertyValues("beacon.dedup.window=0s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void contextFailsWhenChannelConcurrencyIsZero() {
    contextRunner
        .withPropertyValues("beacon.channels.sms.max-concurrency=0")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    BeaconDeliveryProperties.class,
    BeaconChannelProperties.class,
    BeaconDedupProperties.class,
    BeaconRetentionProperties.class
  })
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
