/*
 * どこで: Beacon サービス層
 * 何を: intake 結果/配信結果/E2E 遅延/断念/レート超過/backlog のアプリ固有メトリクスを記録する
 * なぜ: 通知が届いているか、どこで詰まっているかを Prometheus から直接観測できるようにするため
 */
package com.example.beacon.service;

import com.example.beacon.model.AuditReason;
import com.example.beacon.model.Channel;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class BeaconMetrics {

  private static final String METRIC_INTAKE_TOTAL = "beacon.intake.total";
  private static final String METRIC_DELIVERY_TOTAL = "beacon.delivery.total";
  private static final String METRIC_DELIVERY_E2E_DELAY = "beacon.delivery.e2e.delay";
  private static final String METRIC_EXHAUSTED_TOTAL = "beacon.delivery.exhausted.total";
  private static final String METRIC_RATE_LIMITED_TOTAL = "beacon.delivery.rate_limited.total";
  private static final String METRIC_BACKLOG_CURRENT = "beacon.delivery.backlog.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Timer deliveryE2eDelayTimer;

  public BeaconMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Current number of pending or in-flight delivery targets")
        .register(meterRegistry);
    this.deliveryE2eDelayTimer =
        Timer.builder(METRIC_DELIVERY_E2E_DELAY)
            .description("End-to-end delay from hazard reported_at to delivery sent_at")
            .register(meterRegistry);
  }

  /** result は admitted / duplicate / invalid / directory_unavailable。 */
  public void recordIntake(String result) {
    counter(METRIC_INTAKE_TOTAL, "Hazard report intake outcomes", Tags.of("result", result))
        .increment();
  }

  /** result は sent / retry / exhausted / withdrawn / lock_lost。 */
  public void recordDelivery(Channel channel, String result) {
    counter(
            METRIC_DELIVERY_TOTAL,
            "Delivery attempt outcomes",
            Tags.of("channel", tagValue(channel), "result", result))
        .increment();
  }

  public void recordExhausted(Channel channel, AuditReason reason) {
    counter(
            METRIC_EXHAUSTED_TOTAL,
            "Delivery targets given up on",
            Tags.of("channel", tagValue(channel), "reason", reason.name().toLowerCase(Locale.ROOT)))
        .increment();
  }

  public void recordRateLimited(Channel channel) {
    counter(
            METRIC_RATE_LIMITED_TOTAL,
            "Delivery targets re-queued by the channel rate ceiling",
            Tags.of("channel", tagValue(channel)))
        .increment();
  }

  public void recordDeliveryE2eDelay(Instant reportedAt, Instant sentAt) {
    if (reportedAt == null || sentAt == null || sentAt.isBefore(reportedAt)) {
      return;
    }
    deliveryE2eDelayTimer.record(Duration.between(reportedAt, sentAt));
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    return counters.computeIfAbsent(
        name + tags,
        ignored ->
            Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }

  private String tagValue(Channel channel) {
    return channel.name().toLowerCase(Locale.ROOT);
  }
}
