/*
 * どこで: Beacon fan-out 層
 * 何を: admit 済み Alert を購読者 x チャネル単位の配信 target へ展開する
 * なぜ: 配信義務を一度に確定させ、dispatcher が target 単位で独立に進められるようにするため
 */
package com.example.beacon.fanout;

import com.example.beacon.model.Alert;
import com.example.beacon.model.Channel;
import com.example.beacon.model.DeliveryTarget;
import com.example.beacon.model.Subscriber;
import com.example.beacon.repository.SubscriberDirectory;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class FanOutResolver {

  private static final Logger logger = LoggerFactory.getLogger(FanOutResolver.class);

  private final SubscriberDirectory subscriberDirectory;

  /**
   * 役割:
   * - Alert の配信 target を列挙する。
   *
   * 期待動作:
   * - 地域/種別/最低深刻度/オプトイン/宛先有無で絞り、(subscriberId, channel) 順に返す。
   * - target の ID と createdAt は Alert から導くため、同じ Alert を再度 resolve すると等しいリストになる。
   * - ディレクトリ障害は DirectoryUnavailableException のまま伝播し、部分的な結果は返さない。
   */
  public List<DeliveryTarget> resolve(Alert alert) {
    final List<Subscriber> subscribers =
        subscriberDirectory.findSubscribers(alert.geographicRegion(), alert.hazardType());
    final List<DeliveryTarget> targets = new ArrayList<>();
    for (Subscriber subscriber : subscribers) {
      if (!isInterested(subscriber, alert)) {
        continue;
      }
      for (Channel channel : Channel.values()) {
        if (!subscriber.isOptedIn(channel)) {
          continue;
        }
        final String destination = subscriber.destination(channel);
        if (destination == null || destination.isBlank()) {
          // オプトインしていても宛先が無ければ送れない
          logger.debug(
              "subscriber skipped without destination subscriberId={} channel={}",
              subscriber.subscriberId(),
              channel);
          continue;
        }
        targets.add(
            DeliveryTarget.pending(
                alert.alertId(),
                subscriber.subscriberId(),
                channel,
                destination,
                alert.createdAt()));
      }
    }
    targets.sort(
        Comparator.comparing(DeliveryTarget::subscriberId)
            .thenComparing(DeliveryTarget::channel));
    logger.info(
        "alert resolved alertId={} subscribers={} targets={}",
        alert.alertId(),
        subscribers.size(),
        targets.size());
    return List.copyOf(targets);
  }

  // ディレクトリ側でも絞り込むが、実装差を吸収するためここでも判定する
  private boolean isInterested(Subscriber subscriber, Alert alert) {
    return subscriber.active()
        && subscriber.regions().contains(alert.geographicRegion())
        && subscriber.wantsHazardType(alert.hazardType())
        && alert.severity().isAtLeast(subscriber.minimumSeverity());
  }
}
