/*
 * どこで: Beacon 配信層
 * 何を: チャネルごとの送信レート上限をトークンバケットで管理する
 * なぜ: プロバイダの受付上限を超えた分を落とさず待ち行列へ戻すため
 */
package com.example.beacon.dispatch;

import com.example.beacon.config.BeaconChannelProperties;
import com.example.beacon.model.Channel;
import com.google.common.util.concurrent.RateLimiter;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ChannelRateLimiters {

  private final Map<Channel, RateLimiter> limiters = new EnumMap<>(Channel.class);

  public ChannelRateLimiters(BeaconChannelProperties properties) {
    for (Channel channel : Channel.values()) {
      limiters.put(channel, RateLimiter.create(properties.settings(channel).ratePerSecond()));
    }
  }

  /** 待たずに許可を取る。取れなければ false。 */
  public boolean tryAcquire(Channel channel) {
    return limiters.get(channel).tryAcquire();
  }
}
