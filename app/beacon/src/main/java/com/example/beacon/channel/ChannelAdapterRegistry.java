/*
 * どこで: Beacon チャネル層
 * 何を: チャネルから送信実装を引く
 * なぜ: 実装の欠落/重複を起動時に検出し、配信時に未登録チャネルで失敗しないようにするため
 */
package com.example.beacon.channel;

import com.example.beacon.model.Channel;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ChannelAdapterRegistry {

  private final Map<Channel, ChannelAdapter> adapters;

  public ChannelAdapterRegistry(List<ChannelAdapter> adapters) {
    final Map<Channel, ChannelAdapter> byChannel = new EnumMap<>(Channel.class);
    for (ChannelAdapter adapter : adapters) {
      final ChannelAdapter previous = byChannel.put(adapter.channel(), adapter);
      if (previous != null) {
        throw new IllegalStateException("multiple channel adapters for " + adapter.channel());
      }
    }
    for (Channel channel : Channel.values()) {
      if (!byChannel.containsKey(channel)) {
        throw new IllegalStateException("no channel adapter for " + channel);
      }
    }
    this.adapters = byChannel;
  }

  public ChannelAdapter adapter(Channel channel) {
    return adapters.get(channel);
  }
}
