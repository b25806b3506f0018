/*
 * どこで: Beacon 配信層
 * 何を: チャネルごとに並列度と待ち行列長が有界な送信用スレッドプールを持つ
 * なぜ: チャネル間は並行に、チャネル内は上限付きで送信し、溢れた分は DB 側の PENDING に留めるため
 */
package com.example.beacon.dispatch;

import com.example.beacon.config.BeaconChannelProperties;
import com.example.beacon.config.BeaconChannelProperties.ChannelSettings;
import com.example.beacon.model.Channel;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ChannelDispatchPool {

  private static final Logger logger = LoggerFactory.getLogger(ChannelDispatchPool.class);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10L;

  private final Map<Channel, ThreadPoolExecutor> executors = new EnumMap<>(Channel.class);
  private final Map<Channel, AtomicInteger> outstanding = new EnumMap<>(Channel.class);
  private final Map<Channel, Integer> capacities = new EnumMap<>(Channel.class);

  public ChannelDispatchPool(BeaconChannelProperties properties) {
    for (Channel channel : Channel.values()) {
      final ChannelSettings settings = properties.settings(channel);
      final ThreadPoolExecutor executor =
          new ThreadPoolExecutor(
              settings.maxConcurrency(),
              settings.maxConcurrency(),
              60L,
              TimeUnit.SECONDS,
              new ArrayBlockingQueue<>(settings.queueCapacity()),
              new ThreadFactoryBuilder()
                  .setNameFormat("beacon-" + channel.name().toLowerCase(Locale.ROOT) + "-%d")
                  .setDaemon(true)
                  .build(),
              new ThreadPoolExecutor.AbortPolicy());
      executors.put(channel, executor);
      outstanding.put(channel, new AtomicInteger());
      capacities.put(channel, settings.maxConcurrency() + settings.queueCapacity());
    }
  }

  /** 実行中と待機中を合わせた残り枠。 */
  public int freeSlots(Channel channel) {
    return Math.max(capacities.get(channel) - outstanding.get(channel).get(), 0);
  }

  /**
   * 役割:
   * - チャネルのプールへ送信タスクを投入する。
   *
   * 期待動作:
   * - 枠が無ければ RejectedExecutionException を送出する。呼び出し側は target を PENDING へ戻す。
   */
  public void submit(Channel channel, Runnable task) {
    final AtomicInteger counter = outstanding.get(channel);
    counter.incrementAndGet();
    try {
      executors
          .get(channel)
          .execute(
              () -> {
                try {
                  task.run();
                } finally {
                  counter.decrementAndGet();
                }
              });
    } catch (RejectedExecutionException ex) {
      counter.decrementAndGet();
      throw ex;
    }
  }

  @PreDestroy
  public void shutdown() {
    for (Map.Entry<Channel, ThreadPoolExecutor> entry : executors.entrySet()) {
      entry.getValue().shutdown();
    }
    for (Map.Entry<Channel, ThreadPoolExecutor> entry : executors.entrySet()) {
      try {
        if (!entry.getValue().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
          // 残りは lease 切れ後に別ワーカーが拾い直す
          logger.warn("dispatch pool did not drain channel={}", entry.getKey());
          entry.getValue().shutdownNow();
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        entry.getValue().shutdownNow();
      }
    }
  }
}
