/*
 * どこで: Beacon テスト支援
 * 何を: SubscriberDirectory のインメモリ実装
 * なぜ: fan-out とパイプラインを DB なしで検証し、ディレクトリ障害も再現できるようにするため
 */
package com.example.beacon.support;

import com.example.beacon.model.Subscriber;
import com.example.beacon.repository.DirectoryUnavailableException;
import com.example.beacon.repository.SubscriberDirectory;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class InMemorySubscriberDirectory implements SubscriberDirectory {

  private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
  private final AtomicBoolean unavailable = new AtomicBoolean(false);

  public void failLookups(boolean fail) {
    unavailable.set(fail);
  }

  @Override
  public List<Subscriber> findSubscribers(String region, String hazardType) {
    checkAvailable();
    return subscribers.values().stream()
        .filter(Subscriber::active)
        .filter(subscriber -> subscriber.regions().contains(region))
        .filter(subscriber -> subscriber.wantsHazardType(hazardType))
        .sorted(Comparator.comparing(Subscriber::subscriberId))
        .toList();
  }

  @Override
  public Optional<Subscriber> findById(String subscriberId) {
    checkAvailable();
    return Optional.ofNullable(subscribers.get(subscriberId));
  }

  @Override
  public void save(Subscriber subscriber) {
    subscribers.put(subscriber.subscriberId(), subscriber);
  }

  private void checkAvailable() {
    if (unavailable.get()) {
      throw new DirectoryUnavailableException("directory offline", null);
    }
  }
}
