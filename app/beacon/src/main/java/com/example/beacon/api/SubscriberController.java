/*
 * どこで: Beacon API
 * 何を: 購読者の登録/更新/参照のエンドポイントを提供する
 * なぜ: 連絡先を登録時点で検証・正規化し、配信時の恒久失敗を減らすため
 */
package com.example.beacon.api;

import com.example.beacon.model.Subscriber;
import com.example.beacon.repository.SubscriberDirectory;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/subscribers")
@RequiredArgsConstructor
public class SubscriberController {

  private final SubscriberDirectory subscriberDirectory;

  @PutMapping("/{subscriber_id}")
  public SubscriberResponse save(
      @PathVariable("subscriber_id") String subscriberId,
      @Valid @RequestBody SubscriberRequest request) {
    subscriberDirectory.save(request.toSubscriber(subscriberId));
    // 正規化後の値を返す
    return get(subscriberId);
  }

  @GetMapping("/{subscriber_id}")
  public SubscriberResponse get(@PathVariable("subscriber_id") String subscriberId) {
    final Subscriber subscriber =
        subscriberDirectory
            .findById(subscriberId)
            .orElseThrow(() -> new SubscriberNotFoundException(subscriberId));
    return SubscriberResponse.from(subscriber);
  }
}
