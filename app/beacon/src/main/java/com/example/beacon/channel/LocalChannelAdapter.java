/*
 * どこで: Beacon チャネル層
 * 何を: 送信を模擬するチャネル実装
 * なぜ: 外部プロバイダなしで配信の状態遷移を確認するため
 */
package com.example.beacon.channel;

import com.example.beacon.model.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LocalChannelAdapter implements ChannelAdapter {

  private static final Logger logger = LoggerFactory.getLogger(LocalChannelAdapter.class);

  private final Channel channel;

  public LocalChannelAdapter(Channel channel) {
    this.channel = channel;
  }

  @Override
  public Channel channel() {
    return channel;
  }

  @Override
  public SendResult send(String destination, AlertMessage message) {
    // 実送信は行わず、ログに残すだけとする
    logger.info(
        "alert simulated send channel={} destination={} length={}",
        channel,
        destination,
        message.body().length());
    return SendResult.ok();
  }
}
