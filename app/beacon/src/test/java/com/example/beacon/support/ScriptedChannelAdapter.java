/*
 * どこで: Beacon テスト支援
 * 何を: 事前に並べた結果を順に返すチャネル実装
 * なぜ: 一時失敗/恒久失敗の並びを決め打ちで再現するため
 */
package com.example.beacon.support;

import com.example.beacon.channel.AlertMessage;
import com.example.beacon.channel.ChannelAdapter;
import com.example.beacon.channel.SendResult;
import com.example.beacon.model.Channel;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class ScriptedChannelAdapter implements ChannelAdapter {

  private final Channel channel;
  private final Deque<SendResult> script = new ArrayDeque<>();
  private final List<String> destinations = new ArrayList<>();
  private Runnable beforeReturn = () -> {};

  public ScriptedChannelAdapter(Channel channel) {
    this.channel = channel;
  }

  public ScriptedChannelAdapter thenReturn(SendResult... results) {
    script.addAll(List.of(results));
    return this;
  }

  /** 送信結果を返す直前に実行する処理 (取り下げの割り込みなど)。 */
  public ScriptedChannelAdapter beforeReturn(Runnable action) {
    this.beforeReturn = action;
    return this;
  }

  public synchronized int sendCount() {
    return destinations.size();
  }

  @Override
  public Channel channel() {
    return channel;
  }

  @Override
  public synchronized SendResult send(String destination, AlertMessage message) {
    destinations.add(destination);
    beforeReturn.run();
    // 台本を使い切ったら成功を返す
    return script.isEmpty() ? SendResult.ok() : script.poll();
  }
}
