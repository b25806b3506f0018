/*
 * どこで: Beacon チャネル層
 * 何を: 単一宛先への 1 回の送信を抽象化する
 * なぜ: 配信コアを送信プロバイダから切り離し、結果分類だけを受け取るため
 */
package com.example.beacon.channel;

import com.example.beacon.model.Channel;

public interface ChannelAdapter {

  Channel channel();

  /**
   * 役割:
   * - 1 宛先へ 1 回だけ送信を試みる。
   *
   * 期待動作:
   * - リトライはしない。例外は投げず、結果を {@link SendResult} に分類して返す。
   * - レート制御と並列度制御は呼び出し側で済ませておく。
   */
  SendResult send(String destination, AlertMessage message);
}
