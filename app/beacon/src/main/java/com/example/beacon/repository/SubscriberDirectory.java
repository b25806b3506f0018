/*
 * どこで: Beacon Repository 層
 * 何を: 購読者の検索/取得/保存を抽象化する
 * なぜ: 配信コアをストレージ実装から切り離し、インメモリのテストダブルを差し込めるようにするため
 */
package com.example.beacon.repository;

import com.example.beacon.model.Subscriber;
import java.util.List;
import java.util.Optional;

public interface SubscriberDirectory {

  /**
   * 役割:
   * - 地域とハザード種別に関心を持つ有効な購読者を返す。
   *
   * 期待動作:
   * - 1 回の読み取りで完結させ、subscriberId 昇順で返す。
   * - バックエンド障害は {@link DirectoryUnavailableException} として送出し、部分的な結果は返さない。
   */
  List<Subscriber> findSubscribers(String region, String hazardType);

  Optional<Subscriber> findById(String subscriberId);

  /**
   * 役割:
   * - 購読者を登録/更新する。
   *
   * 期待動作:
   * - 連絡先を検証・正規化してから保存する。
   * - 不正な連絡先は IllegalArgumentException を送出する。
   */
  void save(Subscriber subscriber);
}
