/*
 * どこで: Beacon intake 層
 * 何を: 地域バケットと時間バケットから dedup キーを導出する
 * なぜ: ほぼ同時の重複報告を同じキーへ畳み込むため
 */
package com.example.beacon.intake;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

public final class DedupKeys {

  private static final String GRID_PREFIX = "GRID:";

  private DedupKeys() {}

  public static String regionBucket(String regionCode) {
    return regionCode.trim().toUpperCase(Locale.ROOT);
  }

  public static String regionBucket(double latitude, double longitude, double cellDegrees) {
    final long row = (long) Math.floor(latitude / cellDegrees);
    final long column = (long) Math.floor(longitude / cellDegrees);
    return GRID_PREFIX + row + ":" + column;
  }

  public static long timeBucket(Instant reportedAt, Duration bucket) {
    return Math.floorDiv(reportedAt.toEpochMilli(), bucket.toMillis());
  }

  public static String dedupKey(String hazardType, String region, long timeBucket) {
    // 区切り文字を固定し、フィールド境界の曖昧さで衝突しないようにする
    final String canonical = hazardType + "|" + region + "|" + timeBucket;
    return Hashing.sha256().hashString(canonical, StandardCharsets.UTF_8).toString();
  }

  /** 直前/直後の時間バケットに対応するキー。境界をまたいだ連続報告の突き合わせに使う。 */
  public static List<String> adjacentDedupKeys(
      String hazardType, String region, Instant reportedAt, Duration bucket) {
    final long current = timeBucket(reportedAt, bucket);
    return List.of(
        dedupKey(hazardType, region, current - 1), dedupKey(hazardType, region, current + 1));
  }
}
