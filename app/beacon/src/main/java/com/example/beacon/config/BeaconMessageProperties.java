/*
 * どこで: Beacon アプリの設定バインド
 * 何を: 通知文面 (差出人/件名接頭辞/SMS 最大長) の設定を保持する
 * なぜ: 文面の体裁をコード変更なしに調整するため
 */
package com.example.beacon.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "beacon.message")
public record BeaconMessageProperties(String emailFrom, String subjectPrefix, int smsMaxLength) {

  public BeaconMessageProperties {
    emailFrom = emailFrom == null || emailFrom.isBlank() ? "alerts@beacon.local" : emailFrom;
    subjectPrefix = subjectPrefix == null ? "[Bushfire Beacon]" : subjectPrefix;
    smsMaxLength = smsMaxLength <= 0 ? 160 : smsMaxLength;
  }
}
