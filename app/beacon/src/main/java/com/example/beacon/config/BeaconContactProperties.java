/*
 * どこで: Beacon 設定
 * 何を: 連絡先正規化の既定国コードを保持する
 * なぜ: 国番号なしで登録された電話番号を E.164 に揃えるため
 */
package com.example.beacon.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "beacon.contacts")
public record BeaconContactProperties(String defaultRegion) {

  public BeaconContactProperties {
    defaultRegion = defaultRegion == null || defaultRegion.isBlank() ? "AU" : defaultRegion;
  }
}
