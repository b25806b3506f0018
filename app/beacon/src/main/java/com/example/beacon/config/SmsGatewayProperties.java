/*
 * どこで: Beacon 設定
 * 何を: SMS ゲートウェイ呼び出し設定 (送信先/認証/タイムアウト) を保持する
 * なぜ: 送信先 URL と認証情報を外部化し、応答待ちを配信 lease 内に収めるため
 */
package com.example.beacon.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "beacon.sms-gateway")
public record SmsGatewayProperties(
    String baseUrl,
    String sendPath,
    String senderId,
    String apiKey,
    Duration connectTimeout,
    Duration readTimeout) {

  public SmsGatewayProperties {
    baseUrl = baseUrl == null ? "http://sms-gateway:80" : baseUrl;
    sendPath = sendPath == null || sendPath.isBlank() ? "/v1/messages" : sendPath;
    senderId = senderId == null || senderId.isBlank() ? "BEACON" : senderId;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(15) : readTimeout;
  }
}
