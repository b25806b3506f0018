/*
 * どこで: Beacon チャネル層
 * 何を: プロバイダ呼び出しのタイムアウトが配信 lease より短いことを起動時に検証する
 * なぜ: 送信が lease を超えて続くと、別ワーカーが同じ target を再 claim して二重送信するため
 */
package com.example.beacon.channel;

import java.time.Duration;
import java.util.Map;

final class SendTimeouts {

  static final String SMTP_CONNECTION_TIMEOUT = "mail.smtp.connectiontimeout";
  static final String SMTP_TIMEOUT = "mail.smtp.timeout";
  static final String SMTP_WRITE_TIMEOUT = "mail.smtp.writetimeout";

  private SendTimeouts() {}

  /** 接続待ちと 1 回の I/O 待ちの合計が lease 未満であることを要求する。 */
  static void requireWithinLease(
      String provider, Duration connectTimeout, Duration ioTimeout, Duration lease) {
    if (lease == null || lease.isZero() || lease.isNegative()) {
      throw new IllegalStateException("beacon.delivery.lease must be positive");
    }
    requirePositive(provider + " connect timeout", connectTimeout);
    requirePositive(provider + " read timeout", ioTimeout);
    final Duration worstCase = connectTimeout.plus(ioTimeout);
    if (worstCase.compareTo(lease) >= 0) {
      throw new IllegalStateException(
          provider
              + " connect + read timeout ("
              + worstCase
              + ") must be shorter than beacon.delivery.lease ("
              + lease
              + ")");
    }
  }

  /** JavaMail のタイムアウト設定 (ミリ秒) を読む。未設定だと無期限待ちになるため必須とする。 */
  static Duration smtpTimeout(Map<String, String> mailProperties, String key) {
    final String value = mailProperties.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalStateException("spring.mail.properties[" + key + "] is required");
    }
    try {
      return Duration.ofMillis(Long.parseLong(value.trim()));
    } catch (NumberFormatException ex) {
      throw new IllegalStateException(
          "spring.mail.properties[" + key + "] must be milliseconds", ex);
    }
  }

  private static void requirePositive(String name, Duration timeout) {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalStateException(name + " must be positive");
    }
  }
}
