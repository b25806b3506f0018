/*
 * どこで: Beacon アプリの設定バインド
 * 何を: チャネルごとのプロバイダ/レート上限/並列度/待ち行列長を保持する
 * なぜ: 送信先プロバイダの制約に合わせてチャネル単位で絞るため
 */
package com.example.beacon.config;

import com.example.beacon.model.Channel;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "beacon.channels")
@Validated
public record BeaconChannelProperties(
    @NotNull @Valid ChannelSettings email, @NotNull @Valid ChannelSettings sms) {

  public ChannelSettings settings(Channel channel) {
    return switch (channel) {
      case EMAIL -> email;
      case SMS -> sms;
    };
  }

  public record ChannelSettings(
      @NotBlank String provider,
      @Positive double ratePerSecond,
      @Positive int maxConcurrency,
      @Positive int queueCapacity) {}
}
