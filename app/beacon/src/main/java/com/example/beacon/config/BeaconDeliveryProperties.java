/*
 * どこで: Beacon アプリの設定バインド
 * 何を: 配信ポーリング/リトライ/バックオフ/lease の設定を保持する
 * なぜ: 運用パラメータを外部化し、数値をコードに埋め込まないため
 */
package com.example.beacon.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "beacon.delivery")
public record BeaconDeliveryProperties(
    boolean enabled,
    Duration pollInterval,
    int batchSize,
    int maxRetries,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin,
    Duration rateLimitRequeueDelay,
    int errorMessageMaxLength,
    Duration lease) {}
