/*
 * どこで: Beacon チャネル層の設定
 * 何を: beacon.channels.<channel>.provider に応じてチャネル実装を 1 つずつ登録する
 * なぜ: 環境ごとに模擬送信と実プロバイダを切り替え、実プロバイダの待ち時間を配信 lease 内に抑えるため
 */
package com.example.beacon.channel;

import com.example.beacon.config.BeaconDeliveryProperties;
import com.example.beacon.config.BeaconMessageProperties;
import com.example.beacon.config.SmsGatewayProperties;
import com.example.beacon.model.Channel;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.mail.MailProperties;
import org.springframework.boot.http.client.ClientHttpRequestFactoryBuilder;
import org.springframework.boot.http.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.web.client.RestClient;

@Configuration
public class ChannelAdapterConfig {

  @Bean
  @ConditionalOnProperty(
      name = "beacon.channels.email.provider",
      havingValue = "local",
      matchIfMissing = true)
  ChannelAdapter localEmailChannelAdapter() {
    return new LocalChannelAdapter(Channel.EMAIL);
  }

  @Bean
  @ConditionalOnProperty(name = "beacon.channels.email.provider", havingValue = "smtp")
  ChannelAdapter smtpEmailChannelAdapter(
      JavaMailSender mailSender,
      ContactValidator contactValidator,
      BeaconMessageProperties properties,
      MailProperties mailProperties,
      BeaconDeliveryProperties deliveryProperties) {
    // JavaMailSender は spring.mail.properties をそのまま JavaMail へ渡す
    final Map<String, String> settings = mailProperties.getProperties();
    final Duration connectTimeout =
        SendTimeouts.smtpTimeout(settings, SendTimeouts.SMTP_CONNECTION_TIMEOUT);
    final Duration readTimeout = SendTimeouts.smtpTimeout(settings, SendTimeouts.SMTP_TIMEOUT);
    final Duration writeTimeout =
        SendTimeouts.smtpTimeout(settings, SendTimeouts.SMTP_WRITE_TIMEOUT);
    SendTimeouts.requireWithinLease(
        "smtp",
        connectTimeout,
        readTimeout.compareTo(writeTimeout) >= 0 ? readTimeout : writeTimeout,
        deliveryProperties.lease());
    return new SmtpEmailChannelAdapter(mailSender, contactValidator, properties);
  }

  @Bean
  @ConditionalOnProperty(
      name = "beacon.channels.sms.provider",
      havingValue = "local",
      matchIfMissing = true)
  ChannelAdapter localSmsChannelAdapter() {
    return new LocalChannelAdapter(Channel.SMS);
  }

  @Bean
  @ConditionalOnProperty(name = "beacon.channels.sms.provider", havingValue = "http")
  ChannelAdapter httpSmsChannelAdapter(
      RestClient.Builder builder,
      ContactValidator contactValidator,
      SmsGatewayProperties properties,
      BeaconDeliveryProperties deliveryProperties) {
    SendTimeouts.requireWithinLease(
        "sms-gateway",
        properties.connectTimeout(),
        properties.readTimeout(),
        deliveryProperties.lease());
    final ClientHttpRequestFactorySettings settings =
        ClientHttpRequestFactorySettings.defaults()
            .withConnectTimeout(properties.connectTimeout())
            .withReadTimeout(properties.readTimeout());
    final RestClient restClient =
        builder
            .baseUrl(properties.baseUrl())
            .requestFactory(ClientHttpRequestFactoryBuilder.detect().build(settings))
            .build();
    return new HttpSmsChannelAdapter(restClient, contactValidator, properties);
  }
}
