/*
 * どこで: Beacon チャネル層のテスト
 * 何を: 実プロバイダ用アダプタ登録時のタイムアウト検証を確認する
 * なぜ: lease を超えて送信が続く設定で起動できないことを保証するため
 */
package com.example.beacon.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.example.beacon.config.BeaconContactProperties;
import com.example.beacon.config.BeaconDeliveryProperties;
import com.example.beacon.config.BeaconMessageProperties;
import com.example.beacon.config.SmsGatewayProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.mail.MailProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.web.client.RestClient;

class ChannelAdapterConfigTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(
              TestConfiguration.class, ContactValidator.class, ChannelAdapterConfig.class)
          .withBean(RestClient.Builder.class, RestClient::builder)
          .withBean(JavaMailSender.class, () -> mock(JavaMailSender.class))
          .withPropertyValues("beacon.delivery.lease=60s");

  @Test
  void smsGatewayStartsWithDefaultTimeouts() {
    contextRunner
        .withPropertyValues("beacon.channels.sms.provider=http")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              assertThat(context.getBean("httpSmsChannelAdapter"))
                  .isInstanceOf(HttpSmsChannelAdapter.class);
            });
  }

  @Test
  void smsGatewayFailsWhenReadTimeoutReachesLease() {
    contextRunner
        .withPropertyValues(
            "beacon.channels.sms.provider=http", "beacon.sms-gateway.read-timeout=60s")
        .run(
            context ->
                assertThat(context)
                    .getFailure()
                    .hasRootCauseInstanceOf(IllegalStateException.class)
                    .rootCause()
                    .hasMessageContaining("sms-gateway"));
  }

  @Test
  void smsGatewayFailsWhenConnectPlusReadExceedsLease() {
    contextRunner
        .withPropertyValues(
            "beacon.channels.sms.provider=http",
            "beacon.sms-gateway.connect-timeout=30s",
            "beacon.sms-gateway.read-timeout=30s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void smtpStartsWhenMailTimeoutsFitWithinLease() {
    contextRunner
        .withPropertyValues(
            "beacon.channels.email.provider=smtp",
            "spring.mail.properties[mail.smtp.connectiontimeout]=5000",
            "spring.mail.properties[mail.smtp.timeout]=10000",
            "spring.mail.properties[mail.smtp.writetimeout]=20000")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              assertThat(context.getBean("smtpEmailChannelAdapter"))
                  .isInstanceOf(SmtpEmailChannelAdapter.class);
            });
  }

  @Test
  void smtpFailsWhenMailTimeoutsAreMissing() {
    contextRunner
        .withPropertyValues("beacon.channels.email.provider=smtp")
        .run(
            context ->
                assertThat(context)
                    .getFailure()
                    .hasRootCauseInstanceOf(IllegalStateException.class)
                    .rootCause()
                    .hasMessageContaining("mail.smtp.connectiontimeout"));
  }

  @Test
  void smtpFailsWhenWriteTimeoutReachesLease() {
    contextRunner
        .withPropertyValues(
            "beacon.channels.email.provider=smtp",
            "spring.mail.properties[mail.smtp.connectiontimeout]=5000",
            "spring.mail.properties[mail.smtp.timeout]=10000",
            "spring.mail.properties[mail.smtp.writetimeout]=55000")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void localProvidersNeedNoTimeouts() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          assertThat(context.getBeansOfType(ChannelAdapter.class)).hasSize(2);
        });
  }

  @Configuration
  @EnableConfigurationProperties({
    SmsGatewayProperties.class,
    BeaconDeliveryProperties.class,
    BeaconMessageProperties.class,
    BeaconContactProperties.class,
    MailProperties.class
  })
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
