/*
 * どこで: Beacon チャネル層
 * 何を: HTTP の SMS ゲートウェイで SMS チャネルを送信する
 * なぜ: ゲートウェイの応答コードを一時失敗/恒久失敗へ分類し、リトライ判断を dispatcher に渡すため
 */
package com.example.beacon.channel;

import com.example.beacon.config.SmsGatewayProperties;
import com.example.beacon.model.Channel;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

public class HttpSmsChannelAdapter implements ChannelAdapter {

  private static final Logger logger = LoggerFactory.getLogger(HttpSmsChannelAdapter.class);

  private final RestClient smsGatewayRestClient;
  private final ContactValidator contactValidator;
  private final SmsGatewayProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public HttpSmsChannelAdapter(
      RestClient smsGatewayRestClient,
      ContactValidator contactValidator,
      SmsGatewayProperties properties) {
    this.smsGatewayRestClient = smsGatewayRestClient;
    this.contactValidator = contactValidator;
    this.properties = properties;
  }

  @Override
  public Channel channel() {
    return Channel.SMS;
  }

  @Override
  public SendResult send(String destination, AlertMessage message) {
    if (!contactValidator.isE164(destination)) {
      return SendResult.permanentError("destination is not an E.164 number");
    }
    try {
      smsGatewayRestClient
          .post()
          .uri(properties.sendPath())
          .contentType(MediaType.APPLICATION_JSON)
          .headers(this::applyAuthorization)
          .body(new SmsSendRequest(destination, properties.senderId(), message.body()))
          .retrieve()
          .toBodilessEntity();
      return SendResult.ok();
    } catch (RestClientResponseException ex) {
      return classify(ex);
    } catch (ResourceAccessException ex) {
      logger.warn("sms gateway unreachable reason={}", ex.getMessage());
      return SendResult.transientError("sms gateway unreachable: " + ex.getMessage());
    } catch (RestClientException ex) {
      logger.warn("sms gateway call failed reason={}", ex.getMessage());
      return SendResult.transientError("sms gateway call failed: " + ex.getMessage());
    }
  }

  private SendResult classify(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "sms gateway responded with error status={} statusText={}", status, ex.getStatusText());
    final String detail = "sms gateway status " + status;
    if (status == 408 || status == 429 || ex.getStatusCode().is5xxServerError()) {
      return SendResult.transientError(detail);
    }
    return SendResult.permanentError(detail);
  }

  private void applyAuthorization(HttpHeaders headers) {
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      headers.setBearerAuth(properties.apiKey());
    }
  }
}
