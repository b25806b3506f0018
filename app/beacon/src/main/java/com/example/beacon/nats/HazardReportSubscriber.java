/*
 * どこで: Beacon NATS 購読
 * 何を: JetStream からハザード報告を購読し、受付パイプラインへ渡す
 * なぜ: 観測系フィードの報告を HTTP と同じ経路で受け付け、失敗種別に応じて再配信を制御するため
 */
package com.example.beacon.nats;

import com.example.beacon.config.BeaconNatsProperties;
import com.example.beacon.intake.InvalidReportException;
import com.example.beacon.model.HazardReport;
import com.example.beacon.service.AlertPipelineService;
import com.example.beacon.service.IntakeResult;
import com.example.common.TraceIds;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.impl.Headers;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true")
public class HazardReportSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(HazardReportSubscriber.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;
  private static final String TRACE_ID_HEADER = "X-Trace-Id";
  private static final String TRACE_ID_MDC_KEY = "trace_id";

  private final Connection connection;
  private final AlertPipelineService alertPipelineService;
  private final ObjectMapper objectMapper;
  private final BeaconNatsProperties properties;
  private final AtomicBoolean started;
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public HazardReportSubscriber(
      Connection connection,
      AlertPipelineService alertPipelineService,
      ObjectMapper objectMapper,
      BeaconNatsProperties properties) {
    this.connection = connection;
    this.alertPipelineService = alertPipelineService;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.started = new AtomicBoolean(false);
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      ensureStream();
      final JetStream jetStream = connection.jetStream();
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              properties.subject(),
              dispatcher,
              this::handleMessage,
              false,
              buildPushSubscribeOptions());
      logger.info(
          "hazard report subscriber started subject={} stream={} durable={}",
          properties.subject(),
          properties.stream(),
          properties.durable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start JetStream subscription", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    MDC.put(TRACE_ID_MDC_KEY, resolveTraceId(message));
    try {
      final HazardReport report = objectMapper.readValue(message.getData(), HazardReport.class);
      final IntakeResult result = alertPipelineService.submit(report);
      logger.info(
          "hazard report consumed alertId={} outcome={} targets={}",
          result.alertId(),
          result.outcome(),
          result.targetCount());
      // JetStream 明示 ack: 重複判定も正常処理なので ack して再配信を止める
      message.ack();
    } catch (JsonProcessingException ex) {
      // payload 破損は再配信で回復しないため恒久的に TERM する
      logger.warn("failed to parse hazard report payload", ex);
      termSilently(message);
    } catch (InvalidReportException ex) {
      logger.warn("hazard report rejected field={} reason={}", ex.field(), ex.getMessage());
      termSilently(message);
    } catch (DataAccessException ex) {
      // DB など一時的失敗は再配信させる
      logger.warn("temporary failure while handling hazard report", ex);
      nakSilently(message);
    } catch (IOException | RuntimeException ex) {
      // ディレクトリ障害や不明な例外はデータロス回避のため再配信に倒す
      logger.warn("failed to handle hazard report", ex);
      nakSilently(message);
    } finally {
      MDC.remove(TRACE_ID_MDC_KEY);
    }
  }

  private String resolveTraceId(Message message) {
    final Headers headers = message.getHeaders();
    return TraceIds.orNew(headers == null ? null : headers.getFirst(TRACE_ID_HEADER));
  }

  private void ensureStream() throws IOException, JetStreamApiException {
    // Nats-Msg-Id による重複排除を有効化するため stream を必ず作成する
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    final JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
    upsertStream(jetStreamManagement, streamConfiguration);
    logger.info(
        "hazard report stream ensured stream={} subject={} duplicateWindow={}",
        properties.stream(),
        properties.subject(),
        properties.duplicateWindow());
  }

  private void upsertStream(
      JetStreamManagement jetStreamManagement, StreamConfiguration streamConfiguration)
      throws IOException, JetStreamApiException {
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }

  private PushSubscribeOptions buildPushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(properties.ackWait())
            .maxDeliver(properties.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(properties.durable())
        .configuration(consumerConfiguration)
        .build();
  }

  private void nakSilently(Message message) {
    try {
      message.nak();
    } catch (IllegalStateException ex) {
      logger.warn("failed to nack nats message", ex);
    }
  }

  private void termSilently(Message message) {
    try {
      message.term();
    } catch (IllegalStateException ex) {
      logger.warn("failed to term nats message", ex);
    }
  }
}
