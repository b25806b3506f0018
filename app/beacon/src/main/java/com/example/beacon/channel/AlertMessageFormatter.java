/*
 * どこで: Beacon チャネル層
 * 何を: Alert からチャネルごとの通知文面を組み立てる
 * なぜ: 文面の体裁を送信プロバイダ実装から分離するため
 */
package com.example.beacon.channel;

import com.example.beacon.config.BeaconMessageProperties;
import com.example.beacon.model.Alert;
import com.example.beacon.model.Channel;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AlertMessageFormatter {

  private static final String ELLIPSIS = "...";

  private final BeaconMessageProperties properties;

  public AlertMessage format(Alert alert, Channel channel) {
    return switch (channel) {
      case EMAIL -> new AlertMessage(subject(alert), emailBody(alert));
      case SMS -> new AlertMessage(null, smsBody(alert));
    };
  }

  private String subject(Alert alert) {
    final String prefix = properties.subjectPrefix().isBlank() ? "" : properties.subjectPrefix() + " ";
    return prefix
        + alert.severity().name()
        + " "
        + headline(alert.hazardType())
        + " - "
        + alert.geographicRegion();
  }

  private String emailBody(Alert alert) {
    final StringBuilder body = new StringBuilder();
    body.append("Hazard: ").append(headline(alert.hazardType())).append('\n');
    body.append("Severity: ").append(alert.severity().name()).append('\n');
    body.append("Region: ").append(alert.geographicRegion()).append('\n');
    body.append("Reported at: ").append(alert.reportedAt()).append('\n');
    body.append("Source: ").append(alert.source()).append('\n');
    if (alert.description() != null) {
      body.append('\n').append(alert.description()).append('\n');
    }
    body.append('\n').append("Alert ID: ").append(alert.alertId()).append('\n');
    return body.toString();
  }

  private String smsBody(Alert alert) {
    final StringBuilder body = new StringBuilder();
    body.append(alert.severity().name())
        .append(' ')
        .append(headline(alert.hazardType()))
        .append(" in ")
        .append(alert.geographicRegion())
        .append(" at ")
        .append(alert.reportedAt());
    if (alert.description() != null) {
      body.append(". ").append(alert.description());
    }
    return truncate(body.toString(), properties.smsMaxLength());
  }

  private String headline(String hazardType) {
    return hazardType.toUpperCase(Locale.ROOT);
  }

  private String truncate(String text, int maxLength) {
    if (text.length() <= maxLength) {
      return text;
    }
    if (maxLength <= ELLIPSIS.length()) {
      return text.substring(0, maxLength);
    }
    return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
  }
}
