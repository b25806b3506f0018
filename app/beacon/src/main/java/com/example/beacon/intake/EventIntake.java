/*
 * どこで: Beacon intake 層
 * 何を: 生のハザード報告を検証・正規化し、不変の Alert を組み立てる
 * なぜ: 後段 (dedup / fan-out) が正規化済みの値だけを扱えるようにするため
 */
package com.example.beacon.intake;

import com.example.beacon.config.BeaconIntakeProperties;
import com.example.beacon.model.Alert;
import com.example.beacon.model.HazardReport;
import com.example.beacon.model.Severity;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EventIntake {

  private static final int MAX_DESCRIPTION_LENGTH = 2000;

  private final BeaconIntakeProperties properties;
  private final Clock clock;

  /** 副作用なし。永続化は呼び出し側の責務。 */
  public Alert normalize(HazardReport report) {
    if (report == null) {
      throw new InvalidReportException("report", "report is required");
    }
    final String hazardType = normalizeHazardType(report.hazardType());
    final String region = resolveRegion(report);
    final Severity severity =
        Severity.parse(report.severity())
            .orElseThrow(
                () ->
                    new InvalidReportException(
                        "severity", "severity must be one of " + allowedSeverities()));
    final Instant now = Instant.now(clock);
    final Instant reportedAt = parseReportedAt(report.reportedAt(), now);
    final String source = requireText("source", report.source()).trim();
    final String dedupKey =
        DedupKeys.dedupKey(
            hazardType, region, DedupKeys.timeBucket(reportedAt, properties.timeBucket()));
    return new Alert(
        UUID.randomUUID(),
        hazardType,
        region,
        severity,
        reportedAt,
        dedupKey,
        source,
        truncate(report.description()),
        now);
  }

  private String normalizeHazardType(String raw) {
    final String hazardType = requireText("hazard_type", raw).trim().toLowerCase(Locale.ROOT);
    if (!properties.allowedHazardTypes().isEmpty()
        && !properties.allowedHazardTypes().contains(hazardType)) {
      throw new InvalidReportException(
          "hazard_type", "hazard_type is not one of " + properties.allowedHazardTypes());
    }
    return hazardType;
  }

  private String resolveRegion(HazardReport report) {
    if (report.region() != null && !report.region().isBlank()) {
      return DedupKeys.regionBucket(report.region());
    }
    final Double latitude = report.latitude();
    final Double longitude = report.longitude();
    if (latitude == null || longitude == null) {
      throw new InvalidReportException(
          "location", "region or latitude/longitude is required");
    }
    if (latitude.isNaN() || latitude < -90.0d || latitude > 90.0d) {
      throw new InvalidReportException("latitude", "latitude must be within [-90, 90]");
    }
    if (longitude.isNaN() || longitude < -180.0d || longitude > 180.0d) {
      throw new InvalidReportException("longitude", "longitude must be within [-180, 180]");
    }
    return DedupKeys.regionBucket(latitude, longitude, properties.gridCellDegrees());
  }

  private Instant parseReportedAt(String raw, Instant now) {
    final String text = requireText("reported_at", raw);
    final Instant reportedAt;
    try {
      reportedAt = Instant.parse(text.trim());
    } catch (DateTimeParseException ex) {
      throw new InvalidReportException(
          "reported_at", "reported_at must be an ISO-8601 instant", ex);
    }
    if (reportedAt.isAfter(now.plus(properties.maxClockSkew()))) {
      throw new InvalidReportException("reported_at", "reported_at is in the future");
    }
    return reportedAt;
  }

  private String requireText(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidReportException(field, field + " is required");
    }
    return value;
  }

  private String truncate(String description) {
    if (description == null || description.isBlank()) {
      return null;
    }
    final String trimmed = description.trim();
    return trimmed.length() <= MAX_DESCRIPTION_LENGTH
        ? trimmed
        : trimmed.substring(0, MAX_DESCRIPTION_LENGTH);
  }

  private String allowedSeverities() {
    return Arrays.stream(Severity.values()).map(Enum::name).collect(Collectors.joining(", "));
  }
}
