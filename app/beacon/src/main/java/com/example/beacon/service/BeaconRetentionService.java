/*
 * Where: Beacon service layer
 * What: Applies the retention policy to settled alerts and expired dedup records
 * Why: Prevent unbounded growth while keeping alerts that still have work in flight
 */
package com.example.beacon.service;

import com.example.beacon.config.BeaconRetentionProperties;
import com.example.beacon.repository.AlertRepository;
import com.example.beacon.repository.DedupRecordRepository;
import com.example.beacon.repository.DeliveryTargetRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BeaconRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(BeaconRetentionService.class);

  private final AlertRepository alertRepository;
  private final DeliveryTargetRepository deliveryTargetRepository;
  private final DedupRecordRepository dedupRecordRepository;
  private final BeaconRetentionProperties properties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int staleActiveCount = deliveryTargetRepository.countStaleActive(threshold);
    if (staleActiveCount > 0) {
      logger.error(
          "beacon retention found stale active delivery targets count={} threshold={}",
          staleActiveCount,
          threshold);
    }
    final int deletedAlerts = alertRepository.deleteSettledOlderThan(threshold);
    final int deletedDedupRecords = dedupRecordRepository.deleteExpired(now);
    logger.info(
        "beacon retention cleanup deleted alerts={} dedupRecords={} threshold={}",
        deletedAlerts,
        deletedDedupRecords,
        threshold);
  }
}
