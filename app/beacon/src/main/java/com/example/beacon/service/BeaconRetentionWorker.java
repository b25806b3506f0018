/*
 * Where: Beacon cleanup worker
 * What: Triggers retention cleanup on a schedule
 * Why: Automate deletion without manual intervention
 */
package com.example.beacon.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "beacon.retention.enabled", havingValue = "true")
public class BeaconRetentionWorker {

  private final BeaconRetentionService retentionService;

  @Scheduled(fixedDelayString = "${beacon.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
