package com.example.beacon.service;

import static com.example.beacon.support.BeaconFixtures.FIXED_NOW;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.beacon.config.BeaconRetentionProperties;
import com.example.beacon.repository.AlertRepository;
import com.example.beacon.repository.DedupRecordRepository;
import com.example.beacon.repository.DeliveryTargetRepository;
import com.example.beacon.support.BeaconFixtures;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BeaconRetentionServiceTest {

  @Mock private AlertRepository alertRepository;
  @Mock private DeliveryTargetRepository deliveryTargetRepository;
  @Mock private DedupRecordRepository dedupRecordRepository;

  @Test
  void cleanupDeletesSettledAlertsAndExpiredDedupRecords() {
    final BeaconRetentionService service =
        new BeaconRetentionService(
            alertRepository,
            deliveryTargetRepository,
            dedupRecordRepository,
            new BeaconRetentionProperties(true, 30, Duration.ofHours(1)),
            BeaconFixtures.fixedClock());
    final Instant threshold = FIXED_NOW.minus(Duration.ofDays(30));
    when(deliveryTargetRepository.countStaleActive(threshold)).thenReturn(2);
    when(alertRepository.deleteSettledOlderThan(threshold)).thenReturn(5);
    when(dedupRecordRepository.deleteExpired(FIXED_NOW)).thenReturn(7);

    service.cleanup();

    verify(alertRepository).deleteSettledOlderThan(threshold);
    verify(dedupRecordRepository).deleteExpired(FIXED_NOW);
  }
}
