package com.example.beacon.service;

import static com.example.beacon.support.BeaconFixtures.FIXED_NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.beacon.model.Alert;
import com.example.beacon.model.AlertWithdrawal;
import com.example.beacon.model.Channel;
import com.example.beacon.model.DeliveryStatus;
import com.example.beacon.model.DeliveryTarget;
import com.example.beacon.model.Severity;
import com.example.beacon.support.BeaconFixtures;
import com.example.beacon.support.InMemoryAlertRepository;
import com.example.beacon.support.InMemoryDeliveryTargetRepository;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DispatchStatusServiceTest {

  private InMemoryAlertRepository alertRepository;
  private InMemoryDeliveryTargetRepository targetRepository;
  private DispatchStatusService service;

  @BeforeEach
  void setUp() {
    alertRepository = new InMemoryAlertRepository();
    targetRepository = new InMemoryDeliveryTargetRepository();
    service = new DispatchStatusService(alertRepository, targetRepository);
  }

  @Test
  void statusCountsEveryDeliveryStatus() {
    final Alert alert = BeaconFixtures.alert("flood", "R1", Severity.MODERATE);
    alertRepository.insert(alert);
    targetRepository.insertIfAbsent(
        List.of(
            DeliveryTarget.pending(alert.alertId(), "s1", Channel.EMAIL, "a@x.test", FIXED_NOW),
            DeliveryTarget.pending(alert.alertId(), "s2", Channel.EMAIL, "b@x.test", FIXED_NOW),
            DeliveryTarget.pending(alert.alertId(), "s2", Channel.SMS, "+61412345678", FIXED_NOW)));
    final DeliveryTarget claimed =
        targetRepository
            .claimDue(Channel.SMS, 1, FIXED_NOW, FIXED_NOW.plusSeconds(30), "w#1")
            .get(0);
    targetRepository.markSent(claimed.targetId(), FIXED_NOW, "w#1");

    final AlertDispatchStatus status = service.statusOf(alert.alertId());

    assertThat(status.alert()).isEqualTo(alert);
    assertThat(status.withdrawal()).isNull();
    assertThat(status.duplicateOf()).isNull();
    assertThat(status.targets()).hasSize(3);
    assertThat(status.counts())
        .containsEntry(DeliveryStatus.PENDING, 2)
        .containsEntry(DeliveryStatus.SENT, 1)
        .containsEntry(DeliveryStatus.EXHAUSTED, 0)
        .hasSize(DeliveryStatus.values().length);
  }

  @Test
  void statusCarriesWithdrawalAndDuplicateLink() {
    final Alert first = BeaconFixtures.alert("flood", "R1", Severity.MODERATE);
    final Alert duplicate = BeaconFixtures.alert("flood", "R1", Severity.MODERATE);
    alertRepository.insert(first);
    alertRepository.insert(duplicate);
    alertRepository.recordDuplicate(duplicate.alertId(), first.alertId(), FIXED_NOW);
    alertRepository.insertWithdrawal(new AlertWithdrawal(duplicate.alertId(), "test", FIXED_NOW));

    final AlertDispatchStatus status = service.statusOf(duplicate.alertId());

    assertThat(status.duplicateOf()).isEqualTo(first.alertId());
    assertThat(status.withdrawal().reason()).isEqualTo("test");
    assertThat(status.targets()).isEmpty();
  }

  @Test
  void unknownAlertIsNotFound() {
    assertThatThrownBy(() -> service.statusOf(UUID.randomUUID()))
        .isInstanceOf(AlertNotFoundException.class);
  }
}
