package com.example.beacon.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.beacon.AbstractPostgresContainerTest;
import com.example.beacon.model.Severity;
import com.example.beacon.model.Subscriber;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class JdbcSubscriberDirectoryTest extends AbstractPostgresContainerTest {

  @Autowired private SubscriberDirectory subscriberDirectory;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM subscribers", new MapSqlParameterSource());
  }

  @Test
  void saveNormalizesContacts() {
    subscriberDirectory.save(
        subscriber("s1", "Alice@Example.COM", "0412 345 678", Set.of("R1"), Set.of(), true));

    final Subscriber stored = subscriberDirectory.findById("s1").orElseThrow();
    assertThat(stored.email()).isEqualTo("Alice@example.com");
    assertThat(stored.phone()).isEqualTo("+61412345678");
    assertThat(stored.regions()).containsExactly("R1");
    assertThat(stored.minimumSeverity()).isEqualTo(Severity.MODERATE);
  }

  @Test
  void findSubscribersFiltersByRegionHazardTypeAndActive() {
    subscriberDirectory.save(subscriber("s3", "c@example.com", null, Set.of("R1"), Set.of(), true));
    subscriberDirectory.save(
        subscriber("s1", "a@example.com", null, Set.of("R1", "R2"), Set.of("bushfire"), true));
    subscriberDirectory.save(
        subscriber("s2", "b@example.com", null, Set.of("R1"), Set.of("flood"), true));
    subscriberDirectory.save(subscriber("s4", "d@example.com", null, Set.of("R1"), Set.of(), false));
    subscriberDirectory.save(subscriber("s5", "e@example.com", null, Set.of("R9"), Set.of(), true));

    assertThat(subscriberDirectory.findSubscribers("R1", "bushfire"))
        .extracting(Subscriber::subscriberId)
        .containsExactly("s1", "s3");
    assertThat(subscriberDirectory.findSubscribers("R2", "bushfire"))
        .extracting(Subscriber::subscriberId)
        .containsExactly("s1");
    assertThat(subscriberDirectory.findSubscribers("R3", "bushfire")).isEmpty();
  }

  @Test
  void saveReplacesRegionsAndHazardTypes() {
    subscriberDirectory.save(
        subscriber("s1", "a@example.com", null, Set.of("R1", "R2"), Set.of("flood"), true));
    subscriberDirectory.save(
        subscriber("s1", "a@example.com", null, Set.of("R3"), Set.of("bushfire"), true));

    final Subscriber stored = subscriberDirectory.findById("s1").orElseThrow();
    assertThat(stored.regions()).containsExactly("R3");
    assertThat(stored.hazardTypes()).containsExactly("bushfire");
    assertThat(subscriberDirectory.findSubscribers("R1", "bushfire")).isEmpty();
  }

  @Test
  void invalidContactIsRejectedWithoutWriting() {
    assertThatThrownBy(
            () ->
                subscriberDirectory.save(
                    subscriber("s1", "user@", null, Set.of("R1"), Set.of(), true)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("email is invalid");
    assertThatThrownBy(
            () ->
                subscriberDirectory.save(
                    subscriber("s1", null, "12", Set.of("R1"), Set.of(), true)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("phone is invalid");

    assertThat(subscriberDirectory.findById("s1")).isEmpty();
  }

  private static Subscriber subscriber(
      String id,
      String email,
      String phone,
      Set<String> regions,
      Set<String> hazardTypes,
      boolean active) {
    return new Subscriber(
        id,
        email,
        phone,
        regions,
        hazardTypes,
        email != null,
        phone != null,
        Severity.MODERATE,
        active);
  }
}
