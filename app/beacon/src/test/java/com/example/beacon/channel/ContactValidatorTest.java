package com.example.beacon.channel;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.beacon.config.BeaconContactProperties;
import org.junit.jupiter.api.Test;

class ContactValidatorTest {

  private final ContactValidator validator =
      new ContactValidator(new BeaconContactProperties("AU"));

  @Test
  void normalizeEmailLowercasesDomainOnly() {
    assertThat(validator.normalizeEmail("  Ranger.Bob@Example.COM "))
        .contains("Ranger.Bob@example.com");
  }

  @Test
  void normalizeEmailRejectsMalformedInput() {
    assertThat(validator.normalizeEmail("no-at-sign")).isEmpty();
    assertThat(validator.normalizeEmail("user@")).isEmpty();
    assertThat(validator.normalizeEmail(" ")).isEmpty();
    assertThat(validator.normalizeEmail(null)).isEmpty();
  }

  @Test
  void normalizePhoneUsesDefaultRegion() {
    assertThat(validator.normalizePhone("0412 345 678")).contains("+61412345678");
    assertThat(validator.normalizePhone("+61 412 345 678")).contains("+61412345678");
  }

  @Test
  void normalizePhoneRejectsInvalidNumbers() {
    assertThat(validator.normalizePhone("12")).isEmpty();
    assertThat(validator.normalizePhone("call me")).isEmpty();
  }

  @Test
  void isE164AcceptsOnlyCanonicalForm() {
    assertThat(validator.isE164("+61412345678")).isTrue();
    assertThat(validator.isE164("+61 412 345 678")).isFalse();
    assertThat(validator.isE164("0412345678")).isFalse();
    assertThat(validator.isE164(null)).isFalse();
  }
}
