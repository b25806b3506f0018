/*
 * どこで: Beacon チャネル層
 * 何を: メールアドレスと電話番号を検証し正規形 (小文字ドメイン / E.164) に揃える
 * なぜ: 登録時と送信時で同じ基準を使い、不正な宛先を恒久失敗として早期に弾くため
 */
package com.example.beacon.channel;

import com.example.beacon.config.BeaconContactProperties;
import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.Phonenumber.PhoneNumber;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ContactValidator {

  private static final PhoneNumberUtil PHONE_NUMBER_UTIL = PhoneNumberUtil.getInstance();

  private final BeaconContactProperties properties;

  public Optional<String> normalizeEmail(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      final InternetAddress address = new InternetAddress(raw.trim(), true);
      address.validate();
      final String value = address.getAddress();
      final int at = value.lastIndexOf('@');
      if (at <= 0 || at == value.length() - 1) {
        return Optional.empty();
      }
      // ローカル部は大文字小文字を区別しうるため、ドメインだけ小文字化する
      return Optional.of(value.substring(0, at) + value.substring(at).toLowerCase(Locale.ROOT));
    } catch (AddressException ex) {
      return Optional.empty();
    }
  }

  public Optional<String> normalizePhone(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      final PhoneNumber number = PHONE_NUMBER_UTIL.parse(raw.trim(), properties.defaultRegion());
      if (!PHONE_NUMBER_UTIL.isValidNumber(number)) {
        return Optional.empty();
      }
      return Optional.of(PHONE_NUMBER_UTIL.format(number, PhoneNumberUtil.PhoneNumberFormat.E164));
    } catch (NumberParseException ex) {
      return Optional.empty();
    }
  }

  /** 送信直前の確認用。既に E.164 で保存された値だけを受け付ける。 */
  public boolean isE164(String phone) {
    if (phone == null || !phone.startsWith("+")) {
      return false;
    }
    return normalizePhone(phone).filter(phone::equals).isPresent();
  }
}
