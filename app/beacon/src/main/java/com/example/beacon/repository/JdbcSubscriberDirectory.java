/*
 * どこで: Beacon データアクセス
 * 何を: subscribers / subscriber_regions / subscriber_hazard_types の検索と保存を担う
 * なぜ: fan-out が 1 回の読み取りで一貫した購読者集合を得られるようにするため
 */
package com.example.beacon.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.beacon.channel.ContactValidator;
import com.example.beacon.model.Severity;
import com.example.beacon.model.Subscriber;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JdbcSubscriberDirectory implements SubscriberDirectory {

  private static final String SELECT_COLUMNS =
      """
      SELECT s.subscriber_id, s.email, s.phone, s.email_opt_in, s.sms_opt_in,
             s.minimum_severity, s.active,
             ARRAY(SELECT r.region FROM subscriber_regions r
                   WHERE r.subscriber_id = s.subscriber_id ORDER BY r.region) AS regions,
             ARRAY(SELECT h.hazard_type FROM subscriber_hazard_types h
                   WHERE h.subscriber_id = s.subscriber_id ORDER BY h.hazard_type) AS hazard_types
      FROM subscribers s
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ContactValidator contactValidator;
  private final Clock clock;

  @Override
  public List<Subscriber> findSubscribers(String region, String hazardType) {
    // 地域/種別の絞り込みと連絡先の取得を単一 SQL にまとめ、途中状態を読まないようにする
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE s.active = TRUE
              AND EXISTS (
                SELECT 1 FROM subscriber_regions r
                WHERE r.subscriber_id = s.subscriber_id AND r.region = :region)
              AND (
                NOT EXISTS (
                  SELECT 1 FROM subscriber_hazard_types h
                  WHERE h.subscriber_id = s.subscriber_id)
                OR EXISTS (
                  SELECT 1 FROM subscriber_hazard_types h
                  WHERE h.subscriber_id = s.subscriber_id AND h.hazard_type = :hazardType))
            ORDER BY s.subscriber_id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("region", region).addValue("hazardType", hazardType);
    try {
      return jdbcTemplate.query(sql, params, this::mapRow);
    } catch (DataAccessException ex) {
      throw new DirectoryUnavailableException("subscriber directory lookup failed", ex);
    }
  }

  @Override
  public Optional<Subscriber> findById(String subscriberId) {
    final String sql = SELECT_COLUMNS + "WHERE s.subscriber_id = :subscriberId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("subscriberId", subscriberId);
    try {
      return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
    } catch (DataAccessException ex) {
      throw new DirectoryUnavailableException("subscriber directory lookup failed", ex);
    }
  }

  @Override
  @Transactional
  public void save(Subscriber subscriber) {
    if (subscriber.subscriberId() == null || subscriber.subscriberId().isBlank()) {
      throw new IllegalArgumentException("subscriberId is required");
    }
    final String email = normalizeEmail(subscriber.email());
    final String phone = normalizePhone(subscriber.phone());
    final Instant now = Instant.now(clock);
    final String sql =
        """
        INSERT INTO subscribers (
          subscriber_id,
          email,
          phone,
          email_opt_in,
          sms_opt_in,
          minimum_severity,
          active,
          created_at,
          updated_at
        ) VALUES (
          :subscriberId,
          :email,
          :phone,
          :emailOptIn,
          :smsOptIn,
          :minimumSeverity,
          :active,
          :now,
          :now
        )
        ON CONFLICT (subscriber_id) DO UPDATE
        SET email = EXCLUDED.email,
            phone = EXCLUDED.phone,
            email_opt_in = EXCLUDED.email_opt_in,
            sms_opt_in = EXCLUDED.sms_opt_in,
            minimum_severity = EXCLUDED.minimum_severity,
            active = EXCLUDED.active,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriberId", subscriber.subscriberId())
            .addValue("email", email)
            .addValue("phone", phone)
            .addValue("emailOptIn", subscriber.emailOptIn())
            .addValue("smsOptIn", subscriber.smsOptIn())
            .addValue("minimumSeverity", subscriber.minimumSeverity().name())
            .addValue("active", subscriber.active())
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
    replaceChildren(
        "subscriber_regions", "region", subscriber.subscriberId(), subscriber.regions());
    replaceChildren(
        "subscriber_hazard_types",
        "hazard_type",
        subscriber.subscriberId(),
        subscriber.hazardTypes());
  }

  private void replaceChildren(
      String table, String column, String subscriberId, Set<String> values) {
    final MapSqlParameterSource idParams =
        new MapSqlParameterSource().addValue("subscriberId", subscriberId);
    jdbcTemplate.update(
        "DELETE FROM " + table + " WHERE subscriber_id = :subscriberId", idParams);
    final String insertSql =
        "INSERT INTO " + table + " (subscriber_id, " + column + ") VALUES (:subscriberId, :value)";
    final MapSqlParameterSource[] batch =
        values.stream()
            .map(
                value ->
                    new MapSqlParameterSource()
                        .addValue("subscriberId", subscriberId)
                        .addValue("value", value))
            .toArray(MapSqlParameterSource[]::new);
    if (batch.length > 0) {
      jdbcTemplate.batchUpdate(insertSql, batch);
    }
  }

  private String normalizeEmail(String email) {
    if (email == null || email.isBlank()) {
      return null;
    }
    return contactValidator
        .normalizeEmail(email)
        .orElseThrow(() -> new IllegalArgumentException("email is invalid"));
  }

  private String normalizePhone(String phone) {
    if (phone == null || phone.isBlank()) {
      return null;
    }
    return contactValidator
        .normalizePhone(phone)
        .orElseThrow(() -> new IllegalArgumentException("phone is invalid"));
  }

  private Subscriber mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Subscriber(
        rs.getString("subscriber_id"),
        rs.getString("email"),
        rs.getString("phone"),
        toSet(rs.getArray("regions")),
        toSet(rs.getArray("hazard_types")),
        rs.getBoolean("email_opt_in"),
        rs.getBoolean("sms_opt_in"),
        Severity.valueOf(rs.getString("minimum_severity")),
        rs.getBoolean("active"));
  }

  private Set<String> toSet(Array array) throws SQLException {
    if (array == null) {
      return Set.of();
    }
    final Object[] values = (Object[]) array.getArray();
    return Arrays.stream(values).map(String::valueOf).collect(Collectors.toSet());
  }
}
