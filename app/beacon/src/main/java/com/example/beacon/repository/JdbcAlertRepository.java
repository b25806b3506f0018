/*
 * どこで: Beacon データアクセス
 * 何を: alerts / alert_duplicates / alert_withdrawals の登録と取得を担う
 * なぜ: intake・取り下げ・ステータス照会・保持期限処理を支えるため
 */
package com.example.beacon.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.beacon.model.Alert;
import com.example.beacon.model.AlertWithdrawal;
import com.example.beacon.model.Severity;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcAlertRepository implements AlertRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void insert(Alert alert) {
    final String sql =
        """
        INSERT INTO alerts (
          alert_id,
          hazard_type,
          geographic_region,
          severity,
          reported_at,
          dedup_key,
          source,
          description,
          created_at
        ) VALUES (
          :alertId,
          :hazardType,
          :geographicRegion,
          :severity,
          :reportedAt,
          :dedupKey,
          :source,
          :description,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("alertId", alert.alertId())
            .addValue("hazardType", alert.hazardType())
            .addValue("geographicRegion", alert.geographicRegion())
            .addValue("severity", alert.severity().name())
            .addValue("reportedAt", toTimestamp(alert.reportedAt()))
            .addValue("dedupKey", alert.dedupKey())
            .addValue("source", alert.source())
            .addValue("description", alert.description())
            .addValue("createdAt", toTimestamp(alert.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public Optional<Alert> findById(UUID alertId) {
    final String sql =
        """
        SELECT alert_id, hazard_type, geographic_region, severity, reported_at,
               dedup_key, source, description, created_at
        FROM alerts
        WHERE alert_id = :alertId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("alertId", alertId);
    return jdbcTemplate.query(sql, params, this::mapAlert).stream().findFirst();
  }

  @Override
  public void recordDuplicate(UUID alertId, UUID duplicateOf, Instant recordedAt) {
    final String sql =
        """
        INSERT INTO alert_duplicates (alert_id, duplicate_of, recorded_at)
        VALUES (:alertId, :duplicateOf, :recordedAt)
        ON CONFLICT (alert_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("alertId", alertId)
            .addValue("duplicateOf", duplicateOf)
            .addValue("recordedAt", toTimestamp(recordedAt));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public Optional<UUID> findDuplicateOf(UUID alertId) {
    final String sql = "SELECT duplicate_of FROM alert_duplicates WHERE alert_id = :alertId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("alertId", alertId);
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("duplicate_of")))
        .stream()
        .findFirst();
  }

  @Override
  public boolean insertWithdrawal(AlertWithdrawal withdrawal) {
    final String sql =
        """
        INSERT INTO alert_withdrawals (alert_id, reason, withdrawn_at)
        VALUES (:alertId, :reason, :withdrawnAt)
        ON CONFLICT (alert_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("alertId", withdrawal.alertId())
            .addValue("reason", withdrawal.reason())
            .addValue("withdrawnAt", toTimestamp(withdrawal.withdrawnAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }

  @Override
  public Optional<AlertWithdrawal> findWithdrawal(UUID alertId) {
    final String sql =
        "SELECT alert_id, reason, withdrawn_at FROM alert_withdrawals WHERE alert_id = :alertId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("alertId", alertId);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new AlertWithdrawal(
                    UUID.fromString(rs.getString("alert_id")),
                    rs.getString("reason"),
                    rs.getTimestamp("withdrawn_at").toInstant()))
        .stream()
        .findFirst();
  }

  @Override
  public int deleteSettledOlderThan(Instant threshold) {
    // 配信中の target を持つ Alert は残し、子テーブルは ON DELETE CASCADE で消す
    final String sql =
        """
        DELETE FROM alerts a
        WHERE a.created_at < :threshold
          AND NOT EXISTS (
            SELECT 1 FROM delivery_targets t
            WHERE t.alert_id = a.alert_id
              AND t.status IN ('PENDING', 'IN_FLIGHT'))
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private Alert mapAlert(ResultSet rs, int rowNum) throws SQLException {
    return new Alert(
        UUID.fromString(rs.getString("alert_id")),
        rs.getString("hazard_type"),
        rs.getString("geographic_region"),
        Severity.valueOf(rs.getString("severity")),
        rs.getTimestamp("reported_at").toInstant(),
        rs.getString("dedup_key"),
        rs.getString("source"),
        rs.getString("description"),
        rs.getTimestamp("created_at").toInstant());
  }
}
