/*
 * どこで: Beacon データアクセス
 * 何を: delivery_audit (配信断念の監査記録) の登録を担う
 * なぜ: 恒久失敗/リトライ上限到達を隔離して運用介入を可能にするため
 */
package com.example.beacon.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.beacon.model.AuditReason;
import com.example.beacon.model.DeliveryTarget;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeliveryAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(
      UUID auditId,
      DeliveryTarget target,
      AuditReason reason,
      String errorMessage,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO delivery_audit (
          audit_id,
          target_id,
          alert_id,
          subscriber_id,
          channel,
          reason,
          error_message,
          created_at
        ) VALUES (
          :auditId,
          :targetId,
          :alertId,
          :subscriberId,
          :channel,
          :reason,
          :errorMessage,
          :createdAt
        )
        ON CONFLICT (target_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("auditId", auditId)
            .addValue("targetId", target.targetId())
            .addValue("alertId", target.alertId())
            .addValue("subscriberId", target.subscriberId())
            .addValue("channel", target.channel().name())
            .addValue("reason", reason.name())
            .addValue("errorMessage", errorMessage)
            .addValue("createdAt", toTimestamp(createdAt));
    jdbcTemplate.update(sql, params);
  }

  public int countByAlertId(UUID alertId) {
    final String sql = "SELECT COUNT(*) FROM delivery_audit WHERE alert_id = :alertId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("alertId", alertId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }
}
