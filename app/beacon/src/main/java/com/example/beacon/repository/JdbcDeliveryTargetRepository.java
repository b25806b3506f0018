/*
 * どこで: Beacon データアクセス
 * 何を: delivery_targets の登録/claim/状態遷移/照会を担う
 * なぜ: 配信キューを DB に永続化し、ワーカー間で同じ target を二重送信しないため
 */
package com.example.beacon.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.beacon.model.Channel;
import com.example.beacon.model.DeliveryStatus;
import com.example.beacon.model.DeliveryTarget;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcDeliveryTargetRepository implements DeliveryTargetRepository {

  private static final String COLUMNS =
      """
      target_id, alert_id, subscriber_id, channel, destination, status,
      attempt_count, next_attempt_at, locked_by, lease_until, last_error,
      created_at, sent_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public int insertIfAbsent(List<DeliveryTarget> targets) {
    if (targets.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO delivery_targets (
          target_id,
          alert_id,
          subscriber_id,
          channel,
          destination,
          status,
          attempt_count,
          next_attempt_at,
          created_at
        ) VALUES (
          :targetId,
          :alertId,
          :subscriberId,
          :channel,
          :destination,
          :status,
          :attemptCount,
          :nextAttemptAt,
          :createdAt
        )
        ON CONFLICT (alert_id, subscriber_id, channel) DO NOTHING
        """;
    final MapSqlParameterSource[] batch =
        targets.stream()
            .map(
                target ->
                    new MapSqlParameterSource()
                        .addValue("targetId", target.targetId())
                        .addValue("alertId", target.alertId())
                        .addValue("subscriberId", target.subscriberId())
                        .addValue("channel", target.channel().name())
                        .addValue("destination", target.destination())
                        .addValue("status", target.status().name())
                        .addValue("attemptCount", target.attemptCount())
                        .addValue("nextAttemptAt", toTimestamp(target.nextAttemptAt()))
                        .addValue("createdAt", toTimestamp(target.createdAt())))
            .toArray(MapSqlParameterSource[]::new);
    final int[] counts = jdbcTemplate.batchUpdate(sql, batch);
    // ドライバが SUCCESS_NO_INFO(-2) を返す場合は件数に数えない
    return Arrays.stream(counts).filter(count -> count > 0).sum();
  }

  @Override
  public List<DeliveryTarget> claimDue(
      Channel channel, int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // 期限到来の PENDING と lease 切れの IN_FLIGHT をまとめて claim し、SKIP LOCKED で競合を避ける
    final String sql =
        """
        WITH cte AS (
          SELECT target_id
          FROM delivery_targets
          WHERE channel = :channel
            AND (
              (status = 'PENDING' AND (next_attempt_at IS NULL OR next_attempt_at <= :now))
              OR (status = 'IN_FLIGHT' AND (lease_until IS NULL OR lease_until <= :now))
            )
          ORDER BY COALESCE(next_attempt_at, created_at), created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE delivery_targets t
        SET status = 'IN_FLIGHT',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM cte
        WHERE t.target_id = cte.target_id
        RETURNING t.target_id, t.alert_id, t.subscriber_id, t.channel, t.destination, t.status,
                  t.attempt_count, t.next_attempt_at, t.locked_by, t.lease_until, t.last_error,
                  t.created_at, t.sent_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("channel", channel.name())
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public int markSent(UUID targetId, Instant sentAt, String lockedBy) {
    final String sql =
        """
        UPDATE delivery_targets
        SET status = 'SENT',
            sent_at = :sentAt,
            next_attempt_at = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE target_id = :targetId
          AND status = 'IN_FLIGHT'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("targetId", targetId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int markRetry(
      UUID targetId, int attemptCount, Instant nextAttemptAt, String lastError, String lockedBy) {
    final String sql =
        """
        UPDATE delivery_targets
        SET status = 'PENDING',
            attempt_count = :attemptCount,
            next_attempt_at = :nextAttemptAt,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE target_id = :targetId
          AND status = 'IN_FLIGHT'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptCount", attemptCount)
            .addValue("nextAttemptAt", toTimestamp(nextAttemptAt))
            .addValue("lastError", lastError)
            .addValue("targetId", targetId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int markExhausted(UUID targetId, int attemptCount, String lastError, String lockedBy) {
    final String sql =
        """
        UPDATE delivery_targets
        SET status = 'EXHAUSTED',
            attempt_count = :attemptCount,
            next_attempt_at = NULL,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE target_id = :targetId
          AND status = 'IN_FLIGHT'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptCount", attemptCount)
            .addValue("lastError", lastError)
            .addValue("targetId", targetId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int markWithdrawn(UUID targetId, String lockedBy) {
    final String sql =
        """
        UPDATE delivery_targets
        SET status = 'WITHDRAWN',
            next_attempt_at = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE target_id = :targetId
          AND status = 'IN_FLIGHT'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("targetId", targetId).addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int release(UUID targetId, Instant nextAttemptAt, String lockedBy) {
    final String sql =
        """
        UPDATE delivery_targets
        SET status = 'PENDING',
            next_attempt_at = :nextAttemptAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE target_id = :targetId
          AND status = 'IN_FLIGHT'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("nextAttemptAt", toTimestamp(nextAttemptAt))
            .addValue("targetId", targetId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int withdrawPending(UUID alertId) {
    final String sql =
        """
        UPDATE delivery_targets
        SET status = 'WITHDRAWN',
            next_attempt_at = NULL
        WHERE alert_id = :alertId
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("alertId", alertId);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public List<DeliveryTarget> findByAlertId(UUID alertId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM delivery_targets
            WHERE alert_id = :alertId
            ORDER BY subscriber_id, channel
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("alertId", alertId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public int countActive() {
    final String sql =
        "SELECT COUNT(*) FROM delivery_targets WHERE status IN ('PENDING', 'IN_FLIGHT')";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  @Override
  public int countStaleActive(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM delivery_targets
        WHERE created_at < :threshold
          AND status IN ('PENDING', 'IN_FLIGHT')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private DeliveryTarget mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeliveryTarget(
        UUID.fromString(rs.getString("target_id")),
        UUID.fromString(rs.getString("alert_id")),
        rs.getString("subscriber_id"),
        Channel.valueOf(rs.getString("channel")),
        rs.getString("destination"),
        DeliveryStatus.valueOf(rs.getString("status")),
        rs.getInt("attempt_count"),
        toInstant(rs.getTimestamp("next_attempt_at")),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("lease_until")),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("sent_at")));
  }
}
