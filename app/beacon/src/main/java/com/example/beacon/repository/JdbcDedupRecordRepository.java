/*
 * どこで: Beacon データアクセス
 * 何を: dedup_records の原子的 claim / 重複計上 / 期限切れ削除を担う
 * なぜ: INSERT ... ON CONFLICT で先行者判定を 1 文に閉じ込め、同時 admit を直列化するため
 */
package com.example.beacon.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.beacon.model.DedupRecord;
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
public class JdbcDedupRecordRepository implements DedupRecordRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Optional<DedupRecord> tryClaim(
      String dedupKey, UUID alertId, Instant now, Instant expiresAt) {
    // 期限切れ行だけを上書きする。有効な行があると WHERE で更新されず RETURNING が空になる
    final String sql =
        """
        INSERT INTO dedup_records (
          dedup_key,
          first_alert_id,
          window_expires_at,
          duplicate_count,
          created_at
        ) VALUES (
          :dedupKey,
          :alertId,
          :expiresAt,
          0,
          :now
        )
        ON CONFLICT (dedup_key) DO UPDATE
        SET first_alert_id = EXCLUDED.first_alert_id,
            window_expires_at = EXCLUDED.window_expires_at,
            duplicate_count = 0,
            created_at = EXCLUDED.created_at
        WHERE dedup_records.window_expires_at <= :now
        RETURNING dedup_key, first_alert_id, window_expires_at, duplicate_count, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("dedupKey", dedupKey)
            .addValue("alertId", alertId)
            .addValue("expiresAt", toTimestamp(expiresAt))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<DedupRecord> find(String dedupKey) {
    final String sql =
        """
        SELECT dedup_key, first_alert_id, window_expires_at, duplicate_count, created_at
        FROM dedup_records
        WHERE dedup_key = :dedupKey
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("dedupKey", dedupKey);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public void registerDuplicate(String dedupKey, Instant expiresAt, boolean extendWindow) {
    final String sql =
        extendWindow
            ? """
              UPDATE dedup_records
              SET duplicate_count = duplicate_count + 1,
                  window_expires_at = GREATEST(window_expires_at, :expiresAt)
              WHERE dedup_key = :dedupKey
              """
            : """
              UPDATE dedup_records
              SET duplicate_count = duplicate_count + 1
              WHERE dedup_key = :dedupKey
              """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("dedupKey", dedupKey)
            .addValue("expiresAt", toTimestamp(expiresAt));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public int deleteExpired(Instant now) {
    final String sql = "DELETE FROM dedup_records WHERE window_expires_at <= :now";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private DedupRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DedupRecord(
        rs.getString("dedup_key"),
        UUID.fromString(rs.getString("first_alert_id")),
        rs.getTimestamp("window_expires_at").toInstant(),
        rs.getInt("duplicate_count"),
        rs.getTimestamp("created_at").toInstant());
  }
}
