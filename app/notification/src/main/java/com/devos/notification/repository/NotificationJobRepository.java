/*
 * どこで: Notification データアクセス
 * 何を: notification_jobs テーブル(永続ジョブキュー)の登録/claim/更新を担う
 * なぜ: 再送ジョブをプロセス再起動後も失わずに複数ワーカーで分担するため
 */
package com.devos.notification.repository;

import static com.devos.common.JdbcTimestampUtils.toInstant;
import static com.devos.common.JdbcTimestampUtils.toTimestamp;

import com.devos.notification.model.JobStatus;
import com.devos.notification.model.NotificationJobRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationJobRepository {

  private static final String RETURNING_COLUMNS =
      """
      n.job_id, n.job_type, n.payload_json::text AS payload_json_text, n.status,
      n.locked_by, n.locked_at, n.lease_until,
      n.attempt_count, n.max_attempts, n.backoff_base_ms, n.next_retry_at,
      n.last_error, n.created_at, n.completed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationJobRecord record) {
    final String sql =
        """
        INSERT INTO notification_jobs (
          job_id,
          job_type,
          payload_json,
          status,
          locked_by,
          locked_at,
          lease_until,
          attempt_count,
          max_attempts,
          backoff_base_ms,
          next_retry_at,
          last_error,
          created_at,
          completed_at
        ) VALUES (
          :jobId,
          :jobType,
          :payloadJson::jsonb,
          :status,
          :lockedBy,
          :lockedAt,
          :leaseUntil,
          :attemptCount,
          :maxAttempts,
          :backoffBaseMs,
          :nextRetryAt,
          :lastError,
          :createdAt,
          :completedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", record.jobId())
            .addValue("jobType", record.jobType())
            .addValue("payloadJson", record.payloadJson())
            .addValue("status", record.status().name())
            .addValue("lockedBy", record.lockedBy())
            .addValue("lockedAt", toTimestamp(record.lockedAt()))
            .addValue("leaseUntil", toTimestamp(record.leaseUntil()))
            .addValue("attemptCount", record.attemptCount())
            .addValue("maxAttempts", record.maxAttempts())
            .addValue("backoffBaseMs", record.backoffBaseMillis())
            .addValue("nextRetryAt", toTimestamp(record.nextRetryAt()))
            .addValue("lastError", record.lastError())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("completedAt", toTimestamp(record.completedAt()));
    jdbcTemplate.update(sql, params);
    return record.jobId();
  }

  public List<NotificationJobRecord> claimPendingForUpdate(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // PENDING と lease 切れの PROCESSING をまとめて claim し、競合を避ける
    final String sql =
        """
        WITH cte AS (
          SELECT job_id
          FROM notification_jobs
          WHERE (
            status = 'PENDING'
            AND (next_retry_at IS NULL OR next_retry_at <= :now)
          )
          OR (
            status = 'PROCESSING'
            AND (lease_until IS NULL OR lease_until <= :now)
          )
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notification_jobs n
        SET status = 'PROCESSING',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM cte
        WHERE n.job_id = cte.job_id
        RETURNING
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markCompleted(UUID jobId, Instant completedAt, String lockedBy) {
    final String sql =
        """
        UPDATE notification_jobs
        SET status = 'COMPLETED',
            completed_at = :completedAt,
            next_retry_at = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markRetry(
      UUID jobId,
      int attemptCount,
      Instant nextRetryAt,
      boolean failed,
      String lastError,
      String lockedBy) {
    final String sql =
        """
        UPDATE notification_jobs
        SET status = :status,
            attempt_count = :attemptCount,
            next_retry_at = :nextRetryAt,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", failed ? JobStatus.FAILED.name() : JobStatus.PENDING.name())
            .addValue("attemptCount", attemptCount)
            .addValue("nextRetryAt", failed ? null : toTimestamp(nextRetryAt))
            .addValue("lastError", lastError)
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteFinishedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notification_jobs
        WHERE created_at < :threshold
          AND status IN ('COMPLETED', 'FAILED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countActive() {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_jobs
        WHERE status IN ('PENDING', 'PROCESSING')
        """;
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public List<NotificationJobRecord> findByJobType(String jobType) {
    final String sql =
        """
        SELECT
        """
            + RETURNING_COLUMNS
            + """
            FROM notification_jobs n
            WHERE n.job_type = :jobType
            ORDER BY n.created_at
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobType", jobType);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private NotificationJobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationJobRecord(
        UUID.fromString(rs.getString("job_id")),
        rs.getString("job_type"),
        rs.getString("payload_json_text"),
        JobStatus.valueOf(rs.getString("status")),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("lease_until")),
        rs.getInt("attempt_count"),
        rs.getInt("max_attempts"),
        rs.getLong("backoff_base_ms"),
        toInstant(rs.getTimestamp("next_retry_at")),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("completed_at")));
  }
}
