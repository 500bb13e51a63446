package com.devos.notification.repository;

import static com.devos.common.JdbcTimestampUtils.toInstant;
import static com.devos.common.JdbcTimestampUtils.toTimestamp;

import com.devos.notification.model.InAppNotificationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class InAppNotificationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(InAppNotificationRecord record) {
    final String sql =
        """
        INSERT INTO in_app_notifications (
          notification_id,
          user_id,
          workspace_id,
          type,
          title,
          message,
          payload_json,
          read_at,
          created_at
        ) VALUES (
          :notificationId,
          :userId,
          :workspaceId,
          :type,
          :title,
          :message,
          :payloadJson::jsonb,
          :readAt,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("userId", record.userId())
            .addValue("workspaceId", record.workspaceId())
            .addValue("type", record.type())
            .addValue("title", record.title())
            .addValue("message", record.message())
            .addValue("payloadJson", record.payloadJson())
            .addValue("readAt", toTimestamp(record.readAt()))
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public List<InAppNotificationRecord> findByUserIdAndWorkspaceId(
      String userId, String workspaceId, int limit) {
    final String sql =
        """
        SELECT notification_id, user_id, workspace_id, type, title, message,
               payload_json::text AS payload_json_text, read_at, created_at
        FROM in_app_notifications
        WHERE user_id = :userId
          AND workspace_id = :workspaceId
        ORDER BY created_at DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("workspaceId", workspaceId)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private InAppNotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new InAppNotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("user_id"),
        rs.getString("workspace_id"),
        rs.getString("type"),
        rs.getString("title"),
        rs.getString("message"),
        rs.getString("payload_json_text"),
        toInstant(rs.getTimestamp("read_at")),
        toInstant(rs.getTimestamp("created_at")));
  }
}
