/*
 * どこで: Notification データアクセス
 * 何を: chat_integrations テーブルから連携設定を取得し、健全性を更新する
 * なぜ: webhook 送信の可否判定と連続失敗カウンタを永続化するため
 */
package com.devos.notification.repository;

import static com.devos.common.JdbcTimestampUtils.toInstant;
import static com.devos.common.JdbcTimestampUtils.toTimestamp;

import com.devos.notification.model.ChatIntegrationRecord;
import com.devos.notification.model.IntegrationStatus;
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
public class ChatIntegrationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<ChatIntegrationRecord> findByWorkspaceIdAndProvider(
      String workspaceId, String provider) {
    final String sql =
        """
        SELECT integration_id, workspace_id, provider, webhook_url, webhook_id, channel_name,
               status, error_count, rate_limit_per_minute, last_error, last_error_at,
               last_message_at, message_count
        FROM chat_integrations
        WHERE workspace_id = :workspaceId
          AND provider = :provider
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("workspaceId", workspaceId).addValue("provider", provider);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public void insert(ChatIntegrationRecord record, Instant createdAt) {
    final String sql =
        """
        INSERT INTO chat_integrations (
          integration_id, workspace_id, provider, webhook_url, webhook_id, channel_name,
          status, error_count, rate_limit_per_minute, last_error, last_error_at,
          last_message_at, message_count, created_at
        ) VALUES (
          :integrationId, :workspaceId, :provider, :webhookUrl, :webhookId, :channelName,
          :status, :errorCount, :rateLimitPerMinute, :lastError, :lastErrorAt,
          :lastMessageAt, :messageCount, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("integrationId", record.integrationId())
            .addValue("workspaceId", record.workspaceId())
            .addValue("provider", record.provider())
            .addValue("webhookUrl", record.webhookUrl())
            .addValue("webhookId", record.webhookId())
            .addValue("channelName", record.channelName())
            .addValue("status", record.status().name())
            .addValue("errorCount", record.errorCount())
            .addValue("rateLimitPerMinute", record.rateLimitPerMinute())
            .addValue("lastError", record.lastError())
            .addValue("lastErrorAt", toTimestamp(record.lastErrorAt()))
            .addValue("lastMessageAt", toTimestamp(record.lastMessageAt()))
            .addValue("messageCount", record.messageCount())
            .addValue("createdAt", toTimestamp(createdAt));
    jdbcTemplate.update(sql, params);
  }

  /** 送信成功時: 連続失敗カウンタを 0 に戻し、最終送信時刻と送信数を更新する。 */
  public int recordSuccess(UUID integrationId, Instant sentAt) {
    final String sql =
        """
        UPDATE chat_integrations
        SET error_count = 0,
            last_message_at = :sentAt,
            message_count = message_count + 1
        WHERE integration_id = :integrationId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("integrationId", integrationId);
    return jdbcTemplate.update(sql, params);
  }

  public int updateHealth(
      UUID integrationId,
      IntegrationStatus status,
      int errorCount,
      String lastError,
      Instant lastErrorAt) {
    final String sql =
        """
        UPDATE chat_integrations
        SET status = :status,
            error_count = :errorCount,
            last_error = :lastError,
            last_error_at = :lastErrorAt
        WHERE integration_id = :integrationId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("errorCount", errorCount)
            .addValue("lastError", lastError)
            .addValue("lastErrorAt", toTimestamp(lastErrorAt))
            .addValue("integrationId", integrationId);
    return jdbcTemplate.update(sql, params);
  }

  private ChatIntegrationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ChatIntegrationRecord(
        UUID.fromString(rs.getString("integration_id")),
        rs.getString("workspace_id"),
        rs.getString("provider"),
        rs.getString("webhook_url"),
        rs.getString("webhook_id"),
        rs.getString("channel_name"),
        IntegrationStatus.valueOf(rs.getString("status")),
        rs.getInt("error_count"),
        rs.getInt("rate_limit_per_minute"),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("last_error_at")),
        toInstant(rs.getTimestamp("last_message_at")),
        rs.getLong("message_count"));
  }
}
