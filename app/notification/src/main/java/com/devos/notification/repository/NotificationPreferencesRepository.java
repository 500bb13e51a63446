/*
 * どこで: Notification データアクセス
 * 何を: notification_preferences テーブルの取得/upsert/削除を担う
 * なぜ: Preference Store の永続層を SQL で明示的に扱うため
 */
package com.devos.notification.repository;

import static com.devos.common.JdbcTimestampUtils.toInstant;
import static com.devos.common.JdbcTimestampUtils.toTimestamp;

import com.devos.notification.model.ChannelPreferences;
import com.devos.notification.model.NotificationPreferences;
import com.devos.notification.model.QuietHoursConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationPreferencesRepository {

  private static final TypeReference<Map<String, Boolean>> EVENT_SETTINGS_TYPE =
      new TypeReference<>() {};
  private static final TypeReference<Map<String, ChannelPreferences>> OVERRIDES_TYPE =
      new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public Optional<NotificationPreferences> findByUserIdAndWorkspaceId(
      String userId, String workspaceId) {
    final String sql =
        """
        SELECT user_id, workspace_id, enabled,
               event_settings::text AS event_settings_text,
               channel_preferences::text AS channel_preferences_text,
               per_type_channel_overrides::text AS per_type_channel_overrides_text,
               quiet_hours::text AS quiet_hours_text,
               created_at, updated_at
        FROM notification_preferences
        WHERE user_id = :userId
          AND workspace_id = :workspaceId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("workspaceId", workspaceId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NotificationPreferences> findByUserId(String userId) {
    final String sql =
        """
        SELECT user_id, workspace_id, enabled,
               event_settings::text AS event_settings_text,
               channel_preferences::text AS channel_preferences_text,
               per_type_channel_overrides::text AS per_type_channel_overrides_text,
               quiet_hours::text AS quiet_hours_text,
               created_at, updated_at
        FROM notification_preferences
        WHERE user_id = :userId
        ORDER BY workspace_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public void save(NotificationPreferences preferences) {
    // (user_id, workspace_id) の一意制約で upsert し、created_at は初回値を維持する
    final String sql =
        """
        INSERT INTO notification_preferences (
          user_id,
          workspace_id,
          enabled,
          event_settings,
          channel_preferences,
          per_type_channel_overrides,
          quiet_hours,
          created_at,
          updated_at
        ) VALUES (
          :userId,
          :workspaceId,
          :enabled,
          :eventSettings::jsonb,
          :channelPreferences::jsonb,
          :perTypeChannelOverrides::jsonb,
          :quietHours::jsonb,
          :createdAt,
          :updatedAt
        )
        ON CONFLICT (user_id, workspace_id) DO UPDATE
        SET enabled = EXCLUDED.enabled,
            event_settings = EXCLUDED.event_settings,
            channel_preferences = EXCLUDED.channel_preferences,
            per_type_channel_overrides = EXCLUDED.per_type_channel_overrides,
            quiet_hours = EXCLUDED.quiet_hours,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", preferences.userId())
            .addValue("workspaceId", preferences.workspaceId())
            .addValue("enabled", preferences.enabled())
            .addValue("eventSettings", writeJson(preferences.eventSettings()))
            .addValue("channelPreferences", writeJson(preferences.channelPreferences()))
            .addValue("perTypeChannelOverrides", writeJson(preferences.perTypeChannelOverrides()))
            .addValue("quietHours", writeJson(preferences.quietHours()))
            .addValue("createdAt", toTimestamp(preferences.createdAt()))
            .addValue("updatedAt", toTimestamp(preferences.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  public int delete(String userId, String workspaceId) {
    final String sql =
        """
        DELETE FROM notification_preferences
        WHERE user_id = :userId
          AND workspace_id = :workspaceId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("workspaceId", workspaceId);
    return jdbcTemplate.update(sql, params);
  }

  private NotificationPreferences mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationPreferences(
        rs.getString("user_id"),
        rs.getString("workspace_id"),
        rs.getBoolean("enabled"),
        readJson(rs.getString("event_settings_text"), EVENT_SETTINGS_TYPE),
        readJson(rs.getString("channel_preferences_text"), ChannelPreferences.class),
        readJson(rs.getString("per_type_channel_overrides_text"), OVERRIDES_TYPE),
        readJson(rs.getString("quiet_hours_text"), QuietHoursConfig.class),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize notification preferences column", ex);
    }
  }

  private <T> T readJson(String json, Class<T> type) throws SQLException {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new SQLException("invalid json column for " + type.getSimpleName(), ex);
    }
  }

  private <T> T readJson(String json, TypeReference<T> type) throws SQLException {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new SQLException("invalid json column", ex);
    }
  }
}
