package com.devos.notification.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.devos.notification.AbstractPostgresContainerTest;
import com.devos.notification.model.ChannelPreferences;
import com.devos.notification.model.NotificationPreferences;
import com.devos.notification.model.QuietHoursConfig;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationPreferencesRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant CREATED_AT = Instant.parse("2026-01-17T00:00:00Z");
  private static final Instant UPDATED_AT = Instant.parse("2026-01-18T00:00:00Z");

  @Autowired private NotificationPreferencesRepository preferencesRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notification_preferences", new MapSqlParameterSource());
  }

  @Test
  void saveAndFindRoundTripsJsonColumns() {
    final NotificationPreferences preferences =
        new NotificationPreferences(
            "user-1",
            "ws-1",
            true,
            Map.of("storyCompletions", false),
            new ChannelPreferences(false, true, false),
            Map.of("agent_message", new ChannelPreferences(true, true, false)),
            new QuietHoursConfig(true, "23:00", "07:00", "Asia/Tokyo", true),
            CREATED_AT,
            CREATED_AT);

    preferencesRepository.save(preferences);

    assertThat(preferencesRepository.findByUserIdAndWorkspaceId("user-1", "ws-1"))
        .contains(preferences);
  }

  @Test
  void saveUpsertKeepsOriginalCreatedAt() {
    preferencesRepository.save(defaults("user-1", "ws-1", true, CREATED_AT));

    preferencesRepository.save(defaults("user-1", "ws-1", false, UPDATED_AT));

    final NotificationPreferences stored =
        preferencesRepository.findByUserIdAndWorkspaceId("user-1", "ws-1").orElseThrow();
    assertThat(stored.enabled()).isFalse();
    assertThat(stored.createdAt()).isEqualTo(CREATED_AT);
    assertThat(stored.updatedAt()).isEqualTo(UPDATED_AT);
  }

  @Test
  void findByUserIdListsEveryWorkspaceAndDeleteRemovesOne() {
    preferencesRepository.save(defaults("user-1", "ws-b", true, CREATED_AT));
    preferencesRepository.save(defaults("user-1", "ws-a", true, CREATED_AT));

    assertThat(preferencesRepository.findByUserId("user-1"))
        .extracting(NotificationPreferences::workspaceId)
        .containsExactly("ws-a", "ws-b");
    assertThat(preferencesRepository.delete("user-1", "ws-a")).isEqualTo(1);
    assertThat(preferencesRepository.findByUserIdAndWorkspaceId("user-1", "ws-a")).isEmpty();
  }

  private NotificationPreferences defaults(
      String userId, String workspaceId, boolean enabled, Instant timestamp) {
    return new NotificationPreferences(
        userId, workspaceId, enabled, Map.of(), null, Map.of(), null, timestamp, timestamp);
  }
}
