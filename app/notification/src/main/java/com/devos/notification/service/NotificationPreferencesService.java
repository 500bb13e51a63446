/*
 * どこで: Notification サービス層
 * 何を: 通知設定の取得(キャッシュ付き)/遅延作成/部分更新/削除と種別・チャネル判定を行う
 * なぜ: critical 種別と in-app の不変条件を常に満たした設定だけを dispatch に渡すため
 */
package com.devos.notification.service;

import com.devos.notification.config.NotificationPreferencesProperties;
import com.devos.notification.model.ChannelPreferences;
import com.devos.notification.model.NotificationPreferences;
import com.devos.notification.model.NotificationPreferencesUpdate;
import com.devos.notification.model.NotificationPreferencesUpdate.ChannelPreferencesUpdate;
import com.devos.notification.model.NotificationPreferencesUpdate.QuietHoursUpdate;
import com.devos.notification.model.NotificationType;
import com.devos.notification.model.QuietHoursConfig;
import com.devos.notification.repository.NotificationPreferencesRepository;
import com.devos.notification.repository.PreferencesCacheRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationPreferencesService implements PreferenceStore {

  private static final Logger logger = LoggerFactory.getLogger(NotificationPreferencesService.class);
  private static final Pattern TIME_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");

  private final NotificationPreferencesRepository preferencesRepository;
  private final PreferencesCacheRepository cacheRepository;
  private final NotificationPreferencesProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /** キャッシュ → DB → 既定値作成 の順で取得する。 */
  @Override
  public NotificationPreferences getPreferences(String userId, String workspaceId) {
    final Optional<NotificationPreferences> cached = readCache(userId, workspaceId);
    if (cached.isPresent()) {
      return cached.get();
    }
    final NotificationPreferences preferences =
        preferencesRepository
            .findByUserIdAndWorkspaceId(userId, workspaceId)
            .orElseGet(() -> createDefaultPreferences(userId, workspaceId));
    writeCache(preferences);
    return preferences;
  }

  public List<NotificationPreferences> getUserPreferences(String userId) {
    return preferencesRepository.findByUserId(userId);
  }

  public NotificationPreferences createDefaultPreferences(String userId, String workspaceId) {
    final Instant now = Instant.now(clock);
    final Map<String, Boolean> eventSettings = new LinkedHashMap<>();
    for (NotificationType type : NotificationType.values()) {
      if (type.settingKey() != null) {
        eventSettings.put(type.settingKey(), true);
      }
    }
    final NotificationPreferences preferences =
        new NotificationPreferences(
            userId,
            workspaceId,
            true,
            eventSettings,
            ChannelPreferences.defaults(),
            Map.of(),
            QuietHoursConfig.defaults(),
            now,
            now);
    preferencesRepository.save(preferences);
    logger.info("notification preferences created userId={} workspaceId={}", userId, workspaceId);
    return preferences;
  }

  public NotificationPreferences updatePreferences(
      String userId, String workspaceId, NotificationPreferencesUpdate update) {
    validateUpdate(update);
    final NotificationPreferences existing = getPreferences(userId, workspaceId);
    final NotificationPreferences merged = merge(existing, update, Instant.now(clock));
    preferencesRepository.save(merged);
    writeCache(merged);
    final List<String> changedFields = changedFields(existing, merged);
    // 監査ログには変更のあったフィールド名だけを残す
    logger.info(
        "notification preferences updated userId={} workspaceId={} changedFields={}",
        userId,
        workspaceId,
        changedFields);
    return merged;
  }

  /** ワークスペース離脱時に呼ばれる。 */
  public void deletePreferences(String userId, String workspaceId) {
    preferencesRepository.delete(userId, workspaceId);
    invalidateCache(userId, workspaceId);
    logger.info("notification preferences deleted userId={} workspaceId={}", userId, workspaceId);
  }

  public void invalidateCache(String userId, String workspaceId) {
    try {
      cacheRepository.evict(userId, workspaceId);
    } catch (RuntimeException ex) {
      logger.warn(
          "failed to evict notification preferences cache userId={} workspaceId={}",
          userId,
          workspaceId,
          ex);
    }
  }

  @Override
  public boolean isTypeEnabled(String userId, String workspaceId, NotificationType type) {
    if (type.isCritical()) {
      return true;
    }
    final NotificationPreferences preferences = getPreferences(userId, workspaceId);
    if (!preferences.enabled()) {
      return false;
    }
    return checkTypePreference(preferences, type);
  }

  public boolean checkTypePreference(NotificationPreferences preferences, NotificationType type) {
    if (type.isCritical()) {
      return true;
    }
    final String settingKey = type.settingKey();
    if (settingKey == null) {
      return true;
    }
    return preferences.eventSettings().getOrDefault(settingKey, Boolean.TRUE);
  }

  @Override
  public ChannelPreferences getChannelPreferences(
      String userId, String workspaceId, NotificationType type) {
    final NotificationPreferences preferences = getPreferences(userId, workspaceId);
    final ChannelPreferences override = preferences.perTypeChannelOverrides().get(type.value());
    final ChannelPreferences effective =
        override == null ? preferences.channelPreferences() : override;
    return effective.withInAppForced();
  }

  private void validateUpdate(NotificationPreferencesUpdate update) {
    Objects.requireNonNull(update, "update");
    if (update.eventSettings() != null) {
      for (NotificationType type : NotificationType.values()) {
        if (type.isCritical()
            && Boolean.FALSE.equals(update.eventSettings().get(type.settingKey()))) {
          throw new InvalidNotificationPreferencesException(
              "critical notification type cannot be disabled: " + type.settingKey());
        }
      }
    }
    final QuietHoursUpdate quietHours = update.quietHours();
    if (quietHours != null) {
      validateTime("quietHours.startTime", quietHours.startTime());
      validateTime("quietHours.endTime", quietHours.endTime());
      if (quietHours.timezone() != null) {
        try {
          ZoneId.of(quietHours.timezone());
        } catch (DateTimeException ex) {
          throw new InvalidNotificationPreferencesException(
              "invalid quietHours.timezone: " + quietHours.timezone());
        }
      }
    }
  }

  private void validateTime(String field, String value) {
    if (value != null && !TIME_PATTERN.matcher(value).matches()) {
      throw new InvalidNotificationPreferencesException(field + " must be HH:MM: " + value);
    }
  }

  private NotificationPreferences merge(
      NotificationPreferences existing, NotificationPreferencesUpdate update, Instant now) {
    final Map<String, Boolean> eventSettings = new LinkedHashMap<>(existing.eventSettings());
    if (update.eventSettings() != null) {
      eventSettings.putAll(update.eventSettings());
    }
    // 部分更新の後で critical 種別を必ず有効に戻す
    for (NotificationType type : NotificationType.values()) {
      if (type.isCritical()) {
        eventSettings.put(type.settingKey(), true);
      }
    }

    final ChannelPreferences channels = existing.channelPreferences();
    final ChannelPreferencesUpdate channelUpdate = update.channelPreferences();
    final ChannelPreferences mergedChannels =
        channelUpdate == null
            ? channels.withInAppForced()
            : new ChannelPreferences(
                    valueOr(channelUpdate.push(), channels.push()),
                    true,
                    valueOr(channelUpdate.email(), channels.email()))
                .withInAppForced();

    final QuietHoursConfig quietHours = existing.quietHours();
    final QuietHoursUpdate quietUpdate = update.quietHours();
    final QuietHoursConfig mergedQuietHours =
        quietUpdate == null
            ? quietHours
            : new QuietHoursConfig(
                valueOr(quietUpdate.enabled(), quietHours.enabled()),
                valueOr(quietUpdate.startTime(), quietHours.startTime()),
                valueOr(quietUpdate.endTime(), quietHours.endTime()),
                valueOr(quietUpdate.timezone(), quietHours.timezone()),
                valueOr(quietUpdate.exceptCritical(), quietHours.exceptCritical()));

    return new NotificationPreferences(
        existing.userId(),
        existing.workspaceId(),
        valueOr(update.enabled(), existing.enabled()),
        eventSettings,
        mergedChannels,
        existing.perTypeChannelOverrides(),
        mergedQuietHours,
        existing.createdAt(),
        now);
  }

  private List<String> changedFields(NotificationPreferences before, NotificationPreferences after) {
    final List<String> changed = new ArrayList<>();
    if (before.enabled() != after.enabled()) {
      changed.add("enabled");
    }
    if (!before.eventSettings().equals(after.eventSettings())) {
      changed.add("eventSettings");
    }
    if (!before.channelPreferences().equals(after.channelPreferences())) {
      changed.add("channelPreferences");
    }
    if (!before.quietHours().equals(after.quietHours())) {
      changed.add("quietHours");
    }
    return changed;
  }

  private Optional<NotificationPreferences> readCache(String userId, String workspaceId) {
    final Optional<String> cachedJson;
    try {
      cachedJson = cacheRepository.find(userId, workspaceId);
    } catch (RuntimeException ex) {
      logger.warn(
          "notification preferences cache read failed userId={} workspaceId={}",
          userId,
          workspaceId,
          ex);
      return Optional.empty();
    }
    if (cachedJson.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(cachedJson.get(), NotificationPreferences.class));
    } catch (JsonProcessingException ex) {
      // 壊れたキャッシュはミス扱いにして削除する
      logger.warn(
          "corrupted notification preferences cache userId={} workspaceId={}",
          userId,
          workspaceId,
          ex);
      invalidateCache(userId, workspaceId);
      return Optional.empty();
    }
  }

  private void writeCache(NotificationPreferences preferences) {
    try {
      cacheRepository.put(
          preferences.userId(),
          preferences.workspaceId(),
          objectMapper.writeValueAsString(preferences),
          properties.cacheTtl());
    } catch (JsonProcessingException | RuntimeException ex) {
      logger.warn(
          "failed to cache notification preferences userId={} workspaceId={}",
          preferences.userId(),
          preferences.workspaceId(),
          ex);
    }
  }

  private static <T> T valueOr(T value, T fallback) {
    return value == null ? fallback : value;
  }
}
