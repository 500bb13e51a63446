/*
 * どこで: Notification ドメインモデル
 * 何を: (userId, workspaceId) 単位の通知設定を表す
 * なぜ: Preference Store と Quiet Hours の判定入力を 1 つの値にまとめるため
 */
package com.devos.notification.model;

import java.time.Instant;
import java.util.Map;

public record NotificationPreferences(
    String userId,
    String workspaceId,
    boolean enabled,
    Map<String, Boolean> eventSettings,
    ChannelPreferences channelPreferences,
    Map<String, ChannelPreferences> perTypeChannelOverrides,
    QuietHoursConfig quietHours,
    Instant createdAt,
    Instant updatedAt) {

  public NotificationPreferences {
    eventSettings = eventSettings == null ? Map.of() : Map.copyOf(eventSettings);
    channelPreferences =
        channelPreferences == null ? ChannelPreferences.defaults() : channelPreferences;
    perTypeChannelOverrides =
        perTypeChannelOverrides == null ? Map.of() : Map.copyOf(perTypeChannelOverrides);
    quietHours = quietHours == null ? QuietHoursConfig.defaults() : quietHours;
  }
}
