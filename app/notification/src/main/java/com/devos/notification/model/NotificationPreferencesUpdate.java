package com.devos.notification.model;

import java.util.Map;

/** 部分更新。null のフィールドは既存値を維持する。 */
public record NotificationPreferencesUpdate(
    Boolean enabled,
    Map<String, Boolean> eventSettings,
    ChannelPreferencesUpdate channelPreferences,
    QuietHoursUpdate quietHours) {

  public record ChannelPreferencesUpdate(Boolean push, Boolean inApp, Boolean email) {}

  public record QuietHoursUpdate(
      Boolean enabled, String startTime, String endTime, String timezone, Boolean exceptCritical) {}
}
