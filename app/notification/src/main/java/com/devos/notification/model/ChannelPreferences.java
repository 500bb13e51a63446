package com.devos.notification.model;

public record ChannelPreferences(boolean push, boolean inApp, boolean email) {

  public static ChannelPreferences defaults() {
    return new ChannelPreferences(true, true, false);
  }

  /** in-app は無効化できないため常に true へ戻す。 */
  public ChannelPreferences withInAppForced() {
    return inApp ? this : new ChannelPreferences(push, true, email);
  }
}
