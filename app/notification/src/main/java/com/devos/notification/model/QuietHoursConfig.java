package com.devos.notification.model;

public record QuietHoursConfig(
    boolean enabled, String startTime, String endTime, String timezone, boolean exceptCritical) {

  public static QuietHoursConfig defaults() {
    return new QuietHoursConfig(false, "22:00", "08:00", "UTC", true);
  }
}
