package com.devos.notification.model;

import java.time.Instant;

public record QuietHoursStatus(boolean inQuietHours, Instant endsAt, String timezone) {

  public static QuietHoursStatus inactive() {
    return new QuietHoursStatus(false, null, null);
  }
}
