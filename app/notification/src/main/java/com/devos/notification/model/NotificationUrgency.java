package com.devos.notification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationUrgency {
  VERY_LOW("very-low"),
  LOW("low"),
  NORMAL("normal"),
  HIGH("high");

  private final String value;

  NotificationUrgency(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static NotificationUrgency fromValue(String urgency) {
    for (NotificationUrgency notificationUrgency : values()) {
      if (notificationUrgency.value.equalsIgnoreCase(urgency)) {
        return notificationUrgency;
      }
    }
    throw new IllegalArgumentException("unsupported urgency: " + urgency);
  }
}
