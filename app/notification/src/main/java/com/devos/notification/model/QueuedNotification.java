package com.devos.notification.model;

import java.time.Instant;
import java.util.Map;

/** quiet hours 中に保留された通知。 */
public record QueuedNotification(
    NotificationType type, Map<String, Object> payload, Instant timestamp, String workspaceId) {}
