package com.devos.notification.model;

import java.time.Instant;
import java.util.UUID;

public record InAppNotificationRecord(
    UUID notificationId,
    String userId,
    String workspaceId,
    String type,
    String title,
    String message,
    String payloadJson,
    Instant readAt,
    Instant createdAt) {}
