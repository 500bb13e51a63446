package com.devos.notification.model;

/** send-notification ジョブとして永続化する JSON の形。 */
public record SendNotificationJobPayload(
    String workspaceId, String channel, NotificationEvent notification) {}
