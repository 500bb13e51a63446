package com.devos.notification.model;

/** send-notification ジョブ 1 回分の実行単位。attempt は 1 始まり。 */
public record RetryJob(
    String workspaceId, String channel, NotificationEvent notification, int attempt) {}
