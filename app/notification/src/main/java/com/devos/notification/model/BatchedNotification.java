package com.devos.notification.model;

import java.time.Instant;
import java.util.Map;

/** 受信者ごとのバッチバッファに積まれる 1 件分の通知。 */
public record BatchedNotification(
    NotificationType type, Map<String, Object> payload, Instant timestamp, String workspaceId) {}
