package com.devos.notification.model;

import java.time.Instant;
import java.util.UUID;

public record ChatIntegrationRecord(
    UUID integrationId,
    String workspaceId,
    String provider,
    String webhookUrl,
    String webhookId,
    String channelName,
    IntegrationStatus status,
    int errorCount,
    int rateLimitPerMinute,
    String lastError,
    Instant lastErrorAt,
    Instant lastMessageAt,
    long messageCount) {}
