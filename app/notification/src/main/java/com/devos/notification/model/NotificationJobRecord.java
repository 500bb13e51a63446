/*
 * どこで: Notification ドメインモデル
 * 何を: notification_jobs の 1 行を表す
 * なぜ: Repository と キュー処理の間で受け渡す構造を固定するため
 */
package com.devos.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationJobRecord(
    UUID jobId,
    String jobType,
    String payloadJson,
    JobStatus status,
    String lockedBy,
    Instant lockedAt,
    Instant leaseUntil,
    int attemptCount,
    int maxAttempts,
    long backoffBaseMillis,
    Instant nextRetryAt,
    String lastError,
    Instant createdAt,
    Instant completedAt) {}
