/*
 * どこで: Notification サービス層
 * 何を: notification_jobs を使った永続ジョブキュー (登録、claim、ハンドラ実行、リトライ) を実装する
 * なぜ: 送信の再試行を再起動後も失わず、複数インスタンスで重複なく分担するため
 */
package com.devos.notification.service;

import com.devos.notification.config.NotificationDeliveryProperties;
import com.devos.notification.model.JobOptions;
import com.devos.notification.model.JobStatus;
import com.devos.notification.model.NotificationJobRecord;
import com.devos.notification.model.QueuedJob;
import com.devos.notification.repository.NotificationJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class NotificationJobQueue implements DurableJobQueue {

    private static final Logger logger = LoggerFactory.getLogger(NotificationJobQueue.class);
    private static final String HOSTNAME_ENV = "HOSTNAME";
    private static final String DEFAULT_HOSTNAME = "unknown-host";

    private final NotificationJobRepository jobRepository;
    private final NotificationDeliveryProperties properties;
    private final NotificationMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

    public NotificationJobQueue(NotificationJobRepository jobRepository,
            NotificationDeliveryProperties properties,
            NotificationMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        this.jobRepository = jobRepository;
        this.properties = properties;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public UUID enqueue(String jobType, Object payload, JobOptions options) {
        final String payloadJson;
        try {
            payloadJson = payload == null ? "{}" : objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("job payload is not serializable jobType=" + jobType, ex);
        }
        Instant now = Instant.now(clock);
        Duration backoff = options.backoff() == null ? properties.backoffBase() : options.backoff();
        Instant nextRetryAt = options.initialDelay().isZero() ? null : now.plus(options.initialDelay());
        NotificationJobRecord record = new NotificationJobRecord(
                UUID.randomUUID(),
                jobType,
                payloadJson,
                JobStatus.PENDING,
                null,
                null,
                null,
                0,
                options.attempts(),
                backoff.toMillis(),
                nextRetryAt,
                null,
                now,
                null);
        UUID jobId = jobRepository.insert(record);
        logger.debug("job enqueued id={} jobType={} attempts={}", jobId, jobType, options.attempts());
        return jobId;
    }

    @Override
    public void register(String jobType, JobHandler handler) {
        JobHandler previous = handlers.putIfAbsent(jobType, handler);
        if (previous != null) {
            throw new IllegalStateException("job handler already registered jobType=" + jobType);
        }
    }

    public void processPendingBatch() {
        Instant now = Instant.now(clock);
        String lockedBy = resolveLockedBy();
        Instant leaseUntil = now.plus(properties.lease());
        // claim を単一 SQL で行い、ハンドラの IO を長期トランザクションに載せない
        List<NotificationJobRecord> claimed = jobRepository.claimPendingForUpdate(
                properties.batchSize(),
                now,
                leaseUntil,
                lockedBy);
        for (NotificationJobRecord record : claimed) {
            JobHandler handler = handlers.get(record.jobType());
            if (handler == null) {
                logger.warn("no handler registered for job id={} jobType={}", record.jobId(), record.jobType());
                jobRepository.markRetry(record.jobId(), record.attemptCount() + 1, null, true,
                        "no handler registered", lockedBy);
                continue;
            }
            try {
                handler.handle(new QueuedJob(
                        record.jobId(),
                        record.jobType(),
                        record.payloadJson(),
                        record.attemptCount() + 1));
                int updated = jobRepository.markCompleted(record.jobId(), Instant.now(clock), lockedBy);
                if (updated == 0) {
                    logger.warn("job completed but lock was lost id={} jobType={}",
                            record.jobId(),
                            record.jobType());
                }
            } catch (RuntimeException ex) {
                handleFailure(record, ex, now, lockedBy);
            }
        }
        try {
            metrics.updateJobBacklogCurrent(jobRepository.countActive());
        } catch (RuntimeException ex) {
            logger.warn("failed to refresh job backlog gauge", ex);
        }
    }

    @VisibleForTesting
    void handleFailure(NotificationJobRecord record, RuntimeException ex, Instant now, String lockedBy) {
        int nextAttempt = record.attemptCount() + 1;
        if (nextAttempt >= record.maxAttempts()) {
            int updated = jobRepository.markRetry(record.jobId(), nextAttempt, null, true,
                    truncateError(ex.getMessage()), lockedBy);
            if (updated == 0) {
                logger.warn("job failure skipped because lock was lost id={} jobType={}",
                        record.jobId(),
                        record.jobType());
                return;
            }
            logger.warn("job failed permanently id={} jobType={} attempt={}",
                    record.jobId(), record.jobType(), nextAttempt, ex);
            return;
        }
        Duration backoff = computeBackoffDuration(nextAttempt, Duration.ofMillis(record.backoffBaseMillis()));
        Instant nextRetryAt = now.plus(backoff);
        int updated = jobRepository.markRetry(record.jobId(), nextAttempt, nextRetryAt, false,
                truncateError(ex.getMessage()), lockedBy);
        if (updated == 0) {
            logger.warn("job retry skipped because lock was lost id={} attempt={}",
                    record.jobId(),
                    nextAttempt);
            return;
        }
        logger.warn("job retry scheduled id={} jobType={} attempt={} nextRetryAt={}",
                record.jobId(), record.jobType(), nextAttempt, nextRetryAt, ex);
    }

    @VisibleForTesting
    Duration computeBackoffDuration(int attempt, Duration base) {
        double baseMillis = (base == null || base.isZero() ? properties.backoffBase() : base).toMillis();
        double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
        double capped = Math.min(exp, properties.backoffMax().toMillis());
        double jitterMin = properties.backoffJitterMin();
        double jitterMax = properties.backoffJitterMax();
        double jitter = jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
        long backoffMillis = (long) Math.ceil(capped * jitter);
        long minMillis = properties.backoffMin().toMillis();
        return Duration.ofMillis(Math.max(minMillis, backoffMillis));
    }

    private String truncateError(String message) {
        if (message == null) {
            return "unknown error";
        }
        int maxLength = properties.errorMessageMaxLength();
        if (message.length() <= maxLength) {
            return message;
        }
        return message.substring(0, maxLength);
    }

    @VisibleForTesting
    String resolveLockedBy() {
        String env = System.getenv(HOSTNAME_ENV);
        if (env != null && !env.isBlank()) {
            return env;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException | SecurityException ex) {
            logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
            return DEFAULT_HOSTNAME;
        }
    }
}
