/*
 * どこで: 永続ジョブキューのユニットテスト
 * 何を: enqueue の初期遅延、ハンドラ実行と完了、バックオフ計算、試行上限での FAILED 遷移を検証する
 * なぜ: 再送制御が上限を超えて回り続けないことを保証するため
 */
package com.devos.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.devos.notification.config.NotificationDeliveryProperties;
import com.devos.notification.model.JobOptions;
import com.devos.notification.model.JobStatus;
import com.devos.notification.model.NotificationJobRecord;
import com.devos.notification.model.QueuedJob;
import com.devos.notification.repository.NotificationJobRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationJobQueueTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final String LOCKED_BY = "worker-1";
  private static final NotificationDeliveryProperties PROPERTIES =
      new NotificationDeliveryProperties(
          true,
          Duration.ofSeconds(1),
          50,
          3,
          Duration.ofSeconds(1),
          Duration.ofSeconds(60),
          2.0d,
          0.5d,
          1.5d,
          Duration.ofSeconds(1),
          10,
          Duration.ofSeconds(30),
          7,
          Duration.ofHours(1));

  @Mock private NotificationJobRepository jobRepository;

  private NotificationJobQueue queue;

  @BeforeEach
  void setUp() {
    queue =
        new NotificationJobQueue(
            jobRepository,
            PROPERTIES,
            new NotificationMetrics(new SimpleMeterRegistry()),
            new ObjectMapper(),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void enqueueStoresPendingJobWithInitialDelay() {
    when(jobRepository.insert(any())).thenAnswer(invocation -> invocation.<NotificationJobRecord>getArgument(0).jobId());

    queue.enqueue(
        "send-notification",
        Map.of("workspaceId", "ws-1"),
        new JobOptions(3, Duration.ofSeconds(5), Duration.ofSeconds(30)));

    final ArgumentCaptor<NotificationJobRecord> captor =
        ArgumentCaptor.forClass(NotificationJobRecord.class);
    verify(jobRepository).insert(captor.capture());
    final NotificationJobRecord record = captor.getValue();
    assertThat(record.status()).isEqualTo(JobStatus.PENDING);
    assertThat(record.jobType()).isEqualTo("send-notification");
    assertThat(record.payloadJson()).isEqualTo("{\"workspaceId\":\"ws-1\"}");
    assertThat(record.maxAttempts()).isEqualTo(3);
    assertThat(record.attemptCount()).isZero();
    assertThat(record.backoffBaseMillis()).isEqualTo(5000L);
    assertThat(record.nextRetryAt()).isEqualTo(FIXED_NOW.plusSeconds(30));
  }

  @Test
  void enqueueWithoutDelayIsImmediatelyClaimable() {
    when(jobRepository.insert(any())).thenAnswer(invocation -> invocation.<NotificationJobRecord>getArgument(0).jobId());

    queue.enqueue("batch-flush", null, new JobOptions(1, null, null));

    final ArgumentCaptor<NotificationJobRecord> captor =
        ArgumentCaptor.forClass(NotificationJobRecord.class);
    verify(jobRepository).insert(captor.capture());
    assertThat(captor.getValue().nextRetryAt()).isNull();
    assertThat(captor.getValue().payloadJson()).isEqualTo("{}");
    assertThat(captor.getValue().backoffBaseMillis()).isEqualTo(1000L);
  }

  @Test
  void registeringSameJobTypeTwiceFails() {
    queue.register("send-notification", job -> {});

    assertThatThrownBy(() -> queue.register("send-notification", job -> {}))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void processPendingBatchRunsHandlerWithOneBasedAttemptAndCompletes() {
    final NotificationJobRecord record = processingRecord("send-notification", 1);
    when(jobRepository.claimPendingForUpdate(eq(50), eq(FIXED_NOW), any(), anyString()))
        .thenReturn(List.of(record));
    when(jobRepository.markCompleted(eq(record.jobId()), eq(FIXED_NOW), anyString())).thenReturn(1);
    final List<QueuedJob> handled = new ArrayList<>();
    queue.register("send-notification", handled::add);

    queue.processPendingBatch();

    assertThat(handled).singleElement().satisfies(job -> {
      assertThat(job.jobId()).isEqualTo(record.jobId());
      assertThat(job.attempt()).isEqualTo(2);
    });
    verify(jobRepository).markCompleted(eq(record.jobId()), eq(FIXED_NOW), anyString());
  }

  @Test
  void jobWithoutHandlerIsFailed() {
    final NotificationJobRecord record = processingRecord("unknown", 0);
    when(jobRepository.claimPendingForUpdate(anyInt(), any(), any(), anyString()))
        .thenReturn(List.of(record));

    queue.processPendingBatch();

    verify(jobRepository)
        .markRetry(eq(record.jobId()), eq(1), isNull(), eq(true), eq("no handler registered"), anyString());
    verify(jobRepository, never()).markCompleted(any(), any(), anyString());
  }

  @Test
  void handlerFailureSchedulesRetry() {
    final NotificationJobRecord record = processingRecord("send-notification", 0);
    when(jobRepository.claimPendingForUpdate(anyInt(), any(), any(), anyString()))
        .thenReturn(List.of(record));
    queue.register(
        "send-notification",
        job -> {
          throw new RetryableNotificationException("slack 503");
        });

    queue.processPendingBatch();

    verify(jobRepository)
        .markRetry(eq(record.jobId()), eq(1), any(Instant.class), eq(false), eq("slack 503"), anyString());
    verify(jobRepository, never()).markCompleted(any(), any(), anyString());
  }

  @Test
  void handleFailureMarksFailedAtAttemptCeiling() {
    final NotificationJobRecord record = processingRecord("send-notification", 2);
    when(jobRepository.markRetry(any(UUID.class), anyInt(), isNull(), eq(true), any(), any()))
        .thenReturn(1);

    queue.handleFailure(record, new IllegalStateException("boom"), FIXED_NOW, LOCKED_BY);

    verify(jobRepository)
        .markRetry(eq(record.jobId()), eq(3), isNull(), eq(true), eq("boom"), eq(LOCKED_BY));
  }

  @Test
  void handleFailureTruncatesErrorMessageUsingConfiguredLimit() {
    final NotificationJobRecord record = processingRecord("send-notification", 2);
    final String longMessage = "a".repeat(PROPERTIES.errorMessageMaxLength() + 5);

    queue.handleFailure(record, new IllegalStateException(longMessage), FIXED_NOW, LOCKED_BY);

    verify(jobRepository)
        .markRetry(
            eq(record.jobId()),
            eq(3),
            isNull(),
            eq(true),
            eq(longMessage.substring(0, PROPERTIES.errorMessageMaxLength())),
            eq(LOCKED_BY));
  }

  @Test
  void handleFailureSchedulesRetryWithinJitterRange() {
    final NotificationJobRecord record = processingRecord("send-notification", 1);

    queue.handleFailure(record, new IllegalStateException("boom"), FIXED_NOW, LOCKED_BY);

    final ArgumentCaptor<Instant> nextRetryAt = ArgumentCaptor.forClass(Instant.class);
    verify(jobRepository)
        .markRetry(eq(record.jobId()), eq(2), nextRetryAt.capture(), eq(false), eq("boom"), eq(LOCKED_BY));
    assertThat(nextRetryAt.getValue())
        .isBetween(FIXED_NOW.plus(minBackoff(2)), FIXED_NOW.plus(maxBackoff(2)));
  }

  @Test
  void computeBackoffDurationIsCappedAndJittered() {
    final Duration early = queue.computeBackoffDuration(3, Duration.ofSeconds(1));
    final Duration capped = queue.computeBackoffDuration(20, Duration.ofSeconds(1));

    assertThat(early).isBetween(minBackoff(3), maxBackoff(3));
    assertThat(capped)
        .isBetween(Duration.ofMillis(30_000), Duration.ofMillis(90_000));
  }

  @Test
  void resolveLockedByIsNeverBlank() {
    assertThat(queue.resolveLockedBy()).isNotBlank();
  }

  private NotificationJobRecord processingRecord(String jobType, int attemptCount) {
    return new NotificationJobRecord(
        UUID.randomUUID(),
        jobType,
        "{}",
        JobStatus.PROCESSING,
        LOCKED_BY,
        FIXED_NOW,
        FIXED_NOW.plus(PROPERTIES.lease()),
        attemptCount,
        PROPERTIES.maxAttempts(),
        1000L,
        null,
        null,
        FIXED_NOW,
        null);
  }

  private Duration minBackoff(int attempt) {
    final double exp = 1000d * Math.pow(PROPERTIES.backoffExponentBase(), attempt - 1);
    final double capped = Math.min(exp, PROPERTIES.backoffMax().toMillis());
    return Duration.ofMillis(
        Math.max(
            PROPERTIES.backoffMin().toMillis(),
            (long) Math.floor(capped * PROPERTIES.backoffJitterMin())));
  }

  private Duration maxBackoff(int attempt) {
    final double exp = 1000d * Math.pow(PROPERTIES.backoffExponentBase(), attempt - 1);
    final double capped = Math.min(exp, PROPERTIES.backoffMax().toMillis());
    return Duration.ofMillis(
        Math.max(
            PROPERTIES.backoffMin().toMillis(),
            (long) Math.ceil(capped * PROPERTIES.backoffJitterMax())));
  }
}
