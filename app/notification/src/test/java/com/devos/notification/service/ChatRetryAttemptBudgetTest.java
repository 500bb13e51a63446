/*
 * どこで: dispatch から永続ジョブキュー経由の再送までを通したテスト
 * 何を: 失敗し続けるチャネルへの送信回数が maxAttempts (インライン送信込み) で止まることを検証する
 * なぜ: 再送ジョブが上限を 1 回超えてプロバイダへ送り続けないことを保証するため
 */
package com.devos.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.devos.notification.channel.ChannelAdapter;
import com.devos.notification.channel.ChannelAdapterRegistry;
import com.devos.notification.channel.PushNotificationSender;
import com.devos.notification.config.NotificationDeliveryProperties;
import com.devos.notification.model.ChannelSendResult;
import com.devos.notification.model.JobStatus;
import com.devos.notification.model.NotificationEvent;
import com.devos.notification.model.NotificationJobRecord;
import com.devos.notification.model.NotificationType;
import com.devos.notification.model.NotificationUrgency;
import com.devos.notification.model.Recipient;
import com.devos.notification.repository.NotificationJobRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatRetryAttemptBudgetTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final Recipient ALICE = new Recipient("alice", "ws-1");

  @Mock private PreferenceStore preferenceStore;
  @Mock private InAppNotificationService inAppNotificationService;
  @Mock private NotificationBatchService batchService;
  @Mock private QuietHoursService quietHoursService;
  @Mock private PushNotificationSender pushSender;
  @Mock private ChannelAdapterRegistry adapterRegistry;
  @Mock private NotificationJobRepository jobRepository;
  @Mock private ChannelAdapter slack;

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private final Map<UUID, NotificationJobRecord> jobs = new LinkedHashMap<>();
  private SimpleMeterRegistry meterRegistry;
  private NotificationJobQueue jobQueue;
  private NotificationDispatchService dispatchService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    final NotificationMetrics metrics = new NotificationMetrics(meterRegistry);
    jobQueue =
        new NotificationJobQueue(
            jobRepository,
            properties(3),
            metrics,
            objectMapper,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    final SendNotificationJobProcessor processor =
        new SendNotificationJobProcessor(
            jobQueue, adapterRegistry, properties(3), metrics, objectMapper);
    processor.registerHandler();
    dispatchService =
        new NotificationDispatchService(
            preferenceStore,
            inAppNotificationService,
            batchService,
            quietHoursService,
            pushSender,
            adapterRegistry,
            processor,
            new NotificationMessageFormatter(),
            metrics);

    lenient().when(pushSender.isEnabled()).thenReturn(true);
    lenient().when(slack.channelName()).thenReturn("slack");
    lenient().when(adapterRegistry.orderedAdapters()).thenReturn(List.of(slack));
    lenient().when(adapterRegistry.find("slack")).thenReturn(Optional.of(slack));
    lenient()
        .when(batchService.isImmediateNotification(any(), anyBoolean()))
        .thenReturn(true);
    backJobRepositoryWithMap();
  }

  @Test
  void persistentlyFailingChannelIsSentExactlyMaxAttemptsTimes() {
    when(slack.send(anyString(), any())).thenReturn(ChannelSendResult.transientFailure("503"));

    dispatchService.dispatch(event());
    drainQueue();

    verify(slack, times(3)).send(eq("ws-1"), any());
    assertThat(jobs.values()).singleElement().satisfies(
        job -> {
          assertThat(job.maxAttempts()).isEqualTo(2);
          assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        });
    assertThat(
            meterRegistry.get("notification.retry.total").tag("result", "exhausted").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void channelRecoveringOnSecondAttemptStopsRetrying() {
    when(slack.send(anyString(), any()))
        .thenReturn(ChannelSendResult.transientFailure("503"))
        .thenReturn(ChannelSendResult.delivered("#dev"));

    dispatchService.dispatch(event());
    drainQueue();

    verify(slack, times(2)).send(eq("ws-1"), any());
    assertThat(jobs.values()).singleElement().extracting(NotificationJobRecord::status)
        .isEqualTo(JobStatus.COMPLETED);
  }

  private void drainQueue() {
    for (int i = 0; i < 10 && hasPendingJobs(); i++) {
      jobQueue.processPendingBatch();
    }
  }

  private boolean hasPendingJobs() {
    return jobs.values().stream().anyMatch(job -> job.status() == JobStatus.PENDING);
  }

  // バックオフの待ち時間は無視し、PENDING をすべて claim する
  private void backJobRepositoryWithMap() {
    when(jobRepository.insert(any()))
        .thenAnswer(
            invocation -> {
              final NotificationJobRecord record = invocation.getArgument(0);
              jobs.put(record.jobId(), record);
              return record.jobId();
            });
    lenient()
        .when(jobRepository.claimPendingForUpdate(anyInt(), any(), any(), anyString()))
        .thenAnswer(
            invocation -> {
              final String lockedBy = invocation.getArgument(3);
              final List<NotificationJobRecord> claimed = new ArrayList<>();
              for (NotificationJobRecord record : new ArrayList<>(jobs.values())) {
                if (record.status() == JobStatus.PENDING) {
                  final NotificationJobRecord processing =
                      copy(record, JobStatus.PROCESSING, lockedBy, record.attemptCount());
                  jobs.put(record.jobId(), processing);
                  claimed.add(processing);
                }
              }
              return claimed;
            });
    lenient()
        .when(jobRepository.markCompleted(any(), any(), anyString()))
        .thenAnswer(
            invocation -> {
              final NotificationJobRecord record = jobs.get(invocation.<UUID>getArgument(0));
              jobs.put(
                  record.jobId(), copy(record, JobStatus.COMPLETED, null, record.attemptCount()));
              return 1;
            });
    lenient()
        .when(jobRepository.markRetry(any(), anyInt(), any(), anyBoolean(), any(), anyString()))
        .thenAnswer(
            invocation -> {
              final NotificationJobRecord record = jobs.get(invocation.<UUID>getArgument(0));
              final int attemptCount = invocation.getArgument(1);
              final boolean failed = invocation.getArgument(3);
              jobs.put(
                  record.jobId(),
                  copy(record, failed ? JobStatus.FAILED : JobStatus.PENDING, null, attemptCount));
              return 1;
            });
  }

  private static NotificationJobRecord copy(
      NotificationJobRecord record, JobStatus status, String lockedBy, int attemptCount) {
    return new NotificationJobRecord(
        record.jobId(),
        record.jobType(),
        record.payloadJson(),
        status,
        lockedBy,
        record.lockedAt(),
        record.leaseUntil(),
        attemptCount,
        record.maxAttempts(),
        record.backoffBaseMillis(),
        record.nextRetryAt(),
        record.lastError(),
        record.createdAt(),
        record.completedAt());
  }

  private static NotificationDeliveryProperties properties(int maxAttempts) {
    return new NotificationDeliveryProperties(
        true,
        Duration.ofSeconds(1),
        50,
        maxAttempts,
        Duration.ofSeconds(5),
        Duration.ofMinutes(5),
        2.0d,
        0.8d,
        1.2d,
        Duration.ofSeconds(1),
        1000,
        Duration.ofSeconds(30),
        7,
        Duration.ofHours(1));
  }

  private NotificationEvent event() {
    return new NotificationEvent(
        NotificationType.AGENT_ERROR,
        Map.of("agentName", "planner", "error", "timeout"),
        List.of(ALICE),
        NotificationUrgency.HIGH,
        false);
  }
}
