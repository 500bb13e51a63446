package com.devos.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.devos.notification.channel.PushNotificationSender;
import com.devos.notification.config.NotificationBatchProperties;
import com.devos.notification.model.BatchedNotification;
import com.devos.notification.model.JobOptions;
import com.devos.notification.model.NotificationEvent;
import com.devos.notification.model.NotificationPreferences;
import com.devos.notification.model.NotificationType;
import com.devos.notification.model.PushMessage;
import com.devos.notification.model.QueuedJob;
import com.devos.notification.model.Recipient;
import com.devos.notification.repository.BatchQueueRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

@ExtendWith(MockitoExtension.class)
class BatchFlushServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T12:00:00Z");
  private static final String USER_ID = "user-1";

  @Mock private BatchQueueRepository batchQueueRepository;
  @Mock private QuietHoursService quietHoursService;
  @Mock private PreferenceStore preferenceStore;
  @Mock private PushNotificationSender pushSender;
  @Mock private DurableJobQueue jobQueue;

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private SimpleMeterRegistry meterRegistry;
  private BatchFlushService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    final NotificationMetrics metrics = new NotificationMetrics(meterRegistry);
    final NotificationBatchService batchService =
        new NotificationBatchService(
            batchQueueRepository,
            new NotificationBatchProperties(true, Duration.ofMinutes(30), Duration.ofMinutes(5)),
            metrics,
            objectMapper,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    service =
        new BatchFlushService(
            batchService,
            quietHoursService,
            preferenceStore,
            pushSender,
            new NotificationMessageFormatter(),
            jobQueue,
            metrics);
  }

  @Test
  void consolidatedBatchIsPushedOncePerGroup() throws Exception {
    when(batchQueueRepository.drain(USER_ID))
        .thenReturn(
            List.of(
                json(story("Login page", "ws-1")),
                json(story("Signup page", "ws-1")),
                json(story("Billing", "ws-1"))));
    when(pushSender.isEnabled()).thenReturn(true);

    service.flushUser(USER_ID);

    final ArgumentCaptor<PushMessage> message = ArgumentCaptor.forClass(PushMessage.class);
    verify(pushSender).sendToUser(eq(USER_ID), message.capture());
    assertThat(message.getValue().type()).isEqualTo("story_completed_batch");
    assertThat(message.getValue().title()).isEqualTo("3 story completed notifications");
    assertThat(message.getValue().body()).isEqualTo("Login page, Signup page, Billing");
    assertThat(
            meterRegistry
                .get("notification.delivery.total")
                .tags("channel", "push", "result", "sent")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void workspacesInQuietHoursAreHeldInsteadOfPushed() throws Exception {
    final NotificationPreferences quiet = preferences("ws-quiet");
    final NotificationPreferences awake = preferences("ws-awake");
    when(batchQueueRepository.drain(USER_ID))
        .thenReturn(
            List.of(
                json(story("A", "ws-quiet")),
                json(story("B", "ws-awake")),
                json(story("C", "ws-quiet"))));
    when(preferenceStore.getPreferences(USER_ID, "ws-quiet")).thenReturn(quiet);
    when(preferenceStore.getPreferences(USER_ID, "ws-awake")).thenReturn(awake);
    when(quietHoursService.isInQuietHours(USER_ID, quiet)).thenReturn(true);
    when(quietHoursService.isInQuietHours(USER_ID, awake)).thenReturn(false);
    when(pushSender.isEnabled()).thenReturn(true);

    service.flushUser(USER_ID);

    final ArgumentCaptor<NotificationEvent> held = ArgumentCaptor.forClass(NotificationEvent.class);
    verify(quietHoursService, times(2))
        .queueForLater(eq(new Recipient(USER_ID, "ws-quiet")), held.capture());
    assertThat(held.getAllValues())
        .extracting(event -> event.payload().get("storyTitle"))
        .containsExactly("A", "C");
    final ArgumentCaptor<PushMessage> pushed = ArgumentCaptor.forClass(PushMessage.class);
    verify(pushSender).sendToUser(eq(USER_ID), pushed.capture());
    assertThat(pushed.getValue().title()).isEqualTo("B");
  }

  @Test
  void batchIsDroppedWhenPushIsUnavailable() throws Exception {
    when(batchQueueRepository.drain(USER_ID)).thenReturn(List.of(json(story("A", "ws-1"))));
    when(pushSender.isEnabled()).thenReturn(false);

    service.flushUser(USER_ID);

    verify(pushSender, never()).sendToUser(anyString(), any());
  }

  @Test
  void preferenceLookupFailureDoesNotBlockFlush() throws Exception {
    when(batchQueueRepository.drain(USER_ID)).thenReturn(List.of(json(story("A", "ws-1"))));
    when(preferenceStore.getPreferences(USER_ID, "ws-1"))
        .thenThrow(new IllegalStateException("db down"));
    when(pushSender.isEnabled()).thenReturn(true);

    service.flushUser(USER_ID);

    verify(pushSender).sendToUser(eq(USER_ID), any(PushMessage.class));
    verify(quietHoursService, never()).queueForLater(any(), any());
  }

  @Test
  void pushFailureInOneWorkspaceDoesNotDropOtherWorkspaces() throws Exception {
    when(batchQueueRepository.drain(USER_ID))
        .thenReturn(List.of(json(story("A", "ws-a")), json(story("B", "ws-b"))));
    when(pushSender.isEnabled()).thenReturn(true);
    doThrow(new IllegalStateException("push down"))
        .when(pushSender)
        .sendToUser(eq(USER_ID), argThat(message -> "A".equals(message.title())));

    service.flushUser(USER_ID);

    final ArgumentCaptor<PushMessage> pushed = ArgumentCaptor.forClass(PushMessage.class);
    verify(pushSender, times(2)).sendToUser(eq(USER_ID), pushed.capture());
    assertThat(pushed.getAllValues()).extracting(PushMessage::title).containsExactly("A", "B");
    assertThat(deliveries("failed")).isEqualTo(1.0d);
    assertThat(deliveries("sent")).isEqualTo(1.0d);
  }

  @Test
  void quietHoursHoldFailureDoesNotBlockOtherWorkspaces() throws Exception {
    final NotificationPreferences quiet = preferences("ws-quiet");
    final NotificationPreferences awake = preferences("ws-awake");
    when(batchQueueRepository.drain(USER_ID))
        .thenReturn(List.of(json(story("A", "ws-quiet")), json(story("B", "ws-awake"))));
    when(preferenceStore.getPreferences(USER_ID, "ws-quiet")).thenReturn(quiet);
    when(preferenceStore.getPreferences(USER_ID, "ws-awake")).thenReturn(awake);
    when(quietHoursService.isInQuietHours(USER_ID, quiet)).thenReturn(true);
    when(quietHoursService.isInQuietHours(USER_ID, awake)).thenReturn(false);
    doThrow(new IllegalStateException("redis down"))
        .when(quietHoursService)
        .queueForLater(any(), any());
    when(pushSender.isEnabled()).thenReturn(true);

    service.flushUser(USER_ID);

    final ArgumentCaptor<PushMessage> pushed = ArgumentCaptor.forClass(PushMessage.class);
    verify(pushSender).sendToUser(eq(USER_ID), pushed.capture());
    assertThat(pushed.getValue().title()).isEqualTo("B");
  }

  @Test
  void emptyBatchSendsNothing() {
    when(batchQueueRepository.drain(USER_ID)).thenReturn(List.of());

    service.flushUser(USER_ID);

    verify(pushSender, never()).sendToUser(anyString(), any());
  }

  @Test
  void flushAllContinuesAfterSingleUserFailure() throws Exception {
    when(batchQueueRepository.findUserIdsWithPendingBatches()).thenReturn(Set.of("broken", "ok"));
    when(batchQueueRepository.drain("broken")).thenThrow(new RedisConnectionFailureException("down"));
    when(batchQueueRepository.drain("ok")).thenReturn(List.of());

    assertThat(service.flushAll()).isEqualTo(1);
  }

  @Test
  void flushAllReturnsZeroWhenEnumerationFails() {
    when(batchQueueRepository.findUserIdsWithPendingBatches())
        .thenThrow(new RedisConnectionFailureException("down"));

    assertThat(service.flushAll()).isZero();
  }

  @Test
  void requestFlushEnqueuesSingleAttemptJobWithoutPayload() {
    final UUID jobId = UUID.randomUUID();
    when(jobQueue.enqueue(eq(BatchFlushService.JOB_TYPE), isNull(), any(JobOptions.class)))
        .thenReturn(jobId);

    assertThat(service.requestFlush()).isEqualTo(jobId);

    final ArgumentCaptor<JobOptions> options = ArgumentCaptor.forClass(JobOptions.class);
    verify(jobQueue).enqueue(eq(BatchFlushService.JOB_TYPE), isNull(), options.capture());
    assertThat(options.getValue().attempts()).isEqualTo(1);
    assertThat(options.getValue().initialDelay()).isZero();
  }

  @Test
  void registeredHandlerRunsFullFlush() {
    when(batchQueueRepository.findUserIdsWithPendingBatches()).thenReturn(Set.of());

    service.registerHandler();

    final ArgumentCaptor<JobHandler> handler = ArgumentCaptor.forClass(JobHandler.class);
    verify(jobQueue).register(eq(BatchFlushService.JOB_TYPE), handler.capture());
    handler.getValue().handle(new QueuedJob(UUID.randomUUID(), BatchFlushService.JOB_TYPE, "{}", 1));
    verify(batchQueueRepository).findUserIdsWithPendingBatches();
  }

  private double deliveries(String result) {
    return meterRegistry
        .get("notification.delivery.total")
        .tags("channel", "push", "result", result)
        .counter()
        .count();
  }

  private BatchedNotification story(String title, String workspaceId) {
    return new BatchedNotification(
        NotificationType.STORY_COMPLETED, Map.of("storyTitle", title), FIXED_NOW, workspaceId);
  }

  private String json(BatchedNotification notification) throws Exception {
    return objectMapper.writeValueAsString(notification);
  }

  private NotificationPreferences preferences(String workspaceId) {
    return new NotificationPreferences(
        USER_ID, workspaceId, true, Map.of(), null, Map.of(), null, FIXED_NOW, FIXED_NOW);
  }
}
