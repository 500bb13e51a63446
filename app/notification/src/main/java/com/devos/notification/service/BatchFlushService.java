/*
 * どこで: Notification サービス層
 * 何を: 未送信バッチを持つ全ユーザーを走査し、ワークスペース単位で集約して push する
 * なぜ: バッチに溜めた通知を定期的にまとめて届けるため
 */
package com.devos.notification.service;

import com.devos.notification.channel.PushNotificationSender;
import com.devos.notification.model.BatchedNotification;
import com.devos.notification.model.ConsolidatedNotification;
import com.devos.notification.model.JobOptions;
import com.devos.notification.model.NotificationEvent;
import com.devos.notification.model.NotificationPreferences;
import com.devos.notification.model.NotificationUrgency;
import com.devos.notification.model.PushMessage;
import com.devos.notification.model.Recipient;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BatchFlushService {

  public static final String JOB_TYPE = "batch-flush";

  private static final Logger logger = LoggerFactory.getLogger(BatchFlushService.class);
  private static final String PUSH_CHANNEL = "push";

  private final NotificationBatchService batchService;
  private final QuietHoursService quietHoursService;
  private final PreferenceStore preferenceStore;
  private final PushNotificationSender pushSender;
  private final NotificationMessageFormatter formatter;
  private final DurableJobQueue jobQueue;
  private final NotificationMetrics metrics;

  @PostConstruct
  void registerHandler() {
    jobQueue.register(JOB_TYPE, job -> flushAll());
  }

  /** 全ユーザーの flush を 1 回だけ実行するジョブを積む。ペイロードは持たない。 */
  public UUID requestFlush() {
    return jobQueue.enqueue(JOB_TYPE, null, new JobOptions(1, null, Duration.ZERO));
  }

  /** 処理できたユーザー数を返す。1 ユーザーの失敗で走査は止めない。 */
  public int flushAll() {
    final List<String> userIds;
    try {
      userIds = batchService.findUsersWithPendingBatches();
    } catch (RuntimeException ex) {
      logger.error("failed to enumerate pending batches", ex);
      return 0;
    }
    int flushed = 0;
    for (String userId : userIds) {
      try {
        flushUser(userId);
        flushed++;
      } catch (RuntimeException ex) {
        logger.warn("batch flush failed userId={}", userId, ex);
      }
    }
    if (flushed > 0) {
      logger.info("batch flush completed users={} candidates={}", flushed, userIds.size());
    }
    return flushed;
  }

  public void flushUser(String userId) {
    final List<BatchedNotification> items = batchService.flushBatch(userId);
    if (items.isEmpty()) {
      return;
    }
    final Map<String, List<BatchedNotification>> byWorkspace = new LinkedHashMap<>();
    for (BatchedNotification item : items) {
      byWorkspace.computeIfAbsent(item.workspaceId(), ignored -> new ArrayList<>()).add(item);
    }
    for (Map.Entry<String, List<BatchedNotification>> entry : byWorkspace.entrySet()) {
      try {
        deliverWorkspaceBatch(new Recipient(userId, entry.getKey()), entry.getValue());
      } catch (RuntimeException ex) {
        metrics.recordDelivery(PUSH_CHANNEL, "failed");
        logger.warn(
            "batch flush failed for workspace userId={} workspaceId={} size={}",
            userId,
            entry.getKey(),
            entry.getValue().size(),
            ex);
      }
    }
  }

  private void deliverWorkspaceBatch(Recipient recipient, List<BatchedNotification> items) {
    if (isInQuietHours(recipient)) {
      holdForQuietHours(recipient, items);
      return;
    }
    if (!pushSender.isEnabled()) {
      logger.debug(
          "push disabled; dropping flushed batch userId={} workspaceId={} size={}",
          recipient.userId(),
          recipient.workspaceId(),
          items.size());
      return;
    }
    for (ConsolidatedNotification notification : batchService.consolidateBatch(items)) {
      try {
        pushSender.sendToUser(recipient.userId(), toPushMessage(notification));
        metrics.recordDelivery(PUSH_CHANNEL, "sent");
      } catch (RuntimeException ex) {
        metrics.recordDelivery(PUSH_CHANNEL, "failed");
        logger.warn(
            "batched push failed type={} userId={} workspaceId={} count={}",
            notification.type(),
            recipient.userId(),
            recipient.workspaceId(),
            notification.count(),
            ex);
      }
    }
  }

  private boolean isInQuietHours(Recipient recipient) {
    final NotificationPreferences preferences;
    try {
      preferences = preferenceStore.getPreferences(recipient.userId(), recipient.workspaceId());
    } catch (RuntimeException ex) {
      logger.warn(
          "quiet hours lookup failed during batch flush userId={} workspaceId={}",
          recipient.userId(),
          recipient.workspaceId(),
          ex);
      return false;
    }
    return quietHoursService.isInQuietHours(recipient.userId(), preferences);
  }

  private void holdForQuietHours(Recipient recipient, List<BatchedNotification> items) {
    for (BatchedNotification item : items) {
      quietHoursService.queueForLater(
          recipient,
          new NotificationEvent(
              item.type(), item.payload(), List.of(recipient), NotificationUrgency.NORMAL, true));
    }
    logger.debug(
        "flushed batch held for quiet hours userId={} workspaceId={} size={}",
        recipient.userId(),
        recipient.workspaceId(),
        items.size());
  }

  private PushMessage toPushMessage(ConsolidatedNotification notification) {
    final Map<String, Object> payload = notification.payload();
    String body = formatter.body(payload);
    if (body.isEmpty() && payload.get("titles") instanceof List<?> titles && !titles.isEmpty()) {
      body = String.join(", ", titles.stream().map(String::valueOf).toList());
    }
    return new PushMessage(
        formatter.title(notification.type(), payload),
        body,
        notification.type(),
        payload,
        NotificationUrgency.NORMAL);
  }
}
