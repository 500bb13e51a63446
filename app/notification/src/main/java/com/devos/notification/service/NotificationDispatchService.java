/*
 * どこで: Notification サービス層
 * 何を: 通知イベントを受信者ごとに設定で絞り込み、in-app / push / バッチ / チャットへ振り分ける
 * なぜ: 各チャネルの失敗を互いに隔離しつつ 1 つの入口から配信を完了させるため
 */
package com.devos.notification.service;

import com.devos.common.TraceIds;
import com.devos.notification.channel.ChannelAdapter;
import com.devos.notification.channel.ChannelAdapterRegistry;
import com.devos.notification.channel.PushNotificationSender;
import com.devos.notification.model.ChannelPreferences;
import com.devos.notification.model.ChannelSendResult;
import com.devos.notification.model.NotificationEvent;
import com.devos.notification.model.NotificationPreferences;
import com.devos.notification.model.NotificationType;
import com.devos.notification.model.PushMessage;
import com.devos.notification.model.Recipient;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDispatchService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatchService.class);
  private static final String PUSH_CHANNEL = "push";
  private static final String IN_APP_CHANNEL = "in_app";

  private final PreferenceStore preferenceStore;
  private final InAppNotificationService inAppNotificationService;
  private final NotificationBatchService batchService;
  private final QuietHoursService quietHoursService;
  private final PushNotificationSender pushSender;
  private final ChannelAdapterRegistry adapterRegistry;
  private final SendNotificationJobProcessor retryProcessor;
  private final NotificationMessageFormatter formatter;
  private final NotificationMetrics metrics;

  /** 例外を外へ送出しない。個々の失敗はログとメトリクスに残す。 */
  public void dispatch(NotificationEvent event) {
    if (event == null) {
      return;
    }
    final boolean ownsTraceId = MDC.get(TraceIds.MDC_KEY) == null;
    final String traceId = TraceIds.ensureInMdc();
    try {
      doDispatch(event);
    } catch (RuntimeException ex) {
      logger.error(
          "notification dispatch aborted type={} traceId={}", event.type().value(), traceId, ex);
    } finally {
      if (ownsTraceId) {
        MDC.remove(TraceIds.MDC_KEY);
      }
    }
  }

  private void doDispatch(NotificationEvent event) {
    final List<RecipientPlan> plans = filterRecipients(event);
    if (plans.isEmpty()) {
      logger.debug("notification has no eligible recipients type={}", event.type().value());
      return;
    }
    final List<Recipient> recipients = new ArrayList<>(plans.size());
    final List<Recipient> pushRecipients = new ArrayList<>();
    for (RecipientPlan plan : plans) {
      recipients.add(plan.recipient());
      if (plan.pushEnabled()) {
        pushRecipients.add(plan.recipient());
      }
    }
    final NotificationEvent filtered = event.withRecipients(recipients);

    for (Recipient recipient : recipients) {
      createInApp(recipient, filtered);
    }

    if (batchService.isImmediateNotification(filtered.type(), filtered.batchable())) {
      for (Recipient recipient : pushRecipients) {
        sendPush(recipient, filtered);
      }
    } else if (!pushRecipients.isEmpty()) {
      batchService.queueNotification(filtered.withRecipients(pushRecipients));
    }

    notifyChatChannels(filtered);
  }

  private List<RecipientPlan> filterRecipients(NotificationEvent event) {
    final NotificationType type = event.type();
    final List<RecipientPlan> plans = new ArrayList<>(event.recipients().size());
    for (Recipient recipient : event.recipients()) {
      if (type.isCritical()) {
        plans.add(new RecipientPlan(recipient, true));
        continue;
      }
      try {
        if (!preferenceStore.isTypeEnabled(recipient.userId(), recipient.workspaceId(), type)) {
          logger.debug(
              "recipient skipped by preference userId={} workspaceId={} type={}",
              recipient.userId(),
              recipient.workspaceId(),
              type.value());
          continue;
        }
        final ChannelPreferences channels =
            preferenceStore.getChannelPreferences(
                recipient.userId(), recipient.workspaceId(), type);
        plans.add(new RecipientPlan(recipient, channels.push()));
      } catch (RuntimeException ex) {
        // 設定を読めない場合は配信側に倒す
        logger.warn(
            "preference lookup failed; delivering anyway userId={} workspaceId={} type={}",
            recipient.userId(),
            recipient.workspaceId(),
            type.value(),
            ex);
        plans.add(new RecipientPlan(recipient, true));
      }
    }
    return plans;
  }

  private void createInApp(Recipient recipient, NotificationEvent event) {
    try {
      inAppNotificationService.create(recipient, event);
      metrics.recordDelivery(IN_APP_CHANNEL, "sent");
    } catch (RuntimeException ex) {
      metrics.recordDelivery(IN_APP_CHANNEL, "failed");
      logger.error(
          "in-app notification failed userId={} workspaceId={} type={}",
          recipient.userId(),
          recipient.workspaceId(),
          event.type().value(),
          ex);
    }
  }

  private void sendPush(Recipient recipient, NotificationEvent event) {
    if (!pushSender.isEnabled()) {
      return;
    }
    try {
      if (shouldHold(recipient, event.type())) {
        quietHoursService.queueForLater(recipient, event);
        metrics.recordDelivery(PUSH_CHANNEL, "held");
        return;
      }
      pushSender.sendToUser(recipient.userId(), toPushMessage(event));
      metrics.recordDelivery(PUSH_CHANNEL, "sent");
    } catch (RuntimeException ex) {
      metrics.recordDelivery(PUSH_CHANNEL, "failed");
      logger.warn(
          "notification push failed userId={} workspaceId={} type={}",
          recipient.userId(),
          recipient.workspaceId(),
          event.type().value(),
          ex);
    }
  }

  private boolean shouldHold(Recipient recipient, NotificationType type) {
    final NotificationPreferences preferences;
    try {
      preferences = preferenceStore.getPreferences(recipient.userId(), recipient.workspaceId());
    } catch (RuntimeException ex) {
      logger.warn(
          "quiet hours lookup failed; sending now userId={} workspaceId={} type={}",
          recipient.userId(),
          recipient.workspaceId(),
          type.value(),
          ex);
      return false;
    }
    if (!quietHoursService.isInQuietHours(recipient.userId(), preferences)) {
      return false;
    }
    return !quietHoursService.shouldBypassQuietHours(type, preferences.quietHours().exceptCritical());
  }

  private void notifyChatChannels(NotificationEvent event) {
    final List<ChannelAdapter> adapters = adapterRegistry.orderedAdapters();
    if (adapters.isEmpty()) {
      return;
    }
    final Set<String> workspaceIds = new LinkedHashSet<>();
    for (Recipient recipient : event.recipients()) {
      workspaceIds.add(recipient.workspaceId());
    }
    for (String workspaceId : workspaceIds) {
      for (ChannelAdapter adapter : adapters) {
        sendToChannel(adapter, workspaceId, event);
      }
    }
  }

  private void sendToChannel(ChannelAdapter adapter, String workspaceId, NotificationEvent event) {
    final String channel = adapter.channelName();
    final ChannelSendResult result;
    try {
      result = adapter.send(workspaceId, event);
    } catch (RuntimeException ex) {
      metrics.recordDelivery(channel, "failed");
      logger.warn(
          "chat notification threw workspaceId={} channel={} type={}",
          workspaceId,
          channel,
          event.type().value(),
          ex);
      return;
    }
    if (result.sent()) {
      metrics.recordDelivery(channel, "sent");
      return;
    }
    metrics.recordDelivery(channel, "failed");
    logger.warn(
        "chat notification not sent workspaceId={} channel={} type={} error={} retryable={}",
        workspaceId,
        channel,
        event.type().value(),
        result.error(),
        result.retryable());
    if (result.retryable()) {
      scheduleRetry(workspaceId, channel, event, result);
    }
  }

  private void scheduleRetry(
      String workspaceId, String channel, NotificationEvent event, ChannelSendResult result) {
    try {
      retryProcessor.enqueue(workspaceId, channel, event, result.retryAfter());
    } catch (RuntimeException ex) {
      logger.error(
          "failed to enqueue notification retry workspaceId={} channel={} type={}",
          workspaceId,
          channel,
          event.type().value(),
          ex);
    }
  }

  private PushMessage toPushMessage(NotificationEvent event) {
    return new PushMessage(
        formatter.title(event.type(), event.payload()),
        formatter.body(event.payload()),
        event.type().value(),
        event.payload(),
        event.urgency());
  }

  private record RecipientPlan(Recipient recipient, boolean pushEnabled) {}
}
