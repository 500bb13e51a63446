/*
 * どこで: Notification サービス層
 * 何を: send-notification ジョブの登録と処理 (チャネルアダプタの再呼び出し) を行う
 * なぜ: 一時的に失敗した webhook 送信を上限回数までバックオフ付きで再試行するため
 */
package com.devos.notification.service;

import com.devos.notification.channel.ChannelAdapter;
import com.devos.notification.channel.ChannelAdapterRegistry;
import com.devos.notification.config.NotificationDeliveryProperties;
import com.devos.notification.model.ChannelSendResult;
import com.devos.notification.model.JobOptions;
import com.devos.notification.model.NotificationEvent;
import com.devos.notification.model.QueuedJob;
import com.devos.notification.model.RetryJob;
import com.devos.notification.model.SendNotificationJobPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SendNotificationJobProcessor {

  public static final String JOB_TYPE = "send-notification";

  // dispatch 中に行われる最初の送信
  static final int INLINE_ATTEMPTS = 1;

  private static final Logger logger = LoggerFactory.getLogger(SendNotificationJobProcessor.class);

  private final DurableJobQueue jobQueue;
  private final ChannelAdapterRegistry adapterRegistry;
  private final NotificationDeliveryProperties properties;
  private final NotificationMetrics metrics;
  private final ObjectMapper objectMapper;

  @PostConstruct
  void registerHandler() {
    jobQueue.register(JOB_TYPE, this::handle);
  }

  /**
   * dispatch 時のインライン送信を 1 回目の試行として数え、残りの {@code maxAttempts - 1} 回をジョブに載せる。
   * retryAfter が指定されていれば初回実行をその分遅らせる。
   */
  public Optional<UUID> enqueue(
      String workspaceId, String channel, NotificationEvent notification, Duration retryAfter) {
    final int remainingAttempts = properties.maxAttempts() - INLINE_ATTEMPTS;
    if (remainingAttempts < 1) {
      metrics.recordRetry("exhausted");
      logger.warn(
          "notification retry not enqueued; no attempts left workspaceId={} channel={} type={}",
          workspaceId,
          channel,
          notification.type().value());
      return Optional.empty();
    }
    final JobOptions options =
        new JobOptions(remainingAttempts, properties.backoffBase(), retryAfter);
    final UUID jobId =
        jobQueue.enqueue(
            JOB_TYPE, new SendNotificationJobPayload(workspaceId, channel, notification), options);
    metrics.recordRetry("scheduled");
    logger.info(
        "notification retry enqueued jobId={} workspaceId={} channel={} type={}",
        jobId,
        workspaceId,
        channel,
        notification.type().value());
    return Optional.of(jobId);
  }

  void handle(QueuedJob job) {
    final SendNotificationJobPayload payload;
    try {
      payload = objectMapper.readValue(job.payloadJson(), SendNotificationJobPayload.class);
    } catch (JsonProcessingException ex) {
      // 壊れたペイロードは再試行しても回復しない
      logger.error("dropping unreadable send-notification job id={}", job.jobId(), ex);
      metrics.recordRetry("dropped");
      return;
    }
    process(
        new RetryJob(
            payload.workspaceId(),
            payload.channel(),
            payload.notification(),
            job.attempt() + INLINE_ATTEMPTS));
  }

  /**
   * attempt はインライン送信を含めた通し番号。送信に失敗し attempt が上限未満なら {@link RetryableNotificationException} を送出する。上限に達した失敗はログに残して終了する。
   */
  public void process(RetryJob job) {
    final Optional<ChannelAdapter> adapter = adapterRegistry.find(job.channel());
    if (adapter.isEmpty()) {
      logger.warn(
          "retry dropped; channel unavailable workspaceId={} channel={} type={}",
          job.workspaceId(),
          job.channel(),
          job.notification().type().value());
      metrics.recordRetry("dropped");
      return;
    }
    ChannelSendResult result;
    try {
      result = adapter.get().send(job.workspaceId(), job.notification());
    } catch (RuntimeException ex) {
      logger.warn(
          "retry send threw workspaceId={} channel={} attempt={}",
          job.workspaceId(),
          job.channel(),
          job.attempt(),
          ex);
      result = ChannelSendResult.transientFailure(ex.getMessage());
    }
    if (result.sent()) {
      metrics.recordRetry("sent");
      metrics.recordDelivery(job.channel(), "sent");
      logger.info(
          "notification retry succeeded workspaceId={} channel={} attempt={}",
          job.workspaceId(),
          job.channel(),
          job.attempt());
      return;
    }
    if (job.attempt() < properties.maxAttempts()) {
      throw new RetryableNotificationException(
          "notification retry failed channel="
              + job.channel()
              + " attempt="
              + job.attempt()
              + " error="
              + result.error());
    }
    metrics.recordRetry("exhausted");
    logger.warn(
        "notification retry exhausted workspaceId={} channel={} type={} attempt={} error={}",
        job.workspaceId(),
        job.channel(),
        job.notification().type().value(),
        job.attempt(),
        result.error());
  }
}
