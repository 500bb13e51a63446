/*
 * どこで: Notification チャネル層
 * 何を: チャット連携の健全性 (ACTIVE / ERROR / INVALID_WEBHOOK) と連続失敗カウンタを更新する
 * なぜ: 壊れた webhook への送信を打ち切り、再接続が必要なことを記録するため
 */
package com.devos.notification.channel;

import com.devos.notification.model.ChatIntegrationRecord;
import com.devos.notification.model.IntegrationStatus;
import com.devos.notification.repository.ChatIntegrationRepository;
import com.devos.notification.service.NotificationMetrics;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ChatIntegrationHealthService {

  private static final Logger logger = LoggerFactory.getLogger(ChatIntegrationHealthService.class);
  static final int MAX_CONSECUTIVE_FAILURES = 3;
  private static final int MAX_ERROR_LENGTH = 500;

  private final ChatIntegrationRepository integrationRepository;
  private final NotificationMetrics metrics;
  private final Clock clock;

  public void recordSuccess(ChatIntegrationRecord integration) {
    try {
      integrationRepository.recordSuccess(integration.integrationId(), Instant.now(clock));
    } catch (RuntimeException ex) {
      logger.warn(
          "failed to record chat integration success integrationId={} provider={}",
          integration.integrationId(),
          integration.provider(),
          ex);
    }
  }

  /**
   * 連続失敗を 1 増やし、上限に達したら ERROR へ遷移させる。
   *
   * @return 更新後の状態
   */
  public IntegrationStatus recordFailure(ChatIntegrationRecord integration, String error) {
    final int errorCount = integration.errorCount() + 1;
    final IntegrationStatus status =
        errorCount >= MAX_CONSECUTIVE_FAILURES ? IntegrationStatus.ERROR : integration.status();
    update(integration, status, errorCount, error);
    if (status != integration.status()) {
      logger.warn(
          "chat integration disabled after consecutive failures integrationId={} provider={} workspaceId={} errorCount={}",
          integration.integrationId(),
          integration.provider(),
          integration.workspaceId(),
          errorCount);
    }
    return status;
  }

  public void markInvalidWebhook(ChatIntegrationRecord integration, String error) {
    update(integration, IntegrationStatus.INVALID_WEBHOOK, integration.errorCount(), error);
    logger.warn(
        "chat integration webhook invalid integrationId={} provider={} workspaceId={}",
        integration.integrationId(),
        integration.provider(),
        integration.workspaceId());
  }

  private void update(
      ChatIntegrationRecord integration, IntegrationStatus status, int errorCount, String error) {
    try {
      integrationRepository.updateHealth(
          integration.integrationId(), status, errorCount, truncate(error), Instant.now(clock));
      if (status != integration.status()) {
        metrics.recordIntegrationStatus(integration.provider(), status.name());
      }
    } catch (RuntimeException ex) {
      logger.warn(
          "failed to update chat integration health integrationId={} provider={} status={}",
          integration.integrationId(),
          integration.provider(),
          status,
          ex);
    }
  }

  private String truncate(String error) {
    if (error == null) {
      return null;
    }
    return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
  }
}
