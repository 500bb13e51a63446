/*
 * どこで: Notification チャネル層
 * 何を: チャット webhook 送信の共通フロー (連携有無 → 状態 → レート制限 → POST → 健全性更新) を実装する
 * なぜ: プロバイダごとの差分を本文生成と無効判定だけに閉じ込めるため
 */
package com.devos.notification.channel;

import com.devos.notification.model.ChannelSendResult;
import com.devos.notification.model.ChatIntegrationRecord;
import com.devos.notification.model.IntegrationStatus;
import com.devos.notification.model.NotificationEvent;
import com.devos.notification.repository.ChatIntegrationRepository;
import com.devos.notification.service.NotificationMessageFormatter;
import com.devos.notification.service.NotificationMetrics;
import com.devos.notification.service.NotificationRateLimiter;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public abstract class AbstractWebhookChannelAdapter implements ChannelAdapter {

  private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(60);

  protected final Logger logger = LoggerFactory.getLogger(getClass());

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient restClient;

  private final ChatIntegrationRepository integrationRepository;
  private final ChatIntegrationHealthService healthService;
  private final NotificationRateLimiter rateLimiter;
  private final NotificationMetrics metrics;
  protected final NotificationMessageFormatter formatter;
  private final boolean enabled;

  protected AbstractWebhookChannelAdapter(
      RestClient restClient,
      ChatIntegrationRepository integrationRepository,
      ChatIntegrationHealthService healthService,
      NotificationRateLimiter rateLimiter,
      NotificationMetrics metrics,
      NotificationMessageFormatter formatter,
      boolean enabled) {
    this.restClient = restClient;
    this.integrationRepository = integrationRepository;
    this.healthService = healthService;
    this.rateLimiter = rateLimiter;
    this.metrics = metrics;
    this.formatter = formatter;
    this.enabled = enabled;
  }

  @Override
  public boolean isConfigured() {
    return enabled;
  }

  @Override
  public ChannelSendResult send(String workspaceId, NotificationEvent notification) {
    if (!isConfigured()) {
      return ChannelSendResult.failed(channelName() + " is not configured");
    }
    final Optional<ChatIntegrationRecord> found;
    try {
      found = integrationRepository.findByWorkspaceIdAndProvider(workspaceId, channelName());
    } catch (RuntimeException ex) {
      logger.warn(
          "{} integration lookup failed workspaceId={}", channelName(), workspaceId, ex);
      return ChannelSendResult.transientFailure("integration lookup failed");
    }
    if (found.isEmpty()) {
      return ChannelSendResult.failed("no " + channelName() + " integration for workspace");
    }
    final ChatIntegrationRecord integration = found.get();
    if (integration.status() != IntegrationStatus.ACTIVE) {
      return ChannelSendResult.failed(
          channelName() + " integration status is " + integration.status().name().toLowerCase(Locale.ROOT));
    }

    final String targetId = rateLimitTarget(integration);
    if (rateLimiter.isRateLimited(targetId, integration.rateLimitPerMinute())) {
      metrics.recordRateLimited(channelName());
      logger.warn(
          "{} rate limit exceeded workspaceId={} targetId={}", channelName(), workspaceId, targetId);
      return ChannelSendResult.failed("rate limit exceeded");
    }

    try {
      restClient
          .post()
          .uri(URI.create(integration.webhookUrl()))
          .contentType(MediaType.APPLICATION_JSON)
          .body(buildBody(notification, integration))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      return handleResponseException(integration, notification, ex);
    } catch (ResourceAccessException ex) {
      final String error = isTimeout(ex) ? "webhook request timed out" : "webhook connection failed";
      logger.warn(
          "{} send failed workspaceId={} type={} reason={}",
          channelName(),
          workspaceId,
          notification.type().value(),
          error,
          ex);
      healthService.recordFailure(integration, error);
      return ChannelSendResult.transientFailure(error);
    } catch (RuntimeException ex) {
      logger.warn(
          "{} send failed workspaceId={} type={}",
          channelName(),
          workspaceId,
          notification.type().value(),
          ex);
      healthService.recordFailure(integration, ex.getMessage());
      return ChannelSendResult.failed("webhook request failed");
    }

    rateLimiter.recordSend(targetId);
    healthService.recordSuccess(integration);
    logger.debug(
        "{} notification sent workspaceId={} type={}",
        channelName(),
        workspaceId,
        notification.type().value());
    return ChannelSendResult.delivered(integration.channelName());
  }

  /** プロバイダ向けの JSON 本文。 */
  protected abstract Map<String, Object> buildBody(
      NotificationEvent notification, ChatIntegrationRecord integration);

  /** 連携を即座に INVALID_WEBHOOK とみなす HTTP ステータス。 */
  protected boolean isInvalidWebhookStatus(int status) {
    return status == 401 || status == 404;
  }

  protected String rateLimitTarget(ChatIntegrationRecord integration) {
    final String id =
        integration.webhookId() == null || integration.webhookId().isBlank()
            ? integration.integrationId().toString()
            : integration.webhookId();
    return channelName() + ":" + id;
  }

  private ChannelSendResult handleResponseException(
      ChatIntegrationRecord integration,
      NotificationEvent notification,
      RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "{} send failed with http status={} workspaceId={} type={}",
        channelName(),
        status,
        integration.workspaceId(),
        notification.type().value());
    if (isInvalidWebhookStatus(status)) {
      healthService.markInvalidWebhook(integration, "webhook rejected with status " + status);
      return ChannelSendResult.failed("invalid webhook");
    }
    if (status == 429) {
      final Duration retryAfter = parseRetryAfter(ex.getResponseHeaders());
      healthService.recordFailure(integration, channelName() + " rate limited (429)");
      return ChannelSendResult.retryLater("rate limited by provider", retryAfter);
    }
    final String error = "webhook responded with status " + status;
    healthService.recordFailure(integration, error);
    if (ex.getStatusCode().is5xxServerError()) {
      return ChannelSendResult.transientFailure(error);
    }
    return ChannelSendResult.failed(error);
  }

  private Duration parseRetryAfter(HttpHeaders headers) {
    final String value = headers == null ? null : headers.getFirst(HttpHeaders.RETRY_AFTER);
    if (value == null || value.isBlank()) {
      return DEFAULT_RETRY_AFTER;
    }
    try {
      final double seconds = Double.parseDouble(value.trim());
      return seconds > 0 ? Duration.ofMillis((long) Math.ceil(seconds * 1000)) : DEFAULT_RETRY_AFTER;
    } catch (NumberFormatException ex) {
      return DEFAULT_RETRY_AFTER;
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
