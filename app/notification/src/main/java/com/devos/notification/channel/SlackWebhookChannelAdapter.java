package com.devos.notification.channel;

import com.devos.notification.config.NotificationChatProperties;
import com.devos.notification.model.ChatIntegrationRecord;
import com.devos.notification.model.NotificationEvent;
import com.devos.notification.repository.ChatIntegrationRepository;
import com.devos.notification.service.NotificationMessageFormatter;
import com.devos.notification.service.NotificationMetrics;
import com.devos.notification.service.NotificationRateLimiter;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** Slack の incoming webhook へプレーンテキストを送る。 */
@Component
public class SlackWebhookChannelAdapter extends AbstractWebhookChannelAdapter {

  public static final String CHANNEL_NAME = "slack";

  public SlackWebhookChannelAdapter(
      RestClient chatWebhookRestClient,
      ChatIntegrationRepository integrationRepository,
      ChatIntegrationHealthService healthService,
      NotificationRateLimiter rateLimiter,
      NotificationMetrics metrics,
      NotificationMessageFormatter formatter,
      NotificationChatProperties properties) {
    super(
        chatWebhookRestClient,
        integrationRepository,
        healthService,
        rateLimiter,
        metrics,
        formatter,
        properties.slack().enabled());
  }

  @Override
  public String channelName() {
    return CHANNEL_NAME;
  }

  @Override
  protected Map<String, Object> buildBody(
      NotificationEvent notification, ChatIntegrationRecord integration) {
    return Map.of("text", formatter.text(notification.type(), notification.payload()));
  }

  // Slack は失効した webhook に 403 (invalid_token) / 410 (channel_is_archived) も返す
  @Override
  protected boolean isInvalidWebhookStatus(int status) {
    return super.isInvalidWebhookStatus(status) || status == 403 || status == 410;
  }
}
