package com.devos.notification.channel;

import com.devos.notification.config.NotificationChatProperties;
import com.devos.notification.model.ChatIntegrationRecord;
import com.devos.notification.model.NotificationEvent;
import com.devos.notification.repository.ChatIntegrationRepository;
import com.devos.notification.service.NotificationMessageFormatter;
import com.devos.notification.service.NotificationMetrics;
import com.devos.notification.service.NotificationRateLimiter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** Discord の incoming webhook へ content + embed 1 件を送る。 */
@Component
public class DiscordWebhookChannelAdapter extends AbstractWebhookChannelAdapter {

  public static final String CHANNEL_NAME = "discord";
  private static final int MAX_CONTENT_LENGTH = 2000;

  public DiscordWebhookChannelAdapter(
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
        properties.discord().enabled());
  }

  @Override
  public String channelName() {
    return CHANNEL_NAME;
  }

  @Override
  protected Map<String, Object> buildBody(
      NotificationEvent notification, ChatIntegrationRecord integration) {
    final Map<String, Object> embed = new LinkedHashMap<>();
    embed.put("title", formatter.title(notification.type(), notification.payload()));
    embed.put("description", formatter.body(notification.payload()));
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("content", truncate(formatter.text(notification.type(), notification.payload())));
    body.put("embeds", List.of(embed));
    return body;
  }

  private String truncate(String content) {
    return content.length() <= MAX_CONTENT_LENGTH ? content : content.substring(0, MAX_CONTENT_LENGTH);
  }
}
