/*
 * どこで: Notification チャネル層
 * 何を: push 送信を模擬する実装
 * なぜ: 外部 push サービスを伴わずに配信経路を確認するため
 */
package com.devos.notification.channel;

import com.devos.notification.config.NotificationPushProperties;
import com.devos.notification.model.PushMessage;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LocalPushNotificationSender implements PushNotificationSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalPushNotificationSender.class);

  private final NotificationPushProperties properties;

  @Override
  public boolean isEnabled() {
    return properties.enabled();
  }

  @Override
  public void sendToUser(String userId, PushMessage message) {
    // 実送信は行わず、ログに残すだけとする
    logger.info(
        "push simulated send userId={} type={} urgency={} title={}",
        userId,
        message.type(),
        message.urgency() == null ? null : message.urgency().value(),
        message.title());
  }
}
