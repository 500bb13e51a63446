/*
 * どこで: Notification サービス層
 * 何を: NATS で受けた通知メッセージを検証し、受信者を確定して dispatch へ渡す
 * なぜ: ワイヤ形式の揺れを吸収し、恒久エラーと一時エラーを呼び出し側で区別できるようにするため
 */
package com.devos.notification.service;

import com.devos.notification.model.InboundNotificationMessage;
import com.devos.notification.model.NotificationEvent;
import com.devos.notification.model.NotificationType;
import com.devos.notification.model.NotificationUrgency;
import com.devos.notification.model.Recipient;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(NotificationEventHandler.class);

  private final RecipientResolver recipientResolver;
  private final NotificationDispatchService dispatchService;

  /**
   * 種別や urgency が解釈できない場合は {@link NotificationEventPermanentException}。
   * 受信者解決中の DB 障害などはそのまま送出する。
   */
  public void handle(InboundNotificationMessage message) {
    final NotificationEvent event = toEvent(message);
    if (event.recipients().isEmpty()) {
      logger.info("notification event has no recipients type={}", event.type().value());
      return;
    }
    dispatchService.dispatch(event);
  }

  private NotificationEvent toEvent(InboundNotificationMessage message) {
    final NotificationType type;
    final NotificationUrgency urgency;
    try {
      type = NotificationType.fromValue(message.type());
      urgency = message.urgency() == null ? null : NotificationUrgency.fromValue(message.urgency());
    } catch (IllegalArgumentException ex) {
      throw new NotificationEventPermanentException("invalid notification event", ex);
    }
    return new NotificationEvent(
        type,
        message.payload(),
        resolveRecipients(message),
        urgency,
        Boolean.TRUE.equals(message.batchable()));
  }

  private List<Recipient> resolveRecipients(InboundNotificationMessage message) {
    if (message.recipients() != null && !message.recipients().isEmpty()) {
      return message.recipients();
    }
    if (message.scope() == null || message.scope().kind() == null) {
      throw new NotificationEventPermanentException(
          "notification event has neither recipients nor scope", null);
    }
    return recipientResolver.resolve(message.scope());
  }
}
