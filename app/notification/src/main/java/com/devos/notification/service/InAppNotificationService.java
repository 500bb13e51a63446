package com.devos.notification.service;

import com.devos.notification.model.InAppNotificationRecord;
import com.devos.notification.model.NotificationEvent;
import com.devos.notification.model.Recipient;
import com.devos.notification.repository.InAppNotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** 受信者ごとのアプリ内通知レコードを作成する。 */
@Service
@RequiredArgsConstructor
public class InAppNotificationService {

  private final InAppNotificationRepository inAppNotificationRepository;
  private final NotificationMessageFormatter formatter;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public UUID create(Recipient recipient, NotificationEvent event) {
    final String payloadJson;
    try {
      payloadJson = objectMapper.writeValueAsString(event.payload());
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("notification payload is not serializable", ex);
    }
    final InAppNotificationRecord record =
        new InAppNotificationRecord(
            UUID.randomUUID(),
            recipient.userId(),
            recipient.workspaceId(),
            event.type().value(),
            formatter.title(event.type(), event.payload()),
            formatter.body(event.payload()),
            payloadJson,
            null,
            Instant.now(clock));
    return inAppNotificationRepository.insert(record);
  }

  public List<InAppNotificationRecord> findRecent(String userId, String workspaceId, int limit) {
    return inAppNotificationRepository.findByUserIdAndWorkspaceId(userId, workspaceId, limit);
  }
}
