/*
 * どこで: Notification サービス層
 * 何を: 受信者ごとのバッチバッファへの追加、取り出し、種別ごとの集約を行う
 * なぜ: 頻発する完了通知などを 1 件の要約にまとめて push 回数を抑えるため
 */
package com.devos.notification.service;

import com.devos.notification.config.NotificationBatchProperties;
import com.devos.notification.model.BatchedNotification;
import com.devos.notification.model.ConsolidatedNotification;
import com.devos.notification.model.NotificationEvent;
import com.devos.notification.model.NotificationType;
import com.devos.notification.model.Recipient;
import com.devos.notification.repository.BatchQueueRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationBatchService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationBatchService.class);
  private static final int MAX_SAMPLES = 5;
  private static final List<String> TITLE_KEYS = List.of("storyTitle", "epicTitle", "title");
  private static final List<String> NAME_KEYS = List.of("agentName", "projectName");

  private final BatchQueueRepository batchQueueRepository;
  private final NotificationBatchProperties properties;
  private final NotificationMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /** immediate 種別、または batchable でないイベントは即時送信する。 */
  public boolean isImmediateNotification(NotificationType type, boolean batchable) {
    return type.isImmediate() || !batchable;
  }

  public void queueNotification(NotificationEvent event) {
    final Instant now = Instant.now(clock);
    for (Recipient recipient : event.recipients()) {
      final BatchedNotification item =
          new BatchedNotification(event.type(), event.payload(), now, recipient.workspaceId());
      try {
        batchQueueRepository.append(
            recipient.userId(), objectMapper.writeValueAsString(item), properties.ttl());
        metrics.recordBatchQueued();
      } catch (JsonProcessingException | RuntimeException ex) {
        logger.error(
            "failed to queue notification for batch userId={} workspaceId={} type={}",
            recipient.userId(),
            recipient.workspaceId(),
            event.type().value(),
            ex);
      }
    }
  }

  /** バッファを取り出してクリアする。存在しない、または読めない場合は空リスト。 */
  public List<BatchedNotification> flushBatch(String userId) {
    final List<String> rawItems;
    try {
      rawItems = batchQueueRepository.drain(userId);
    } catch (RuntimeException ex) {
      logger.error("failed to flush batch userId={}", userId, ex);
      return List.of();
    }
    final List<BatchedNotification> items = new ArrayList<>(rawItems.size());
    for (String raw : rawItems) {
      try {
        items.add(objectMapper.readValue(raw, BatchedNotification.class));
      } catch (JsonProcessingException | IllegalArgumentException ex) {
        logger.warn("skipping corrupted batch entry userId={}", userId, ex);
      }
    }
    metrics.recordBatchFlushed(items.size());
    return items;
  }

  public int getBatchSize(String userId) {
    try {
      return (int) batchQueueRepository.size(userId);
    } catch (RuntimeException ex) {
      logger.warn("failed to read batch size userId={}", userId, ex);
      return 0;
    }
  }

  public List<String> findUsersWithPendingBatches() {
    return List.copyOf(batchQueueRepository.findUserIdsWithPendingBatches());
  }

  /**
   * 種別ごとにまとめる。consolidatable な種別で 2 件以上あれば {@code <type>_batch} の 1 件に畳み込み、
   * それ以外はそのまま返す。出力順は各種別が最初に現れた順。
   */
  public List<ConsolidatedNotification> consolidateBatch(List<BatchedNotification> notifications) {
    final Map<NotificationType, List<BatchedNotification>> byType = new LinkedHashMap<>();
    for (BatchedNotification notification : notifications) {
      byType.computeIfAbsent(notification.type(), ignored -> new ArrayList<>()).add(notification);
    }
    final List<ConsolidatedNotification> result = new ArrayList<>();
    for (Map.Entry<NotificationType, List<BatchedNotification>> entry : byType.entrySet()) {
      final NotificationType type = entry.getKey();
      final List<BatchedNotification> group = entry.getValue();
      if (group.size() > 1 && type.isConsolidatable()) {
        result.add(consolidateGroup(type, group));
        continue;
      }
      for (BatchedNotification notification : group) {
        result.add(
            new ConsolidatedNotification(
                type.value(),
                notification.payload(),
                notification.workspaceId(),
                notification.timestamp()));
      }
    }
    return result;
  }

  private ConsolidatedNotification consolidateGroup(
      NotificationType type, List<BatchedNotification> group) {
    final Set<String> titles = sample(group, TITLE_KEYS);
    final Set<String> names = sample(group, NAME_KEYS);
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("count", group.size());
    payload.put("titles", List.copyOf(titles));
    payload.put("names", List.copyOf(names));
    payload.put("title", group.size() + " " + type.displayName() + " notifications");
    final Instant latest =
        group.stream()
            .map(BatchedNotification::timestamp)
            .filter(timestamp -> timestamp != null)
            .max(Comparator.naturalOrder())
            .orElse(null);
    return new ConsolidatedNotification(
        type.value() + "_batch", payload, group.get(0).workspaceId(), latest);
  }

  private Set<String> sample(List<BatchedNotification> group, List<String> keys) {
    final Set<String> values = new LinkedHashSet<>();
    for (BatchedNotification notification : group) {
      if (values.size() >= MAX_SAMPLES) {
        break;
      }
      for (String key : keys) {
        final Object value = notification.payload() == null ? null : notification.payload().get(key);
        if (value != null && !String.valueOf(value).isBlank()) {
          values.add(String.valueOf(value));
          break;
        }
      }
    }
    return values;
  }
}
