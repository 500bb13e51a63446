/*
 * どこで: Notification サービス層
 * 何を: タイムゾーンを考慮した quiet hours 判定、保留キューへの退避、ダイジェスト生成を行う
 * なぜ: 深夜帯などの非 critical 通知を保留し、窓の終了後にまとめて届けるため
 */
package com.devos.notification.service;

import com.devos.notification.config.NotificationQuietHoursProperties;
import com.devos.notification.model.DigestSummary;
import com.devos.notification.model.NotificationEvent;
import com.devos.notification.model.NotificationPreferences;
import com.devos.notification.model.NotificationType;
import com.devos.notification.model.QueuedNotification;
import com.devos.notification.model.QuietHoursConfig;
import com.devos.notification.model.QuietHoursStatus;
import com.devos.notification.model.Recipient;
import com.devos.notification.repository.QuietHoursQueueRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class QuietHoursService {

  private static final Logger logger = LoggerFactory.getLogger(QuietHoursService.class);
  private static final int MINUTES_PER_DAY = 24 * 60;
  private static final ZoneId UTC = ZoneId.of("UTC");

  private final QuietHoursQueueRepository queueRepository;
  private final NotificationQuietHoursProperties properties;
  private final NotificationMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /** 判定に失敗した場合は quiet hours 外として扱う。 */
  public boolean isInQuietHours(String userId, NotificationPreferences preferences) {
    final QuietHoursConfig config = preferences == null ? null : preferences.quietHours();
    if (config == null || !config.enabled()) {
      return false;
    }
    try {
      final ZoneId zone = resolveZone(config.timezone());
      final LocalTime now = LocalTime.now(clock.withZone(zone));
      final String current = String.format("%02d:%02d", now.getHour(), now.getMinute());
      return isTimeBetween(current, config.startTime(), config.endTime());
    } catch (RuntimeException ex) {
      logger.warn("quiet hours check failed userId={}; treating as outside quiet hours", userId, ex);
      return false;
    }
  }

  public QuietHoursStatus getStatus(String userId, NotificationPreferences preferences) {
    if (!isInQuietHours(userId, preferences)) {
      return QuietHoursStatus.inactive();
    }
    final QuietHoursConfig config = preferences.quietHours();
    final ZoneId zone = resolveZone(config.timezone());
    return new QuietHoursStatus(true, calculateEndTime(config, zone), zone.getId());
  }

  /** critical 種別は exceptCritical の値に関わらず常に素通りさせる。 */
  public boolean shouldBypassQuietHours(NotificationType type, boolean exceptCritical) {
    return type.isCritical();
  }

  /**
   * [start, end) に current が含まれるか。start > end は日付をまたぐ窓として扱う。
   */
  public boolean isTimeBetween(String current, String start, String end) {
    final int currentMinutes = timeToMinutes(current);
    final int startMinutes = timeToMinutes(start);
    final int endMinutes = timeToMinutes(end);
    if (startMinutes <= endMinutes) {
      return currentMinutes >= startMinutes && currentMinutes < endMinutes;
    }
    return currentMinutes >= startMinutes || currentMinutes < endMinutes;
  }

  public void queueForLater(Recipient recipient, NotificationEvent event) {
    final Instant now = Instant.now(clock);
    final QueuedNotification queued =
        new QueuedNotification(event.type(), event.payload(), now, recipient.workspaceId());
    try {
      queueRepository.save(
          recipient.userId(),
          now.toEpochMilli(),
          objectMapper.writeValueAsString(queued),
          properties.retention());
      metrics.recordQuietHoursHeld();
      logger.debug(
          "notification held for quiet hours userId={} workspaceId={} type={}",
          recipient.userId(),
          recipient.workspaceId(),
          event.type().value());
    } catch (JsonProcessingException | RuntimeException ex) {
      logger.error(
          "failed to hold notification for quiet hours userId={} workspaceId={} type={}",
          recipient.userId(),
          recipient.workspaceId(),
          event.type().value(),
          ex);
    }
  }

  /** タイムスタンプ昇順で返す。壊れたエントリは読み飛ばす。 */
  public List<QueuedNotification> getQueuedNotifications(String userId) {
    return parse(userId, readQueue(userId).values());
  }

  public List<QueuedNotification> flushQueuedNotifications(String userId) {
    final Map<String, String> held = readQueue(userId);
    if (held.isEmpty()) {
      return List.of();
    }
    final List<QueuedNotification> items = parse(userId, held.values());
    try {
      // 読み取り後に保留されたエントリは次回の flush まで残す
      queueRepository.delete(held.keySet());
    } catch (RuntimeException ex) {
      logger.error("failed to clear quiet hours queue userId={}", userId, ex);
    }
    metrics.recordQuietHoursFlushed(items.size());
    return items;
  }

  private Map<String, String> readQueue(String userId) {
    try {
      return queueRepository.findAll(userId);
    } catch (RuntimeException ex) {
      logger.error("failed to read quiet hours queue userId={}", userId, ex);
      return Map.of();
    }
  }

  private List<QueuedNotification> parse(String userId, Collection<String> rawItems) {
    final List<QueuedNotification> items = new ArrayList<>(rawItems.size());
    for (String raw : rawItems) {
      try {
        items.add(objectMapper.readValue(raw, QueuedNotification.class));
      } catch (JsonProcessingException | IllegalArgumentException ex) {
        logger.warn("skipping corrupted quiet hours entry userId={}", userId, ex);
      }
    }
    items.sort(Comparator.comparing(QueuedNotification::timestamp));
    return items;
  }

  public long countQueuedNotifications(String userId) {
    try {
      return queueRepository.count(userId);
    } catch (RuntimeException ex) {
      logger.warn("failed to count quiet hours queue userId={}", userId, ex);
      return 0L;
    }
  }

  public List<String> findUsersWithHeldNotifications() {
    return List.copyOf(queueRepository.findUserIdsWithHeldNotifications());
  }

  public DigestSummary buildDigestSummary(List<QueuedNotification> notifications) {
    final Map<String, Integer> byType = new LinkedHashMap<>();
    for (QueuedNotification notification : notifications) {
      byType.merge(notification.type().value(), 1, Integer::sum);
    }
    final int count = notifications.size();
    final String title = count + " notification" + (count == 1 ? "" : "s") + " during quiet hours";
    final String body =
        "You missed: "
            + byType.entrySet().stream()
                .map(entry -> entry.getValue() + " " + entry.getKey().replace('_', ' '))
                .collect(Collectors.joining(", "));
    return new DigestSummary(title, body, count, byType);
  }

  @VisibleForTesting
  Instant calculateEndTime(QuietHoursConfig config, ZoneId zone) {
    final ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
    final int currentMinutes = now.getHour() * 60 + now.getMinute();
    final int startMinutes = timeToMinutes(config.startTime());
    final int endMinutes = timeToMinutes(config.endTime());
    ZonedDateTime end =
        now.toLocalDate().atTime(endMinutes / 60, endMinutes % 60).atZone(zone);
    final boolean crossesMidnight = startMinutes > endMinutes;
    if (crossesMidnight && currentMinutes >= startMinutes) {
      end = end.plusDays(1);
    } else if (!crossesMidnight && currentMinutes >= endMinutes) {
      end = end.plusDays(1);
    }
    return end.toInstant();
  }

  @VisibleForTesting
  ZoneId resolveZone(String timezone) {
    if (timezone == null || timezone.isBlank()) {
      return UTC;
    }
    try {
      return ZoneId.of(timezone);
    } catch (DateTimeException ex) {
      logger.warn("invalid quiet hours timezone={}; falling back to UTC", timezone);
      return UTC;
    }
  }

  static int timeToMinutes(String time) {
    final int separator = time.indexOf(':');
    if (separator < 0) {
      throw new IllegalArgumentException("time must be HH:MM: " + time);
    }
    final int hours = Integer.parseInt(time.substring(0, separator));
    final int minutes = Integer.parseInt(time.substring(separator + 1));
    final int total = hours * 60 + minutes;
    if (hours < 0 || minutes < 0 || minutes > 59 || total >= MINUTES_PER_DAY) {
      throw new IllegalArgumentException("time must be HH:MM: " + time);
    }
    return total;
  }
}
