/*
 * どこで: Notification サービス層
 * 何を: quiet hours の窓が明けたユーザーの保留通知を取り出し、ダイジェスト 1 件として push する
 * なぜ: 保留中の通知を窓の終了後に取りこぼさず届けるため
 */
package com.devos.notification.service;

import com.devos.notification.channel.PushNotificationSender;
import com.devos.notification.model.DigestSummary;
import com.devos.notification.model.NotificationPreferences;
import com.devos.notification.model.NotificationUrgency;
import com.devos.notification.model.PushMessage;
import com.devos.notification.model.QueuedNotification;
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
public class QuietHoursFlushService {

  public static final String DIGEST_TYPE = "quiet_hours_digest";

  private static final Logger logger = LoggerFactory.getLogger(QuietHoursFlushService.class);
  private static final String PUSH_CHANNEL = "push";

  private final QuietHoursService quietHoursService;
  private final PreferenceStore preferenceStore;
  private final PushNotificationSender pushSender;
  private final NotificationMetrics metrics;

  /** ダイジェストを送ったユーザー数を返す。 */
  public int flushEndedWindows() {
    final List<String> userIds;
    try {
      userIds = quietHoursService.findUsersWithHeldNotifications();
    } catch (RuntimeException ex) {
      logger.error("failed to enumerate held quiet hours notifications", ex);
      return 0;
    }
    int delivered = 0;
    for (String userId : userIds) {
      try {
        if (flushUserIfWindowEnded(userId)) {
          delivered++;
        }
      } catch (RuntimeException ex) {
        logger.warn("quiet hours flush failed userId={}", userId, ex);
      }
    }
    return delivered;
  }

  /**
   * 保留中の通知が属するいずれかのワークスペースでまだ quiet hours 中なら何もしない。
   * push が無効な場合は保留を残し、retention による失効に任せる。
   */
  public boolean flushUserIfWindowEnded(String userId) {
    final List<QueuedNotification> held = quietHoursService.getQueuedNotifications(userId);
    if (held.isEmpty()) {
      return false;
    }
    final Set<String> workspaceIds = new LinkedHashSet<>();
    for (QueuedNotification notification : held) {
      workspaceIds.add(notification.workspaceId());
    }
    for (String workspaceId : workspaceIds) {
      if (stillInQuietHours(userId, workspaceId)) {
        return false;
      }
    }
    if (!pushSender.isEnabled()) {
      return false;
    }
    final List<QueuedNotification> flushed = quietHoursService.flushQueuedNotifications(userId);
    if (flushed.isEmpty()) {
      return false;
    }
    final DigestSummary digest = quietHoursService.buildDigestSummary(flushed);
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("count", digest.count());
    data.put("byType", digest.byType());
    pushSender.sendToUser(
        userId,
        new PushMessage(digest.title(), digest.body(), DIGEST_TYPE, data, NotificationUrgency.NORMAL));
    metrics.recordDelivery(PUSH_CHANNEL, "sent");
    logger.info("quiet hours digest sent userId={} count={}", userId, digest.count());
    return true;
  }

  private boolean stillInQuietHours(String userId, String workspaceId) {
    final NotificationPreferences preferences;
    try {
      preferences = preferenceStore.getPreferences(userId, workspaceId);
    } catch (RuntimeException ex) {
      logger.warn(
          "quiet hours lookup failed during flush userId={} workspaceId={}",
          userId,
          workspaceId,
          ex);
      return false;
    }
    return quietHoursService.isInQuietHours(userId, preferences);
  }
}
