package com.devos.notification.repository;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

/** quiet hours 中に保留した通知 (QueuedNotification の JSON) を保持する。 */
public interface QuietHoursQueueRepository {

  /** (userId, timestamp) に一意な接尾辞を付けたキーで保存し、そのキーを返す。同一ミリ秒でも上書きしない。 */
  String save(String userId, long timestampMillis, String notificationJson, Duration retention);

  /** キー → JSON。取得までに期限切れになったエントリは含まない。 */
  Map<String, String> findAll(String userId);

  long count(String userId);

  /** findAll で読んだキーだけを消す。読んだ後に保存されたエントリは残る。 */
  void delete(Collection<String> keys);

  Set<String> findUserIdsWithHeldNotifications();
}
