/*
 * どこで: Notification データアクセス(Redis)
 * 何を: quiet-hours:<userId>:<timestamp>-<uuid> キーで保留通知を保存/列挙/削除する
 * なぜ: 保留通知を 12 時間の保持上限付きで複数インスタンスから共有するため
 */
package com.devos.notification.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisQuietHoursQueueRepository implements QuietHoursQueueRepository {

  private static final String KEY_PREFIX = "quiet-hours:";
  private static final long SCAN_COUNT = 100L;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisQuietHoursQueueRepository(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public String save(String userId, long timestampMillis, String notificationJson, Duration retention) {
    final String key = heldKey(userId, timestampMillis, UUID.randomUUID().toString());
    redisTemplate.opsForValue().set(key, notificationJson, retention);
    return key;
  }

  @Override
  public Map<String, String> findAll(String userId) {
    final List<String> keys = scanKeys(userPattern(userId));
    if (keys.isEmpty()) {
      return Map.of();
    }
    final List<String> values = redisTemplate.opsForValue().multiGet(keys);
    if (values == null) {
      return Map.of();
    }
    final Map<String, String> present = new LinkedHashMap<>();
    for (int i = 0; i < keys.size() && i < values.size(); i++) {
      // 取得までに TTL 切れしたキーは null になる
      if (values.get(i) != null) {
        present.put(keys.get(i), values.get(i));
      }
    }
    return present;
  }

  @Override
  public long count(String userId) {
    return scanKeys(userPattern(userId)).size();
  }

  @Override
  public void delete(Collection<String> keys) {
    if (!keys.isEmpty()) {
      redisTemplate.delete(keys);
    }
  }

  @Override
  public Set<String> findUserIdsWithHeldNotifications() {
    final Set<String> userIds = new LinkedHashSet<>();
    for (String key : scanKeys(KEY_PREFIX + "*")) {
      final String rest = key.substring(KEY_PREFIX.length());
      final int separator = rest.lastIndexOf(':');
      if (separator > 0) {
        userIds.add(rest.substring(0, separator));
      }
    }
    return userIds;
  }

  private List<String> scanKeys(String pattern) {
    final List<String> keys = new ArrayList<>();
    final ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_COUNT).build();
    try (Cursor<String> cursor = redisTemplate.scan(options)) {
      while (cursor.hasNext()) {
        keys.add(cursor.next());
      }
    }
    return keys;
  }

  static String heldKey(String userId, long timestampMillis, String suffix) {
    return KEY_PREFIX + userId + ":" + timestampMillis + "-" + suffix;
  }

  static String userPattern(String userId) {
    return KEY_PREFIX + userId + ":*";
  }
}
