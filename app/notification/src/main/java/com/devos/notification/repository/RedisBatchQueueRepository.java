package com.devos.notification.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

@Repository
public class RedisBatchQueueRepository implements BatchQueueRepository {

  private static final String KEY_PREFIX = "batch:";
  private static final long SCAN_COUNT = 100L;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  @SuppressWarnings("rawtypes")
  private final RedisScript<List> batchDrainScript;

  public RedisBatchQueueRepository(
      StringRedisTemplate redisTemplate, @SuppressWarnings("rawtypes") RedisScript<List> batchDrainScript) {
    this.redisTemplate = redisTemplate;
    this.batchDrainScript = batchDrainScript;
  }

  @Override
  public void append(String userId, String notificationJson, Duration ttl) {
    final String key = batchKey(userId);
    redisTemplate.opsForList().rightPush(key, notificationJson);
    redisTemplate.expire(key, ttl);
  }

  @Override
  public List<String> drain(String userId) {
    final List<?> raw = redisTemplate.execute(batchDrainScript, List.of(batchKey(userId)));
    if (raw == null || raw.isEmpty()) {
      return List.of();
    }
    final List<String> items = new ArrayList<>(raw.size());
    for (Object value : raw) {
      if (value != null) {
        items.add(String.valueOf(value));
      }
    }
    return items;
  }

  @Override
  public long size(String userId) {
    final Long size = redisTemplate.opsForList().size(batchKey(userId));
    return size == null ? 0L : size;
  }

  @Override
  public Set<String> findUserIdsWithPendingBatches() {
    final Set<String> userIds = new LinkedHashSet<>();
    final ScanOptions options = ScanOptions.scanOptions().match(KEY_PREFIX + "*").count(SCAN_COUNT).build();
    try (Cursor<String> cursor = redisTemplate.scan(options)) {
      while (cursor.hasNext()) {
        userIds.add(cursor.next().substring(KEY_PREFIX.length()));
      }
    }
    return userIds;
  }

  static String batchKey(String userId) {
    return KEY_PREFIX + userId;
  }
}
