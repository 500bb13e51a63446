package com.devos.notification.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.Optional;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisPreferencesCacheRepository implements PreferencesCacheRepository {

  private static final String KEY_PREFIX = "notification-prefs:";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisPreferencesCacheRepository(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public Optional<String> find(String userId, String workspaceId) {
    return Optional.ofNullable(redisTemplate.opsForValue().get(cacheKey(userId, workspaceId)));
  }

  @Override
  public void put(String userId, String workspaceId, String preferencesJson, Duration ttl) {
    redisTemplate.opsForValue().set(cacheKey(userId, workspaceId), preferencesJson, ttl);
  }

  @Override
  public void evict(String userId, String workspaceId) {
    redisTemplate.delete(cacheKey(userId, workspaceId));
  }

  static String cacheKey(String userId, String workspaceId) {
    return KEY_PREFIX + userId + ":" + workspaceId;
  }
}
