package com.devos.notification.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisInteractionDedupRepository implements InteractionDedupRepository {

  private static final String KEY_PREFIX = "dedup:";
  private static final String SENTINEL = "1";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisInteractionDedupRepository(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public boolean exists(String interactionId) {
    return Boolean.TRUE.equals(redisTemplate.hasKey(dedupKey(interactionId)));
  }

  @Override
  public void markSeen(String interactionId, Duration ttl) {
    redisTemplate.opsForValue().set(dedupKey(interactionId), SENTINEL, ttl);
  }

  @Override
  public boolean markSeenIfAbsent(String interactionId, Duration ttl) {
    return Boolean.TRUE.equals(
        redisTemplate.opsForValue().setIfAbsent(dedupKey(interactionId), SENTINEL, ttl));
  }

  static String dedupKey(String interactionId) {
    return KEY_PREFIX + interactionId;
  }
}
