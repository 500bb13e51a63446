package com.devos.notification.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.UUID;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisRateLimitRepository implements RateLimitRepository {

  private static final String KEY_PREFIX = "rate-limit:";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisRateLimitRepository(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public void removeUpTo(String targetId, long cutoffMillis) {
    redisTemplate.opsForZSet().removeRangeByScore(rateLimitKey(targetId), 0, cutoffMillis);
  }

  @Override
  public long count(String targetId) {
    final Long size = redisTemplate.opsForZSet().zCard(rateLimitKey(targetId));
    return size == null ? 0L : size;
  }

  @Override
  public void add(String targetId, long timestampMillis, Duration retention) {
    final String key = rateLimitKey(targetId);
    // 同一ミリ秒の送信が 1 件に潰れないよう member に一意な接尾辞を付ける
    final String member = timestampMillis + "-" + UUID.randomUUID();
    redisTemplate.opsForZSet().add(key, member, timestampMillis);
    redisTemplate.expire(key, retention);
  }

  static String rateLimitKey(String targetId) {
    return KEY_PREFIX + targetId;
  }
}
