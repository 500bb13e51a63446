package com.devos.notification.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.devos.notification.MutableClock;
import com.devos.notification.config.NotificationRateLimitProperties;
import com.devos.notification.repository.RateLimitRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

class NotificationRateLimiterTest {

  private static final String TARGET = "discord:hook-1";

  private MutableClock clock;
  private InMemoryRateLimitRepository repository;
  private NotificationRateLimiter rateLimiter;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-17T00:00:00Z"));
    repository = new InMemoryRateLimitRepository();
    rateLimiter =
        new NotificationRateLimiter(
            repository,
            new NotificationRateLimitProperties(Duration.ofSeconds(60), Duration.ofSeconds(120), 30),
            clock);
  }

  @Test
  void rejectsSendOnceLimitIsReachedWithinWindow() {
    for (int i = 0; i < 30; i++) {
      assertThat(rateLimiter.isRateLimited(TARGET, 30)).isFalse();
      rateLimiter.recordSend(TARGET);
      clock.advance(Duration.ofSeconds(1));
    }

    assertThat(rateLimiter.isRateLimited(TARGET, 30)).isTrue();
  }

  @Test
  void acceptsAgainAfterWindowElapses() {
    for (int i = 0; i < 30; i++) {
      rateLimiter.recordSend(TARGET);
    }
    assertThat(rateLimiter.isRateLimited(TARGET, 30)).isTrue();

    clock.advance(Duration.ofSeconds(61));

    assertThat(rateLimiter.isRateLimited(TARGET, 30)).isFalse();
    assertThat(repository.count(TARGET)).isZero();
  }

  @Test
  void targetsAreCountedIndependently() {
    for (int i = 0; i < 2; i++) {
      rateLimiter.recordSend(TARGET);
    }

    assertThat(rateLimiter.isRateLimited(TARGET, 2)).isTrue();
    assertThat(rateLimiter.isRateLimited("slack:hook-9", 2)).isFalse();
  }

  @Test
  void nonPositiveLimitUsesDefault() {
    for (int i = 0; i < 29; i++) {
      rateLimiter.recordSend(TARGET);
    }
    assertThat(rateLimiter.isRateLimited(TARGET, 0)).isFalse();

    rateLimiter.recordSend(TARGET);

    assertThat(rateLimiter.isRateLimited(TARGET, 0)).isTrue();
  }

  @Test
  void checkingAloneDoesNotConsumeCapacity() {
    for (int i = 0; i < 10; i++) {
      assertThat(rateLimiter.isRateLimited(TARGET, 1)).isFalse();
    }
  }

  @Test
  void storeFailureAllowsSend() {
    final NotificationRateLimiter failing =
        new NotificationRateLimiter(
            new FailingRateLimitRepository(),
            new NotificationRateLimitProperties(Duration.ofSeconds(60), Duration.ofSeconds(120), 30),
            clock);

    assertThat(failing.isRateLimited(TARGET, 1)).isFalse();
    failing.recordSend(TARGET);
  }

  static final class InMemoryRateLimitRepository implements RateLimitRepository {

    private final Map<String, List<Long>> sends = new HashMap<>();

    @Override
    public void removeUpTo(String targetId, long cutoffMillis) {
      sends.getOrDefault(targetId, new ArrayList<>()).removeIf(ts -> ts <= cutoffMillis);
    }

    @Override
    public long count(String targetId) {
      return sends.getOrDefault(targetId, List.of()).size();
    }

    @Override
    public void add(String targetId, long timestampMillis, Duration retention) {
      sends.computeIfAbsent(targetId, ignored -> new ArrayList<>()).add(timestampMillis);
    }
  }

  static final class FailingRateLimitRepository implements RateLimitRepository {

    @Override
    public void removeUpTo(String targetId, long cutoffMillis) {
      throw new RedisConnectionFailureException("redis down");
    }

    @Override
    public long count(String targetId) {
      throw new RedisConnectionFailureException("redis down");
    }

    @Override
    public void add(String targetId, long timestampMillis, Duration retention) {
      throw new RedisConnectionFailureException("redis down");
    }
  }
}
