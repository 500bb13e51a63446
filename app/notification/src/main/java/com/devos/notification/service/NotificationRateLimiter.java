/*
 * どこで: Notification サービス層
 * 何を: 送信先 (webhook 等) ごとのスライディングウィンドウでの送信数上限を判定/記録する
 * なぜ: 外部プロバイダのレート制限に達する前に送信を止めるため
 */
package com.devos.notification.service;

import com.devos.notification.config.NotificationRateLimitProperties;
import com.devos.notification.repository.RateLimitRepository;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRateLimiter {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRateLimiter.class);

  private final RateLimitRepository rateLimitRepository;
  private final NotificationRateLimitProperties properties;
  private final Clock clock;

  /**
   * 窓より古い記録を削除してから数え、limitPerMinute 以上なら true。critical でも例外なく適用する。
   * ストアに到達できない場合は送信を止めない。
   */
  public boolean isRateLimited(String targetId, int limitPerMinute) {
    final int limit = limitPerMinute > 0 ? limitPerMinute : properties.defaultLimitPerMinute();
    final long now = clock.millis();
    try {
      rateLimitRepository.removeUpTo(targetId, now - properties.window().toMillis());
      final long count = rateLimitRepository.count(targetId);
      return count >= limit;
    } catch (RuntimeException ex) {
      logger.warn("rate limit check failed targetId={}; allowing send", targetId, ex);
      return false;
    }
  }

  /** 送信成功後にだけ呼ぶ。 */
  public void recordSend(String targetId) {
    try {
      rateLimitRepository.add(targetId, clock.millis(), properties.retention());
    } catch (RuntimeException ex) {
      logger.warn("failed to record send for rate limit targetId={}", targetId, ex);
    }
  }
}
