/*
 * どこで: Notification サービス層
 * 何を: 受信した webhook インタラクション (ボタン押下、スラッシュコマンド) の重複を検出する
 * なぜ: プロバイダの再送で同じ操作が二重に処理されないようにするため
 */
package com.devos.notification.service;

import com.devos.notification.config.NotificationDedupProperties;
import com.devos.notification.repository.InteractionDedupRepository;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class InteractionDeduplicator {

  private static final Logger logger = LoggerFactory.getLogger(InteractionDeduplicator.class);
  private static final long COARSE_WINDOW_SECONDS = 60L;

  private final InteractionDedupRepository dedupRepository;
  private final NotificationDedupProperties properties;
  private final NotificationMetrics metrics;

  public boolean isDuplicate(String interactionId) {
    try {
      return dedupRepository.exists(interactionId);
    } catch (RuntimeException ex) {
      logger.warn("dedup lookup failed interactionId={}; treating as new", interactionId, ex);
      return false;
    }
  }

  public void markSeen(String interactionId) {
    try {
      dedupRepository.markSeen(interactionId, properties.ttl());
    } catch (RuntimeException ex) {
      logger.warn("failed to mark interaction as seen interactionId={}", interactionId, ex);
    }
  }

  /**
   * 初回のみ handler を実行する。判定と登録は SET NX の 1 操作で行う。
   *
   * @return handler を実行した場合 true、重複として捨てた場合 false
   */
  public boolean handleOnce(String interactionId, Runnable handler) {
    boolean firstSeen;
    try {
      firstSeen = dedupRepository.markSeenIfAbsent(interactionId, properties.ttl());
    } catch (RuntimeException ex) {
      logger.warn("dedup store unavailable interactionId={}; handling anyway", interactionId, ex);
      firstSeen = true;
    }
    if (!firstSeen) {
      metrics.recordDuplicateInteraction();
      logger.info("duplicate interaction ignored interactionId={}", interactionId);
      return false;
    }
    handler.run();
    return true;
  }

  /**
   * プロバイダ由来の ID (trigger_id / callback_id) があればそれを使い、無ければ
   * workspace:user:action:分単位の時刻 で合成する。
   */
  public String resolveInteractionId(
      String providerInteractionId, String workspaceId, String userId, String action, Instant at) {
    if (providerInteractionId != null && !providerInteractionId.isBlank()) {
      return providerInteractionId;
    }
    final long bucket = at.getEpochSecond() / COARSE_WINDOW_SECONDS;
    return workspaceId + ":" + userId + ":" + action + ":" + bucket;
  }
}
