package com.devos.notification.repository;

import java.time.Duration;

public interface InteractionDedupRepository {

  boolean exists(String interactionId);

  void markSeen(String interactionId, Duration ttl);

  /** 未登録なら登録して true、既に存在すれば false。 */
  boolean markSeenIfAbsent(String interactionId, Duration ttl);
}
