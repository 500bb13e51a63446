package com.devos.notification.repository;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/** 受信者ごとのバッチバッファ。要素は BatchedNotification の JSON。 */
public interface BatchQueueRepository {

  /** 末尾に追加し、バッファ全体の TTL を ttl へ延長する。 */
  void append(String userId, String notificationJson, Duration ttl);

  /** バッファを読み取りと同時に削除する。存在しなければ空リスト。 */
  List<String> drain(String userId);

  long size(String userId);

  Set<String> findUserIdsWithPendingBatches();
}
