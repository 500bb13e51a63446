package com.devos.notification.repository;

import java.time.Duration;

/** 送信先ごとの送信時刻集合 (スライディングウィンドウ) を扱うプリミティブ操作。 */
public interface RateLimitRepository {

  /** cutoffMillis 以下のスコアを持つエントリを削除する。 */
  void removeUpTo(String targetId, long cutoffMillis);

  long count(String targetId);

  /** 送信時刻を 1 件追加し、集合の保持期間を retention へ延長する。 */
  void add(String targetId, long timestampMillis, Duration retention);
}
