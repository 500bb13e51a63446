package com.devos.notification.model;

import java.time.Duration;

/**
 * enqueue 時の試行上限とバックオフ基準値。initialDelay は初回実行までの待ち時間。
 */
public record JobOptions(int attempts, Duration backoff, Duration initialDelay) {

  public JobOptions {
    if (attempts < 1) {
      throw new IllegalArgumentException("attempts must be positive: " + attempts);
    }
    initialDelay = initialDelay == null ? Duration.ZERO : initialDelay;
  }
}
