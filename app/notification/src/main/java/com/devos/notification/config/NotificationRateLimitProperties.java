/*
 * どこで: Notification アプリの設定バインド
 * 何を: 送信先ごとのスライディングウィンドウ設定を保持する
 * なぜ: 外部 webhook の上限に合わせて窓と既定値を外部化するため
 */
package com.devos.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.rate-limit")
@Validated
public record NotificationRateLimitProperties(
    @NotNull Duration window, @NotNull Duration retention, @Positive int defaultLimitPerMinute) {

  @AssertTrue(message = "notification.rate-limit.retention must not be shorter than window")
  public boolean isRetentionCoveringWindow() {
    // null は @NotNull で検出する前提。
    return window == null || retention == null || retention.compareTo(window) >= 0;
  }
}
