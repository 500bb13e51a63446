/*
 * どこで: Notification アプリの設定バインド
 * 何を: チャット webhook アダプタの有効/無効、呼び出し順、タイムアウトを保持する
 * なぜ: アダプタの呼び出し順を設定で固定し、テスト可能にするため
 */
package com.devos.notification.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.chat")
@Validated
public record NotificationChatProperties(
    List<String> order, Duration timeout, @NotNull Provider discord, @NotNull Provider slack) {

  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  public NotificationChatProperties {
    order = order == null || order.isEmpty() ? List.of("discord", "slack") : List.copyOf(order);
    timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
    discord = discord == null ? new Provider(false) : discord;
    slack = slack == null ? new Provider(false) : slack;
  }

  public record Provider(boolean enabled) {}
}
