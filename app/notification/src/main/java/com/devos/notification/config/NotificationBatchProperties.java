/*
 * どこで: Notification アプリの設定バインド
 * 何を: バッチバッファの TTL と定期 flush 間隔を保持する
 * なぜ: 集約の粒度を環境ごとに調整するため
 */
package com.devos.notification.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.batch")
@Validated
public record NotificationBatchProperties(
    boolean enabled, @NotNull Duration ttl, @NotNull Duration flushInterval) {}
