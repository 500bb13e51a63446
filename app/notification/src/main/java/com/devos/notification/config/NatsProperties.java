/*
 * どこで: Notification アプリの設定バインド
 * 何を: NATS 接続先と再接続ポリシーをプロパティから読み込む
 * なぜ: 常駐 Subscriber がブローカ再起動後も購読を続けられるようにするため
 */
package com.devos.notification.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled,
    @NotBlank String url,
    @NotNull Duration connectionTimeout,
    @NotNull Duration reconnectWait,
    int maxReconnects) {}
