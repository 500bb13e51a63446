package com.devos.notification.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** quiet hours 保留キューの保持期間と flush 間隔。 */
@ConfigurationProperties(prefix = "notification.quiet-hours")
@Validated
public record NotificationQuietHoursProperties(
    boolean enabled, @NotNull Duration retention, @NotNull Duration flushInterval) {}
