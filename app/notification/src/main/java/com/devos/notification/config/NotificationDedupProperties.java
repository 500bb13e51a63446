package com.devos.notification.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.dedup")
@Validated
public record NotificationDedupProperties(@NotNull Duration ttl) {}
