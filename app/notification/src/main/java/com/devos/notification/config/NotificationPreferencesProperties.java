package com.devos.notification.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.preferences")
@Validated
public record NotificationPreferencesProperties(@NotNull Duration cacheTtl) {}
