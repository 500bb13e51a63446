package com.devos.notification.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.push")
public record NotificationPushProperties(boolean enabled) {}
