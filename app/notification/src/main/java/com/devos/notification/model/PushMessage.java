package com.devos.notification.model;

import java.util.Map;

public record PushMessage(
    String title, String body, String type, Map<String, Object> data, NotificationUrgency urgency) {}
